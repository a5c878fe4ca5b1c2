package com.lexbridge.backend.service;

import com.lexbridge.backend.models.Message;

/**
 * Outcome of one client message.
 *
 * @param reply                    the assistant's answer, null when the message was relayed to an advocate
 * @param caseId                   the conversation's case, null while no case is open
 * @param profileUpdated           whether the turn changed the case profile
 * @param recommendationsAvailable whether the case profile is complete enough to rank advocates
 */
public record ClientTurn(Message clientMessage,
                         Message reply,
                         String caseId,
                         boolean profileUpdated,
                         boolean recommendationsAvailable) {
}
