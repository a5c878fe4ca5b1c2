package com.lexbridge.backend.store;

import com.lexbridge.backend.models.Case;
import com.lexbridge.backend.models.CaseStatus;

import java.util.List;
import java.util.Optional;

public interface CaseStore {

    Case create(Case legalCase);

    Optional<Case> findById(String id);

    Optional<Case> findByConversationId(String conversationId);

    List<Case> findByClientId(String clientId);

    List<Case> findByAdvocateId(String advocateId);

    /**
     * Writes {@code legalCase} only if the stored status still equals
     * {@code expectedStatus}.
     *
     * @return false when the stored case moved on in the meantime
     */
    boolean replaceIfStatus(Case legalCase, CaseStatus expectedStatus);
}
