package com.lexbridge.backend.service;

import com.lexbridge.backend.models.Case;
import com.lexbridge.backend.models.CaseRequest;
import com.lexbridge.backend.models.Message;

import java.util.List;

/**
 * What an advocate sees when opening a request: the request, the case behind
 * it and the interview that produced the case profile.
 */
public record CaseRequestDetail(CaseRequest request, Case legalCase, List<Message> messages) {

    public CaseRequestDetail {
        messages = List.copyOf(messages);
    }
}
