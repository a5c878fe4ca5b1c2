package com.lexbridge.backend.controller;

import com.lexbridge.backend.exception.ConflictException;
import com.lexbridge.backend.exception.ConflictReason;
import com.lexbridge.backend.exception.NotFoundException;
import com.lexbridge.backend.models.CaseRequest;
import com.lexbridge.backend.models.RequestStatus;
import com.lexbridge.backend.service.CaseLifecycleManager;
import com.lexbridge.backend.service.ConversationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ClientControllerTest {

    private ConversationService conversationService;
    private CaseLifecycleManager lifecycleManager;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        conversationService = mock(ConversationService.class);
        lifecycleManager = mock(CaseLifecycleManager.class);
        mvc = MockMvcBuilders.standaloneSetup(new ClientController(conversationService, lifecycleManager))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void selectAdvocate_shouldReturnCreatedRequest() throws Exception {
        when(lifecycleManager.selectAdvocate("case-1", "client-1", "adv-1")).thenReturn(CaseRequest.builder()
                .id("req-1")
                .caseId("case-1")
                .advocateId("adv-1")
                .matchScore(74.0)
                .matchReasons(List.of("Specializes in civil"))
                .status(RequestStatus.PENDING)
                .build());

        mvc.perform(post("/client/cases/case-1/select-advocate")
                        .header(AbstractController.USER_HEADER, "client-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"advocateId\":\"adv-1\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("req-1"))
                .andExpect(jsonPath("$.matchScore").value(74.0));
    }

    @Test
    void selectAdvocate_shouldMapConflictWithReason() throws Exception {
        when(lifecycleManager.selectAdvocate("case-1", "client-1", "adv-1"))
                .thenThrow(new ConflictException(ConflictReason.REQUEST_ALREADY_PENDING, "Case case-1 already has a pending request"));

        mvc.perform(post("/client/cases/case-1/select-advocate")
                        .header(AbstractController.USER_HEADER, "client-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"advocateId\":\"adv-1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("conflict"))
                .andExpect(jsonPath("$.reason").value("REQUEST_ALREADY_PENDING"));
    }

    @Test
    void selectAdvocate_shouldRejectMissingAdvocateId() throws Exception {
        mvc.perform(post("/client/cases/case-1/select-advocate")
                        .header(AbstractController.USER_HEADER, "client-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_failed"));
        verifyNoInteractions(lifecycleManager);
    }

    @Test
    void getCase_shouldMapNotFound() throws Exception {
        when(lifecycleManager.getCase(anyString(), anyString())).thenThrow(NotFoundException.caseNotFound("case-9"));

        mvc.perform(get("/client/cases/case-9").header(AbstractController.USER_HEADER, "client-1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"))
                .andExpect(jsonPath("$.reason").doesNotExist());
    }

    @Test
    void requests_shouldFail_whenUserHeaderMissing() throws Exception {
        mvc.perform(get("/client/cases"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("X-User-Id header is required"));
        verifyNoInteractions(lifecycleManager);
    }

    @Test
    void advancePhase_shouldRejectUnknownPhase() throws Exception {
        mvc.perform(post("/client/conversations/conv-1/phase")
                        .header(AbstractController.USER_HEADER, "client-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"phase\":\"ai_dreaming\"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(conversationService);
    }
}
