package com.lexbridge.backend.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Builder(toBuilder = true)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "cases")
public class Case {
    @Id
    private String id;
    private String clientId;
    private String advocateId; // set once the case is advocate_assigned or later
    private String conversationId;
    private CaseProfile profile;
    private CaseStatus status;
    private String selectedAdvocateId; // kept after a rejection for audit
    private AdvocateResponse advocateResponse;
    private String rejectionReason;
    private Instant createdAt;
    private Instant updatedAt;
}
