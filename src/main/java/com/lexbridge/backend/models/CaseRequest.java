package com.lexbridge.backend.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * An offer of one case to one advocate. Score and reasons are captured when
 * the offer is made and never recomputed.
 */
@Builder(toBuilder = true)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "caseRequests")
public class CaseRequest {
    @Id
    private String id;
    private String caseId;
    private String advocateId;
    private String clientId;
    private double matchScore;
    private List<String> matchReasons;
    private RequestStatus status;
    private Instant createdAt;
    private Instant respondedAt;
    private String rejectionReason;
}
