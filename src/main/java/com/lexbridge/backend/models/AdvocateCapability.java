package com.lexbridge.backend.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Builder(toBuilder = true)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "advocates")
public class AdvocateCapability {
    @Id
    private String id;
    private String displayName;
    private String enrollmentNumber;
    private List<String> states;
    private List<String> districts;
    private String homeCourt;
    private List<MatterType> specializations;
    private List<String> subSpecializations; // stored order matters for scoring
    private int yearsOfPractice;
    private String landmarkCases;
    private int landmarkCaseCount;
    private Double successRate; // percentage, null when unknown
    private int currentCaseLoad;
    @Builder.Default
    private int maxCaseLoad = 20;
    @Builder.Default
    private FeeTier feeTier = FeeTier.STANDARD;
    private BigDecimal consultationFee;
    private List<String> languages;
    private String officeAddress;
    private double rating;
    private int reviewCount;
    @Builder.Default
    private boolean available = true;
    private boolean verified;
    private Instant updatedAt;

    public double workloadRatio() {
        return maxCaseLoad > 0 ? (double) currentCaseLoad / maxCaseLoad : 0.0;
    }
}
