package com.lexbridge.backend.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;

/**
 * Structured facts describing a case. Every field is optional: a case starts
 * with a partial profile that fills in as the interview goes on.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CaseProfile {

    public static final CaseProfile EMPTY = CaseProfile.builder().build();

    MatterType matterType;
    String subCategory;
    String state;
    String district;
    CourtLevel courtLevel;
    Complexity complexity;
    Urgency urgency;
    BigDecimal amountInDispute;
    List<String> preferredLanguages;
    FeeTier budgetTier;
    Boolean seniorCounselRequired;
    List<String> specificExpertise;
    String summary;

    /**
     * Returns a copy with every field present in {@code fragment} applied.
     * Absent fields (null, blank text, empty lists) never clear a value.
     */
    public CaseProfile mergedWith(CaseProfile fragment) {
        if (fragment == null) {
            return this;
        }
        return CaseProfile.builder()
                .matterType(pick(fragment.matterType, matterType))
                .subCategory(pickText(fragment.subCategory, subCategory))
                .state(pickText(fragment.state, state))
                .district(pickText(fragment.district, district))
                .courtLevel(pick(fragment.courtLevel, courtLevel))
                .complexity(pick(fragment.complexity, complexity))
                .urgency(pick(fragment.urgency, urgency))
                .amountInDispute(pick(fragment.amountInDispute, amountInDispute))
                .preferredLanguages(pickList(fragment.preferredLanguages, preferredLanguages))
                .budgetTier(pick(fragment.budgetTier, budgetTier))
                .seniorCounselRequired(pick(fragment.seniorCounselRequired, seniorCounselRequired))
                .specificExpertise(pickList(fragment.specificExpertise, specificExpertise))
                .summary(pickText(fragment.summary, summary))
                .build();
    }

    /** Matter type and filing state are the minimum needed to rank advocates. */
    @JsonIgnore
    public boolean isScorable() {
        return matterType != null && state != null && !state.isBlank();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return EMPTY.equals(this);
    }

    private static <T> T pick(T incoming, T current) {
        return incoming != null ? incoming : current;
    }

    private static String pickText(String incoming, String current) {
        return incoming != null && !incoming.isBlank() ? incoming.trim() : current;
    }

    private static List<String> pickList(List<String> incoming, List<String> current) {
        return incoming != null && !incoming.isEmpty() ? List.copyOf(incoming) : current;
    }
}
