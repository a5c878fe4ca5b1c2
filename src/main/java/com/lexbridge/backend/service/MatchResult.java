package com.lexbridge.backend.service;

import java.util.List;

/**
 * Score of one advocate against one case profile, with one reason per scoring
 * clause that contributed, in clause order.
 */
public record MatchResult(double score, List<String> reasons) {

    public MatchResult {
        reasons = List.copyOf(reasons);
    }

    static MatchResult rejected(String reason) {
        return new MatchResult(0.0, List.of(reason));
    }
}
