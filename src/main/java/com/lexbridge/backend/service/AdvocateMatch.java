package com.lexbridge.backend.service;

import com.lexbridge.backend.models.AdvocateCapability;

import java.util.List;

/**
 * One ranked recommendation.
 */
public record AdvocateMatch(AdvocateCapability advocate,
                            double matchScore,
                            List<String> matchReasons,
                            String availability) {

    public String advocateId() {
        return advocate.getId();
    }
}
