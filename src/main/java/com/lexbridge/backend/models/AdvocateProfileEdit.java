package com.lexbridge.backend.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;

/**
 * Fields an advocate may set on their own record. Null means "leave as is".
 * Rating, review count, verification, success rate and case load are owned by
 * the platform and have no counterpart here.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class AdvocateProfileEdit {
    String displayName;
    String enrollmentNumber;
    List<String> states;
    List<String> districts;
    String homeCourt;
    List<MatterType> specializations;
    List<String> subSpecializations;
    Integer yearsOfPractice;
    String landmarkCases;
    Integer landmarkCaseCount;
    FeeTier feeTier;
    BigDecimal consultationFee;
    List<String> languages;
    String officeAddress;
    Integer maxCaseLoad;
    Boolean available;
}
