package com.lexbridge.backend.support;

import com.lexbridge.backend.models.AdvocateCapability;
import com.lexbridge.backend.models.CaseProfile;
import com.lexbridge.backend.models.Complexity;
import com.lexbridge.backend.models.CourtLevel;
import com.lexbridge.backend.models.FeeTier;
import com.lexbridge.backend.models.MatterType;

import java.util.List;

public final class Fixtures {

    private Fixtures() {
    }

    /** The Delhi civil practitioner used throughout the scoring tests. */
    public static AdvocateCapability.AdvocateCapabilityBuilder delhiCivilAdvocate() {
        return AdvocateCapability.builder()
                .displayName("Adv. Rajesh Kumar Sharma")
                .states(List.of("Delhi"))
                .districts(List.of("South Delhi"))
                .homeCourt("Delhi High Court")
                .specializations(List.of(MatterType.CIVIL))
                .subSpecializations(List.of())
                .yearsOfPractice(19)
                .currentCaseLoad(28)
                .maxCaseLoad(40)
                .feeTier(FeeTier.PREMIUM)
                .rating(4.8)
                .reviewCount(156)
                .available(true);
    }

    public static CaseProfile.CaseProfileBuilder delhiCivilProfile() {
        return CaseProfile.builder()
                .matterType(MatterType.CIVIL)
                .state("Delhi")
                .district("South Delhi")
                .courtLevel(CourtLevel.DISTRICT)
                .complexity(Complexity.MODERATE)
                .budgetTier(FeeTier.PREMIUM);
    }
}
