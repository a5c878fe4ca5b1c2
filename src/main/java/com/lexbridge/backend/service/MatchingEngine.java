package com.lexbridge.backend.service;

import com.lexbridge.backend.models.AdvocateCapability;
import com.lexbridge.backend.models.CaseProfile;
import com.lexbridge.backend.models.Complexity;
import com.lexbridge.backend.models.CourtLevel;
import com.lexbridge.backend.models.FeeTier;
import com.lexbridge.backend.models.Urgency;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Ranks advocates against a case profile. Pure: no storage access and no side
 * effects, so it can be called for previews before a case exists.
 *
 * <p>Scoring is a pair of hard filters followed by additive clauses:
 * specialization (30), geography (25), experience (15 plus senior counsel and
 * High Court bonuses), availability (10, may go negative for urgent matters),
 * fee alignment (10), language (5), rating (5) and success rate (3). The sum is
 * capped at 100.
 */
@Component
public class MatchingEngine {

    public static final int DEFAULT_LIMIT = 5;

    private static final int SENIOR_COUNSEL_YEARS = 15;
    private static final int LANDMARK_CASE_THRESHOLD = 5;

    private static final Comparator<AdvocateMatch> RANKING =
            Comparator.comparingDouble(AdvocateMatch::matchScore).reversed()
                    .thenComparing(Comparator.comparingDouble((AdvocateMatch m) -> m.advocate().getRating()).reversed())
                    .thenComparing(Comparator.comparingInt((AdvocateMatch m) -> m.advocate().getReviewCount()).reversed())
                    .thenComparing(AdvocateMatch::advocateId, Comparator.nullsLast(Comparator.naturalOrder()));

    public MatchResult score(AdvocateCapability advocate, CaseProfile profile) {
        String state = blankToNull(profile.getState());
        List<String> advocateStates = nullToEmpty(advocate.getStates());

        // Hard filters
        if (state != null && !advocateStates.isEmpty() && !advocateStates.contains(state)) {
            return MatchResult.rejected("Not available in " + state);
        }
        if (!advocate.isAvailable()) {
            return MatchResult.rejected("Currently not accepting new cases");
        }

        List<String> reasons = new ArrayList<>();
        double score = 0.0;
        score += specialization(advocate, profile, reasons);
        score += geography(advocate, profile, state, reasons);
        score += experience(advocate, profile, reasons);
        score += availability(advocate, profile, reasons);
        score += feeAlignment(advocate, profile, reasons);
        score += language(advocate, profile, reasons);
        score += rating(advocate, reasons);
        score += successRate(advocate, reasons);

        return new MatchResult(Math.min(100.0, score), reasons);
    }

    public List<AdvocateMatch> recommend(CaseProfile profile, Map<String, AdvocateCapability> directory) {
        return recommend(profile, directory.values(), DEFAULT_LIMIT);
    }

    public List<AdvocateMatch> recommend(CaseProfile profile, Map<String, AdvocateCapability> directory, int limit) {
        return recommend(profile, directory.values(), limit);
    }

    public List<AdvocateMatch> recommend(CaseProfile profile, Collection<AdvocateCapability> advocates, int limit) {
        List<AdvocateMatch> matches = new ArrayList<>();
        for (AdvocateCapability advocate : advocates) {
            MatchResult result = score(advocate, profile);
            if (result.score() > 0) {
                matches.add(new AdvocateMatch(advocate, roundToTenth(result.score()), result.reasons(),
                        availabilityLabel(advocate)));
            }
        }
        matches.sort(RANKING);
        return matches.size() <= limit ? matches : new ArrayList<>(matches.subList(0, Math.max(0, limit)));
    }

    /** Human-readable capacity: High below half load, Limited from 80%. */
    public static String availabilityLabel(AdvocateCapability advocate) {
        double ratio = advocate.workloadRatio();
        if (ratio < 0.5) {
            return "High";
        } else if (ratio < 0.8) {
            return "Moderate";
        }
        return "Limited";
    }

    // --- Clauses ---

    private double specialization(AdvocateCapability advocate, CaseProfile profile, List<String> reasons) {
        List<String> subSpecializations = nullToEmpty(advocate.getSubSpecializations());
        List<String> expertise = nullToEmpty(profile.getSpecificExpertise());

        if (profile.getMatterType() != null
                && nullToEmpty(advocate.getSpecializations()).contains(profile.getMatterType())) {
            double points = 20;
            reasons.add("Specializes in " + profile.getMatterType().getValue() + " matters");

            String expert = firstExpertiseOverlap(expertise, subSpecializations);
            if (expert != null) {
                points += 5;
                reasons.add("Expert in " + expert);
            }

            String subCategory = blankToNull(profile.getSubCategory());
            if (subCategory != null) {
                String wanted = subCategory.toLowerCase(Locale.ROOT);
                for (String sub : subSpecializations) {
                    if (sub == null || sub.isBlank()) {
                        continue;
                    }
                    String offered = sub.toLowerCase(Locale.ROOT);
                    if (offered.contains(wanted) || wanted.contains(offered)) {
                        points += 5;
                        reasons.add("Handles " + subCategory + " cases regularly");
                        break;
                    }
                }
            }
            return points;
        }

        String related = firstExpertiseOverlap(expertise, subSpecializations);
        if (related != null) {
            reasons.add("Has experience with " + related);
            return 10;
        }
        return 0;
    }

    private double geography(AdvocateCapability advocate, CaseProfile profile, String state, List<String> reasons) {
        double points = 0;
        if (state != null && nullToEmpty(advocate.getStates()).contains(state)) {
            points += 10;
            reasons.add("Practices in " + state);
        }
        String district = blankToNull(profile.getDistrict());
        if (district != null && nullToEmpty(advocate.getDistricts()).contains(district)) {
            points += 10;
            reasons.add("Familiar with " + district + " courts");
        }
        String homeCourt = advocate.getHomeCourt();
        if (profile.getCourtLevel() == CourtLevel.HIGH_COURT && state != null && homeCourt != null
                && homeCourt.toLowerCase(Locale.ROOT).contains(state.toLowerCase(Locale.ROOT))) {
            points += 5;
            reasons.add("Home court is " + homeCourt);
        }
        return points;
    }

    private double experience(AdvocateCapability advocate, CaseProfile profile, List<String> reasons) {
        Complexity complexity = profile.getComplexity() != null ? profile.getComplexity() : Complexity.MODERATE;
        int minimumYears = complexity.getMinimumYearsOfPractice();
        int years = Math.max(0, advocate.getYearsOfPractice());

        double points;
        if (years >= minimumYears) {
            points = Math.min(15.0, 8 + 0.5 * (years - minimumYears));
        } else {
            points = 5;
        }
        reasons.add(years + " years of practice");

        if (Boolean.TRUE.equals(profile.getSeniorCounselRequired()) && years >= SENIOR_COUNSEL_YEARS) {
            points += 5;
            reasons.add("Senior counsel with " + years + " years at the bar");
        }
        if (profile.getCourtLevel() == CourtLevel.HIGH_COURT
                && advocate.getLandmarkCaseCount() > LANDMARK_CASE_THRESHOLD) {
            points += 3;
            reasons.add("Experience with High Court matters");
        }
        return points;
    }

    // Strict "<" at every boundary: a ratio of exactly 0.7 earns 4 points, not 7.
    private double availability(AdvocateCapability advocate, CaseProfile profile, List<String> reasons) {
        double ratio = advocate.workloadRatio();
        if (ratio < 0.5) {
            reasons.add("Excellent availability");
            return 10;
        } else if (ratio < 0.7) {
            reasons.add("Good availability");
            return 7;
        } else if (ratio < 0.9) {
            reasons.add("Moderate availability");
            return 4;
        }
        reasons.add("Limited availability");
        return profile.getUrgency() == Urgency.URGENT ? 2 - 5 : 2;
    }

    private double feeAlignment(AdvocateCapability advocate, CaseProfile profile, List<String> reasons) {
        FeeTier budget = profile.getBudgetTier() != null ? profile.getBudgetTier() : FeeTier.STANDARD;
        FeeTier advocateTier = advocate.getFeeTier() != null ? advocate.getFeeTier() : FeeTier.STANDARD;

        if (budget.acceptableAdvocateTiers().contains(advocateTier)) {
            if (advocateTier == budget) {
                reasons.add("Fee structure matches budget (" + advocateTier.getValue() + ")");
                return 10;
            }
            reasons.add("Fee structure compatible (" + advocateTier.getValue() + ")");
            return 6;
        }
        reasons.add("Fee structure above budget (" + advocateTier.getValue() + ")");
        return 2;
    }

    private double language(AdvocateCapability advocate, CaseProfile profile, List<String> reasons) {
        Set<String> spoken = new LinkedHashSet<>();
        for (String language : nullToEmpty(advocate.getLanguages())) {
            if (language != null) {
                spoken.add(language.toLowerCase(Locale.ROOT));
            }
        }
        Set<String> shared = new LinkedHashSet<>();
        for (String language : nullToEmpty(profile.getPreferredLanguages())) {
            if (language != null && spoken.contains(language.toLowerCase(Locale.ROOT))) {
                shared.add(language);
            }
        }
        if (shared.isEmpty()) {
            return 0;
        }
        reasons.add("Speaks " + String.join(", ", shared));
        return Math.min(5, 2 * shared.size());
    }

    private double rating(AdvocateCapability advocate, List<String> reasons) {
        double rating = advocate.getRating();
        if (rating >= 4.5) {
            reasons.add("Highly rated (" + rating + "/5, " + advocate.getReviewCount() + " reviews)");
            return 5;
        } else if (rating >= 4.0) {
            reasons.add("Well rated (" + rating + "/5)");
            return 3;
        }
        return 0;
    }

    private double successRate(AdvocateCapability advocate, List<String> reasons) {
        Double rate = advocate.getSuccessRate();
        if (rate == null) {
            return 0;
        }
        if (rate >= 80) {
            reasons.add("Excellent success rate");
            return 3;
        } else if (rate >= 60) {
            reasons.add("Good success rate");
            return 1;
        }
        return 0;
    }

    // --- Helpers ---

    /** First requested tag, in request order, contained in any sub-specialization. */
    private static String firstExpertiseOverlap(List<String> expertise, List<String> subSpecializations) {
        for (String tag : expertise) {
            if (tag == null || tag.isBlank()) {
                continue;
            }
            String needle = tag.toLowerCase(Locale.ROOT);
            for (String sub : subSpecializations) {
                if (sub != null && sub.toLowerCase(Locale.ROOT).contains(needle)) {
                    return tag;
                }
            }
        }
        return null;
    }

    private static double roundToTenth(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list != null ? list : List.of();
    }
}
