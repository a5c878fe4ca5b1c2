package com.lexbridge.backend.assistant;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexbridge.backend.models.CaseProfile;
import com.lexbridge.backend.models.Complexity;
import com.lexbridge.backend.models.CourtLevel;
import com.lexbridge.backend.models.FeeTier;
import com.lexbridge.backend.models.MatterType;
import com.lexbridge.backend.models.Urgency;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pulls a case profile out of assistant text. Looks for a fenced
 * {@code case_profile} block first, then for a bare JSON object carrying
 * {@code matter_type}. Unknown enum values are dropped rather than rejected.
 */
@Slf4j
@Component
public class CaseProfileParser {

    private static final String FENCE_OPEN = "```case_profile";
    private static final String FENCE_CLOSE = "```";

    private final ObjectMapper mapper;

    public CaseProfileParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Optional<CaseProfile> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String json = fencedBlock(text);
        boolean fenced = json != null;
        if (!fenced) {
            json = bareObject(text);
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            JsonNode node = mapper.readTree(json);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            if (!fenced && !node.has("matter_type")) {
                return Optional.empty();
            }
            CaseProfile profile = toProfile(node);
            return profile.isEmpty() ? Optional.empty() : Optional.of(profile);
        } catch (JsonProcessingException e) {
            log.debug("Assistant reply carried an unreadable case profile: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static String fencedBlock(String text) {
        int start = text.indexOf(FENCE_OPEN);
        if (start < 0) {
            return null;
        }
        start += FENCE_OPEN.length();
        int end = text.indexOf(FENCE_CLOSE, start);
        return end > start ? text.substring(start, end).trim() : null;
    }

    private static String bareObject(String text) {
        if (!text.contains("\"matter_type\"")) {
            return null;
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        return start >= 0 && end > start ? text.substring(start, end + 1) : null;
    }

    private static CaseProfile toProfile(JsonNode node) {
        return CaseProfile.builder()
                .matterType(MatterType.fromValue(text(node, "matter_type")))
                .subCategory(text(node, "sub_category"))
                .state(text(node, "state"))
                .district(text(node, "district"))
                .courtLevel(CourtLevel.fromValue(text(node, "court_level")))
                .complexity(Complexity.fromValue(firstText(node, "complexity", "estimated_complexity")))
                .urgency(Urgency.fromValue(firstText(node, "urgency", "urgency_level")))
                .amountInDispute(decimal(node, "amount_in_dispute"))
                .preferredLanguages(textList(node, "preferred_languages"))
                .budgetTier(FeeTier.fromValue(firstText(node, "budget_tier", "budget_category")))
                .seniorCounselRequired(node.hasNonNull("senior_counsel_required")
                        ? node.get("senior_counsel_required").asBoolean() : null)
                .specificExpertise(textList(node, "specific_expertise"))
                .summary(firstText(node, "summary", "case_summary"))
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() || "...".equals(text) ? null : text;
    }

    private static String firstText(JsonNode node, String field, String alias) {
        String value = text(node, field);
        return value != null ? value : text(node, alias);
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        try {
            return new BigDecimal(value.asText().replace(",", "").trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Accepts a JSON array or a comma-separated string. */
    private static List<String> textList(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        List<String> items = new ArrayList<>();
        if (value.isArray()) {
            value.forEach(item -> addTrimmed(items, item.asText()));
        } else {
            for (String part : value.asText().split(",")) {
                addTrimmed(items, part);
            }
        }
        return items.isEmpty() ? null : items;
    }

    private static void addTrimmed(List<String> items, String raw) {
        if (raw != null && !raw.isBlank()) {
            items.add(raw.trim());
        }
    }
}
