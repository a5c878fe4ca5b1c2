package com.lexbridge.backend.store.mongo;

import com.lexbridge.backend.models.AdvocateCapability;
import com.lexbridge.backend.models.AdvocateResponse;
import com.lexbridge.backend.models.Case;
import com.lexbridge.backend.models.CaseProfile;
import com.lexbridge.backend.models.CaseRequest;
import com.lexbridge.backend.models.CaseStatus;
import com.lexbridge.backend.models.Complexity;
import com.lexbridge.backend.models.Conversation;
import com.lexbridge.backend.models.ConversationPhase;
import com.lexbridge.backend.models.CourtLevel;
import com.lexbridge.backend.models.FeeTier;
import com.lexbridge.backend.models.MatterType;
import com.lexbridge.backend.models.Message;
import com.lexbridge.backend.models.Notification;
import com.lexbridge.backend.models.NotificationType;
import com.lexbridge.backend.models.RequestStatus;
import com.lexbridge.backend.models.SenderType;
import com.lexbridge.backend.models.Urgency;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entity to BSON mapping. Enums are stored by their wire value, timestamps as
 * BSON dates, references to other entities as plain strings.
 */
final class MongoDocuments {

    private MongoDocuments() {
    }

    // --- Advocates ---

    static Document advocateProfileFields(AdvocateCapability advocate) {
        return new Document("displayName", advocate.getDisplayName())
                .append("enrollmentNumber", advocate.getEnrollmentNumber())
                .append("states", listOrEmpty(advocate.getStates()))
                .append("districts", listOrEmpty(advocate.getDistricts()))
                .append("homeCourt", advocate.getHomeCourt())
                .append("specializations", enumValues(advocate.getSpecializations()))
                .append("subSpecializations", listOrEmpty(advocate.getSubSpecializations()))
                .append("yearsOfPractice", advocate.getYearsOfPractice())
                .append("landmarkCases", advocate.getLandmarkCases())
                .append("landmarkCaseCount", advocate.getLandmarkCaseCount())
                .append("successRate", advocate.getSuccessRate())
                .append("maxCaseLoad", advocate.getMaxCaseLoad())
                .append("feeTier", value(advocate.getFeeTier()))
                .append("consultationFee", decimal(advocate.getConsultationFee()))
                .append("languages", listOrEmpty(advocate.getLanguages()))
                .append("officeAddress", advocate.getOfficeAddress())
                .append("rating", advocate.getRating())
                .append("reviewCount", advocate.getReviewCount())
                .append("available", advocate.isAvailable())
                .append("verified", advocate.isVerified())
                .append("updatedAt", date(advocate.getUpdatedAt()));
    }

    static Document toDocument(AdvocateCapability advocate) {
        return advocateProfileFields(advocate)
                .append("currentCaseLoad", advocate.getCurrentCaseLoad());
    }

    static AdvocateCapability toAdvocate(Document doc) {
        List<MatterType> specializations = new ArrayList<>();
        for (String raw : strings(doc, "specializations")) {
            MatterType type = MatterType.fromValue(raw);
            if (type != null) {
                specializations.add(type);
            }
        }
        FeeTier feeTier = FeeTier.fromValue(doc.getString("feeTier"));
        return AdvocateCapability.builder()
                .id(idText(doc.get("_id")))
                .displayName(doc.getString("displayName"))
                .enrollmentNumber(doc.getString("enrollmentNumber"))
                .states(strings(doc, "states"))
                .districts(strings(doc, "districts"))
                .homeCourt(doc.getString("homeCourt"))
                .specializations(specializations)
                .subSpecializations(strings(doc, "subSpecializations"))
                .yearsOfPractice(doc.getInteger("yearsOfPractice", 0))
                .landmarkCases(doc.getString("landmarkCases"))
                .landmarkCaseCount(doc.getInteger("landmarkCaseCount", 0))
                .successRate(doubleOrNull(doc.get("successRate")))
                .currentCaseLoad(doc.getInteger("currentCaseLoad", 0))
                .maxCaseLoad(doc.getInteger("maxCaseLoad", 20))
                .feeTier(feeTier != null ? feeTier : FeeTier.STANDARD)
                .consultationFee(bigDecimal(doc.get("consultationFee")))
                .languages(strings(doc, "languages"))
                .officeAddress(doc.getString("officeAddress"))
                .rating(doubleOrZero(doc.get("rating")))
                .reviewCount(doc.getInteger("reviewCount", 0))
                .available(doc.getBoolean("available", true))
                .verified(doc.getBoolean("verified", false))
                .updatedAt(instant(doc.getDate("updatedAt")))
                .build();
    }

    /** Advocate ids are ObjectIds for seeded records and the account id for self-registered ones. */
    static String idText(Object id) {
        if (id instanceof ObjectId) {
            return ((ObjectId) id).toHexString();
        }
        return id == null ? null : id.toString();
    }

    // --- Case profiles ---

    static Document toDocument(CaseProfile profile) {
        if (profile == null) {
            return null;
        }
        Document doc = new Document();
        putIfPresent(doc, "matterType", value(profile.getMatterType()));
        putIfPresent(doc, "subCategory", profile.getSubCategory());
        putIfPresent(doc, "state", profile.getState());
        putIfPresent(doc, "district", profile.getDistrict());
        putIfPresent(doc, "courtLevel", value(profile.getCourtLevel()));
        putIfPresent(doc, "complexity", value(profile.getComplexity()));
        putIfPresent(doc, "urgency", value(profile.getUrgency()));
        putIfPresent(doc, "amountInDispute", decimal(profile.getAmountInDispute()));
        putIfPresent(doc, "preferredLanguages", profile.getPreferredLanguages());
        putIfPresent(doc, "budgetTier", value(profile.getBudgetTier()));
        putIfPresent(doc, "seniorCounselRequired", profile.getSeniorCounselRequired());
        putIfPresent(doc, "specificExpertise", profile.getSpecificExpertise());
        putIfPresent(doc, "summary", profile.getSummary());
        return doc;
    }

    @SuppressWarnings("unchecked")
    static CaseProfile toProfile(Document doc) {
        if (doc == null) {
            return CaseProfile.EMPTY;
        }
        return CaseProfile.builder()
                .matterType(MatterType.fromValue(doc.getString("matterType")))
                .subCategory(doc.getString("subCategory"))
                .state(doc.getString("state"))
                .district(doc.getString("district"))
                .courtLevel(CourtLevel.fromValue(doc.getString("courtLevel")))
                .complexity(Complexity.fromValue(doc.getString("complexity")))
                .urgency(Urgency.fromValue(doc.getString("urgency")))
                .amountInDispute(bigDecimal(doc.get("amountInDispute")))
                .preferredLanguages((List<String>) doc.get("preferredLanguages"))
                .budgetTier(FeeTier.fromValue(doc.getString("budgetTier")))
                .seniorCounselRequired(doc.getBoolean("seniorCounselRequired"))
                .specificExpertise((List<String>) doc.get("specificExpertise"))
                .summary(doc.getString("summary"))
                .build();
    }

    // --- Cases ---

    static Document toDocument(Case legalCase) {
        return new Document("clientId", legalCase.getClientId())
                .append("advocateId", legalCase.getAdvocateId())
                .append("conversationId", legalCase.getConversationId())
                .append("profile", toDocument(legalCase.getProfile()))
                .append("status", value(legalCase.getStatus()))
                .append("selectedAdvocateId", legalCase.getSelectedAdvocateId())
                .append("advocateResponse", value(legalCase.getAdvocateResponse()))
                .append("rejectionReason", legalCase.getRejectionReason())
                .append("createdAt", date(legalCase.getCreatedAt()))
                .append("updatedAt", date(legalCase.getUpdatedAt()));
    }

    static Case toCase(Document doc) {
        return Case.builder()
                .id(doc.getObjectId("_id").toHexString())
                .clientId(doc.getString("clientId"))
                .advocateId(doc.getString("advocateId"))
                .conversationId(doc.getString("conversationId"))
                .profile(toProfile(doc.get("profile", Document.class)))
                .status(CaseStatus.fromValue(doc.getString("status")))
                .selectedAdvocateId(doc.getString("selectedAdvocateId"))
                .advocateResponse(AdvocateResponse.fromValue(doc.getString("advocateResponse")))
                .rejectionReason(doc.getString("rejectionReason"))
                .createdAt(instant(doc.getDate("createdAt")))
                .updatedAt(instant(doc.getDate("updatedAt")))
                .build();
    }

    // --- Case requests ---

    static Document toDocument(CaseRequest request) {
        return new Document("caseId", request.getCaseId())
                .append("advocateId", request.getAdvocateId())
                .append("clientId", request.getClientId())
                .append("matchScore", request.getMatchScore())
                .append("matchReasons", listOrEmpty(request.getMatchReasons()))
                .append("status", value(request.getStatus()))
                .append("createdAt", date(request.getCreatedAt()))
                .append("respondedAt", date(request.getRespondedAt()))
                .append("rejectionReason", request.getRejectionReason());
    }

    static CaseRequest toCaseRequest(Document doc) {
        return CaseRequest.builder()
                .id(doc.getObjectId("_id").toHexString())
                .caseId(doc.getString("caseId"))
                .advocateId(doc.getString("advocateId"))
                .clientId(doc.getString("clientId"))
                .matchScore(doubleOrZero(doc.get("matchScore")))
                .matchReasons(strings(doc, "matchReasons"))
                .status(RequestStatus.fromValue(doc.getString("status")))
                .createdAt(instant(doc.getDate("createdAt")))
                .respondedAt(instant(doc.getDate("respondedAt")))
                .rejectionReason(doc.getString("rejectionReason"))
                .build();
    }

    // --- Conversations and messages ---

    static Document toDocument(Conversation conversation) {
        return new Document("clientId", conversation.getClientId())
                .append("caseId", conversation.getCaseId())
                .append("phase", value(conversation.getPhase()))
                .append("assistantSessionToken", conversation.getAssistantSessionToken())
                .append("createdAt", date(conversation.getCreatedAt()))
                .append("updatedAt", date(conversation.getUpdatedAt()));
    }

    static Conversation toConversation(Document doc) {
        return Conversation.builder()
                .id(doc.getObjectId("_id").toHexString())
                .clientId(doc.getString("clientId"))
                .caseId(doc.getString("caseId"))
                .phase(ConversationPhase.fromValue(doc.getString("phase")))
                .assistantSessionToken(doc.getString("assistantSessionToken"))
                .createdAt(instant(doc.getDate("createdAt")))
                .updatedAt(instant(doc.getDate("updatedAt")))
                .build();
    }

    static Document toDocument(Message message) {
        return new Document("conversationId", message.getConversationId())
                .append("senderType", value(message.getSenderType()))
                .append("senderId", message.getSenderId())
                .append("content", message.getContent())
                .append("createdAt", date(message.getCreatedAt()));
    }

    static Message toMessage(Document doc) {
        return Message.builder()
                .id(doc.getObjectId("_id").toHexString())
                .conversationId(doc.getString("conversationId"))
                .senderType(SenderType.fromValue(doc.getString("senderType")))
                .senderId(doc.getString("senderId"))
                .content(doc.getString("content"))
                .createdAt(instant(doc.getDate("createdAt")))
                .build();
    }

    // --- Notifications ---

    static Document toDocument(Notification notification) {
        Map<String, String> data = notification.getData() != null ? notification.getData() : Collections.emptyMap();
        return new Document("recipientId", notification.getRecipientId())
                .append("type", value(notification.getType()))
                .append("title", notification.getTitle())
                .append("message", notification.getMessage())
                .append("data", new Document(new LinkedHashMap<>(data)))
                .append("read", notification.isRead())
                .append("createdAt", date(notification.getCreatedAt()));
    }

    static Notification toNotification(Document doc) {
        Map<String, String> data = new LinkedHashMap<>();
        Document dataDoc = doc.get("data", Document.class);
        if (dataDoc != null) {
            for (Map.Entry<String, Object> entry : dataDoc.entrySet()) {
                data.put(entry.getKey(), entry.getValue() != null ? entry.getValue().toString() : null);
            }
        }
        return Notification.builder()
                .id(doc.getObjectId("_id").toHexString())
                .recipientId(doc.getString("recipientId"))
                .type(NotificationType.fromValue(doc.getString("type")))
                .title(doc.getString("title"))
                .message(doc.getString("message"))
                .data(data)
                .read(doc.getBoolean("read", false))
                .createdAt(instant(doc.getDate("createdAt")))
                .build();
    }

    // --- Helpers ---

    private static void putIfPresent(Document doc, String key, Object value) {
        if (value != null) {
            doc.append(key, value);
        }
    }

    private static String value(MatterType v) {
        return v != null ? v.getValue() : null;
    }

    private static String value(CourtLevel v) {
        return v != null ? v.getValue() : null;
    }

    private static String value(Complexity v) {
        return v != null ? v.getValue() : null;
    }

    private static String value(Urgency v) {
        return v != null ? v.getValue() : null;
    }

    private static String value(FeeTier v) {
        return v != null ? v.getValue() : null;
    }

    private static String value(CaseStatus v) {
        return v != null ? v.getValue() : null;
    }

    private static String value(AdvocateResponse v) {
        return v != null ? v.getValue() : null;
    }

    private static String value(RequestStatus v) {
        return v != null ? v.getValue() : null;
    }

    private static String value(ConversationPhase v) {
        return v != null ? v.getValue() : null;
    }

    private static String value(SenderType v) {
        return v != null ? v.getValue() : null;
    }

    private static String value(NotificationType v) {
        return v != null ? v.getValue() : null;
    }

    private static List<String> enumValues(List<MatterType> types) {
        List<String> values = new ArrayList<>();
        if (types != null) {
            for (MatterType type : types) {
                values.add(type.getValue());
            }
        }
        return values;
    }

    private static <T> List<T> listOrEmpty(List<T> list) {
        return list != null ? list : new ArrayList<>();
    }

    @SuppressWarnings("unchecked")
    private static List<String> strings(Document doc, String key) {
        Object raw = doc.get(key);
        return raw instanceof List ? new ArrayList<>((List<String>) raw) : new ArrayList<>();
    }

    private static Date date(Instant instant) {
        return instant != null ? Date.from(instant) : null;
    }

    private static Instant instant(Date date) {
        return date != null ? date.toInstant() : null;
    }

    private static Decimal128 decimal(BigDecimal value) {
        return value != null ? new Decimal128(value) : null;
    }

    private static BigDecimal bigDecimal(Object raw) {
        if (raw instanceof Decimal128) {
            return ((Decimal128) raw).bigDecimalValue();
        }
        if (raw instanceof Number) {
            return BigDecimal.valueOf(((Number) raw).doubleValue());
        }
        return null;
    }

    private static Double doubleOrNull(Object raw) {
        return raw instanceof Number ? ((Number) raw).doubleValue() : null;
    }

    private static double doubleOrZero(Object raw) {
        return raw instanceof Number ? ((Number) raw).doubleValue() : 0.0;
    }
}
