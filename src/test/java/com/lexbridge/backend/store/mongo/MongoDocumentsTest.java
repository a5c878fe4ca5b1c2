package com.lexbridge.backend.store.mongo;

import com.lexbridge.backend.models.AdvocateCapability;
import com.lexbridge.backend.models.Case;
import com.lexbridge.backend.models.CaseProfile;
import com.lexbridge.backend.models.CaseStatus;
import com.lexbridge.backend.models.FeeTier;
import com.lexbridge.backend.models.MatterType;
import com.lexbridge.backend.models.Notification;
import com.lexbridge.backend.models.NotificationType;
import com.lexbridge.backend.support.Fixtures;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MongoDocumentsTest {

    @Test
    void profileDocument_shouldOmitAbsentFieldsAndStoreWireValues() {
        CaseProfile profile = Fixtures.delhiCivilProfile()
                .amountInDispute(new BigDecimal("150000.50"))
                .build();

        Document doc = MongoDocuments.toDocument(profile);

        assertThat(doc.getString("matterType")).isEqualTo("civil");
        assertThat(doc.getString("courtLevel")).isEqualTo("district");
        assertThat(doc.getString("budgetTier")).isEqualTo("premium");
        assertThat(doc.get("amountInDispute")).isEqualTo(new Decimal128(new BigDecimal("150000.50")));
        assertThat(doc).doesNotContainKeys("urgency", "summary", "preferredLanguages");
        assertThat(MongoDocuments.toProfile(doc)).isEqualTo(profile);
    }

    @Test
    void toProfile_shouldReturnEmpty_whenDocumentMissing() {
        assertThat(MongoDocuments.toProfile(null)).isSameAs(CaseProfile.EMPTY);
        assertThat(MongoDocuments.toDocument((CaseProfile) null)).isNull();
    }

    @Test
    void toAdvocate_shouldApplyDefaultsForSparseDocuments() {
        ObjectId id = new ObjectId();
        Document doc = new Document("_id", id)
                .append("displayName", "Adv. Meera Iyer")
                .append("specializations", List.of("criminal", "astrology"))
                .append("rating", 4)
                .append("feeTier", "unknown");

        AdvocateCapability advocate = MongoDocuments.toAdvocate(doc);

        assertThat(advocate.getId()).isEqualTo(id.toHexString());
        assertThat(advocate.getSpecializations()).containsExactly(MatterType.CRIMINAL);
        assertThat(advocate.getFeeTier()).isEqualTo(FeeTier.STANDARD);
        assertThat(advocate.getMaxCaseLoad()).isEqualTo(20);
        assertThat(advocate.isAvailable()).isTrue();
        assertThat(advocate.getRating()).isEqualTo(4.0);
        assertThat(advocate.getSuccessRate()).isNull();
        assertThat(advocate.getStates()).isEmpty();
    }

    @Test
    void toAdvocate_shouldKeepAccountId_forSelfRegisteredAdvocates() {
        Document doc = new Document("_id", "user-42").append("enrollmentNumber", "KA/2345/2008");

        assertThat(MongoDocuments.toAdvocate(doc).getId()).isEqualTo("user-42");
    }

    @Test
    void advocateProfileFields_shouldLeaveCaseLoadOut() {
        AdvocateCapability advocate = Fixtures.delhiCivilAdvocate().build();

        assertThat(MongoDocuments.advocateProfileFields(advocate)).doesNotContainKey("currentCaseLoad");
        assertThat(MongoDocuments.toDocument(advocate)).containsEntry("currentCaseLoad", 28);
    }

    @Test
    void caseDocument_shouldCarryStatusAndEmbeddedProfile() {
        Instant created = Instant.parse("2026-03-01T10:15:30Z");
        Case legalCase = Case.builder()
                .clientId("client-1")
                .conversationId("conv-1")
                .profile(Fixtures.delhiCivilProfile().build())
                .status(CaseStatus.PENDING_ADVOCATE)
                .selectedAdvocateId("adv-1")
                .createdAt(created)
                .updatedAt(created)
                .build();

        Document doc = MongoDocuments.toDocument(legalCase).append("_id", new ObjectId());
        Case restored = MongoDocuments.toCase(doc);

        assertThat(doc.getString("status")).isEqualTo("pending_advocate");
        assertThat(restored.getStatus()).isEqualTo(CaseStatus.PENDING_ADVOCATE);
        assertThat(restored.getProfile()).isEqualTo(legalCase.getProfile());
        assertThat(restored.getCreatedAt()).isEqualTo(created);
        assertThat(restored.getAdvocateId()).isNull();
    }

    @Test
    void notificationDocument_shouldKeepDataAsStrings() {
        Notification notification = Notification.builder()
                .recipientId("adv-1")
                .type(NotificationType.CASE_REQUEST)
                .title("New Case Request")
                .message("A client sent a request")
                .data(Map.of("case_id", "case-1"))
                .build();

        Document doc = MongoDocuments.toDocument(notification).append("_id", new ObjectId());
        Notification restored = MongoDocuments.toNotification(doc);

        assertThat(doc.getString("type")).isEqualTo("case_request");
        assertThat(restored.getData()).containsExactly(Map.entry("case_id", "case-1"));
        assertThat(restored.isRead()).isFalse();
    }
}
