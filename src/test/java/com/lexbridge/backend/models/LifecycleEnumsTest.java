package com.lexbridge.backend.models;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LifecycleEnumsTest {

    @Nested
    @DisplayName("CaseStatus")
    class CaseStatusTransitions {

        @Test
        void canTransitionTo_shouldFollowLifecycle() {
            assertThat(CaseStatus.AI_CONVERSATION.canTransitionTo(CaseStatus.PENDING_ADVOCATE)).isTrue();
            assertThat(CaseStatus.PENDING_ADVOCATE.canTransitionTo(CaseStatus.ADVOCATE_ASSIGNED)).isTrue();
            assertThat(CaseStatus.PENDING_ADVOCATE.canTransitionTo(CaseStatus.ADVOCATE_REJECTED)).isTrue();
            assertThat(CaseStatus.ADVOCATE_REJECTED.canTransitionTo(CaseStatus.PENDING_ADVOCATE)).isTrue();
            assertThat(CaseStatus.ADVOCATE_ASSIGNED.canTransitionTo(CaseStatus.IN_PROGRESS)).isTrue();
            assertThat(CaseStatus.IN_PROGRESS.canTransitionTo(CaseStatus.COMPLETED)).isTrue();
            assertThat(CaseStatus.COMPLETED.canTransitionTo(CaseStatus.CLOSED)).isTrue();
        }

        @Test
        void canTransitionTo_shouldRejectSkipsAndReversals() {
            assertThat(CaseStatus.AI_CONVERSATION.canTransitionTo(CaseStatus.ADVOCATE_ASSIGNED)).isFalse();
            assertThat(CaseStatus.ADVOCATE_ASSIGNED.canTransitionTo(CaseStatus.PENDING_ADVOCATE)).isFalse();
            assertThat(CaseStatus.IN_PROGRESS.canTransitionTo(CaseStatus.CLOSED)).isFalse();
            assertThat(CaseStatus.CLOSED.successors()).isEmpty();
            assertThat(CaseStatus.COMPLETED.canTransitionTo(null)).isFalse();
        }

        @Test
        void hasAssignedAdvocate_shouldHoldFromAssignmentOnwards() {
            assertThat(CaseStatus.PENDING_ADVOCATE.hasAssignedAdvocate()).isFalse();
            assertThat(CaseStatus.ADVOCATE_REJECTED.hasAssignedAdvocate()).isFalse();
            assertThat(CaseStatus.ADVOCATE_ASSIGNED.hasAssignedAdvocate()).isTrue();
            assertThat(CaseStatus.CLOSED.hasAssignedAdvocate()).isTrue();
        }

        @Test
        void fromValue_shouldReadWireNames() {
            assertThat(CaseStatus.fromValue(" Pending_Advocate ")).isEqualTo(CaseStatus.PENDING_ADVOCATE);
            assertThat(CaseStatus.fromValue("unknown")).isNull();
        }
    }

    @Nested
    @DisplayName("ConversationPhase")
    class ConversationPhaseTransitions {

        @Test
        void canAdvanceTo_shouldOnlyMoveForward() {
            assertThat(ConversationPhase.AI_INTERVIEW.canAdvanceTo(ConversationPhase.AI_DRAFTING)).isTrue();
            assertThat(ConversationPhase.ADVOCATE_REVIEW.canAdvanceTo(ConversationPhase.ADVOCATE_ACTIVE)).isTrue();
            assertThat(ConversationPhase.AI_DRAFTING.canAdvanceTo(ConversationPhase.AI_INTERVIEW)).isFalse();
            assertThat(ConversationPhase.AI_INTERVIEW.canAdvanceTo(ConversationPhase.AI_INTERVIEW)).isFalse();
        }

        @Test
        void isAssistantTurn_shouldCoverAiPhasesOnly() {
            assertThat(ConversationPhase.AI_COUNSELLING.isAssistantTurn()).isTrue();
            assertThat(ConversationPhase.ADVOCATE_ACTIVE.isAssistantTurn()).isFalse();
        }
    }

    @Test
    void feeTier_shouldListAcceptableAdvocateTiers() {
        assertThat(FeeTier.PRO_BONO.acceptableAdvocateTiers()).containsExactlyInAnyOrder(FeeTier.AFFORDABLE, FeeTier.PRO_BONO);
        assertThat(FeeTier.AFFORDABLE.acceptableAdvocateTiers()).doesNotContain(FeeTier.PREMIUM);
        assertThat(FeeTier.fromValue("pro bono")).isEqualTo(FeeTier.PRO_BONO);
    }
}
