package com.lexbridge.backend.assistant;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexbridge.backend.models.MatterType;
import com.lexbridge.backend.models.Message;
import com.lexbridge.backend.models.SenderType;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LangChainAssistantAdapterTest {

    private final CaseProfileParser parser = new CaseProfileParser(new ObjectMapper());

    @Test
    void systemPrompt_shouldAskForEveryProfileFieldTheParserReads() {
        assertThat(LangChainAssistantAdapter.SYSTEM_PROMPT).contains(
                "\"matter_type\"", "\"sub_category\"", "\"state\"", "\"district\"",
                "\"court_level\"", "\"complexity\"", "\"urgency\"", "\"budget_tier\"",
                "\"amount_in_dispute\"", "\"preferred_languages\"", "\"senior_counsel_required\"",
                "\"specific_expertise\"", "\"case_summary\"");
    }

    @Test
    void respond_shouldReturnTextAndProfile() {
        ChatModel model = mock(ChatModel.class);
        when(model.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("Understood.\n```case_profile\n{\"matter_type\":\"matrimonial\"}\n```"))
                .build());
        LangChainAssistantAdapter adapter = new LangChainAssistantAdapter(model, parser);

        AssistantReply reply = adapter.respond("token-1", List.of(), "My spouse filed for divorce");

        assertThat(reply.text()).startsWith("Understood.");
        assertThat(reply.sessionToken()).isEqualTo("token-1");
        assertThat(reply.profileFragment()).hasValueSatisfying(p ->
                assertThat(p.getMatterType()).isEqualTo(MatterType.MATRIMONIAL));
    }

    @Test
    void respond_shouldIssueToken_onFirstTurn() {
        ChatModel model = mock(ChatModel.class);
        when(model.chat(any(ChatRequest.class)))
                .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("Hello")).build());

        AssistantReply reply = new LangChainAssistantAdapter(model, parser).respond(null, List.of(), "Hi");

        assertThat(reply.sessionToken()).isNotBlank();
        assertThat(reply.profileFragment()).isEmpty();
    }

    @Test
    void respond_shouldApologizeAndKeepToken_whenModelFails() {
        ChatModel model = mock(ChatModel.class);
        when(model.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("rate limited"));

        AssistantReply reply = new LangChainAssistantAdapter(model, parser).respond("token-1", List.of(), "Hi");

        assertThat(reply.text()).isEqualTo(LangChainAssistantAdapter.APOLOGY_REPLY);
        assertThat(reply.sessionToken()).isEqualTo("token-1");
        assertThat(reply.profileFragment()).isEmpty();
    }

    @Test
    void respond_shouldFallBack_whenModelIsMissingOrSilent() {
        ChatModel silent = mock(ChatModel.class);
        when(silent.chat(any(ChatRequest.class)))
                .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from(" ")).build());

        assertThat(new LangChainAssistantAdapter(null, parser).respond(null, List.of(), "Hi").text())
                .isEqualTo(LangChainAssistantAdapter.NOT_CONFIGURED_REPLY);
        assertThat(new LangChainAssistantAdapter(silent, parser).respond("t", List.of(), "Hi").text())
                .isEqualTo(LangChainAssistantAdapter.EMPTY_REPLY);
    }

    @Test
    void toChatMessages_shouldMapSendersToRoles() {
        List<Message> history = List.of(
                Message.builder().senderType(SenderType.AI).content("Welcome").build(),
                Message.builder().senderType(SenderType.CLIENT).content("I need help").build(),
                Message.builder().senderType(SenderType.AI).content("").build());

        List<ChatMessage> messages = LangChainAssistantAdapter.toChatMessages(history, "It is about rent");

        assertThat(messages).hasSize(4);
        assertThat(messages.get(0)).isInstanceOf(SystemMessage.class);
        assertThat(messages.get(1)).isInstanceOf(AiMessage.class);
        assertThat(messages.get(2)).isInstanceOf(UserMessage.class);
        assertThat(((UserMessage) messages.get(3)).singleText()).isEqualTo("It is about rent");
    }
}
