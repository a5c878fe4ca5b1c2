package com.lexbridge.backend.assistant;

import com.lexbridge.backend.models.Message;
import com.lexbridge.backend.models.SenderType;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Interview assistant backed by a LangChain4j {@link ChatModel}.
 */
@Slf4j
public class LangChainAssistantAdapter implements AssistantAdapter {

    static final String NOT_CONFIGURED_REPLY =
            "The legal assistant is not configured yet. Please describe your matter and an advocate will follow up.";
    static final String APOLOGY_REPLY =
            "I apologize, but I'm having trouble processing your request right now. Please try again in a moment.";
    static final String EMPTY_REPLY = "I've noted that. Could you tell me a little more?";

    static final String SYSTEM_PROMPT = """
            You are an experienced Indian advocate helping a client understand their legal matter.

            Work in three stages:
            1. Interview: ask ONE question at a time and collect the material facts (parties, dates,
               jurisdiction, facts, relief sought).
            2. Counselling and drafting: explain the options and prepare documents in the format Indian
               courts expect.
            3. Recommendation: once the facts are clear, offer to recommend suitable advocates.

            For each matter type gather the essentials:
            - Civil: parties, cause of action, jurisdiction, relief sought, limitation period
            - Matrimonial: marriage details, grounds for relief, children, assets, maintenance
            - Criminal/Bail: offence details, arrest circumstances, prior record, grounds for bail
            - Property: property details, ownership chain, nature of dispute, documents available
            - Constitutional: fundamental right violated, state action, urgency

            Be professional, approachable and concise.

            Whenever you learn case facts, include this block in your reply with the fields you know:
            ```case_profile
            {
              "matter_type": "civil | matrimonial | criminal | property | constitutional | conveyancing | notice",
              "sub_category": "...",
              "state": "...",
              "district": "...",
              "court_level": "district | high_court | supreme_court | tribunal",
              "complexity": "simple | moderate | complex | highly_complex",
              "urgency": "urgent | normal | can_wait",
              "budget_tier": "pro_bono | affordable | standard | premium",
              "amount_in_dispute": 0,
              "preferred_languages": ["..."],
              "senior_counsel_required": false,
              "specific_expertise": ["..."],
              "case_summary": "..."
            }
            ```
            """;

    private final ChatModel chatModel;
    private final CaseProfileParser parser;

    /**
     * @param chatModel model to call, or null when no API key is configured
     */
    public LangChainAssistantAdapter(ChatModel chatModel, CaseProfileParser parser) {
        this.chatModel = chatModel;
        this.parser = parser;
    }

    @Override
    public AssistantReply respond(String sessionToken, List<Message> history, String newMessage) {
        String token = sessionToken != null ? sessionToken : UUID.randomUUID().toString();
        if (chatModel == null) {
            return AssistantReply.textOnly(NOT_CONFIGURED_REPLY, token);
        }

        ChatRequest request = ChatRequest.builder()
                .messages(toChatMessages(history, newMessage))
                .build();
        String text;
        try {
            ChatResponse response = chatModel.chat(request);
            text = response.aiMessage() != null ? response.aiMessage().text() : null;
        } catch (RuntimeException e) {
            log.warn("Assistant call failed for session {}", token, e);
            return AssistantReply.textOnly(APOLOGY_REPLY, sessionToken);
        }
        if (text == null || text.isBlank()) {
            text = EMPTY_REPLY;
        }
        return new AssistantReply(text, token, parser.parse(text));
    }

    static List<ChatMessage> toChatMessages(List<Message> history, String newMessage) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from(SYSTEM_PROMPT));
        if (history != null) {
            for (Message message : history) {
                if (message.getContent() == null || message.getContent().isBlank()) {
                    continue;
                }
                if (message.getSenderType() == SenderType.CLIENT) {
                    messages.add(UserMessage.from(message.getContent()));
                } else {
                    messages.add(AiMessage.from(message.getContent()));
                }
            }
        }
        messages.add(UserMessage.from(newMessage));
        return messages;
    }
}
