package com.lexbridge.backend.config;

import com.lexbridge.backend.assistant.AssistantAdapter;
import com.lexbridge.backend.assistant.CaseProfileParser;
import com.lexbridge.backend.assistant.LangChainAssistantAdapter;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class AssistantConfig {

    @Bean
    public AssistantAdapter assistantAdapter(LexBridgeProperties properties, CaseProfileParser parser) {
        LexBridgeProperties.Assistant settings = properties.getAssistant();
        ChatModel chatModel = null;
        if (settings.getApiKey() != null && !settings.getApiKey().isBlank()) {
            chatModel = AnthropicChatModel.builder()
                    .apiKey(settings.getApiKey())
                    .modelName(settings.getModelName())
                    .maxTokens(settings.getMaxTokens())
                    .timeout(settings.getTimeout())
                    .build();
            log.info("Assistant uses Anthropic model {}", settings.getModelName());
        } else {
            log.warn("lexbridge.assistant.api-key is not set; the assistant answers with a fixed reply");
        }
        return new LangChainAssistantAdapter(chatModel, parser);
    }
}
