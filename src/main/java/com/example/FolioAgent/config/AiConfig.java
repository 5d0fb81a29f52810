package com.example.FolioAgent.config;

import com.example.FolioAgent.service.ChatClientResolver;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chat clients keyed by model name ("deepseek", "openai"), one per chat model the
 * Spring AI starters registered. DeepSeek comes first and is the default.
 */
@Configuration
public class AiConfig {

    /** Baseline persona; responders and the classifier add their own system prompt per call. */
    static final String DEFAULT_SYSTEM =
            "You're Mr Pot, the assistant on Yuqi's portfolio site. You only talk about what the portfolio shows.";

    /**
     * The models are looked up when this bean is created, after the auto-configured
     * chat models exist, so every configured provider gets a client.
     */
    @Bean
    public ChatClientResolver chatClientResolver(ObjectProvider<DeepSeekChatModel> deepSeek,
                                                 ObjectProvider<OpenAiChatModel> openAi) {
        Map<String, ChatClient> clients = new LinkedHashMap<>();
        DeepSeekChatModel deepSeekModel = deepSeek.getIfAvailable();
        if (deepSeekModel != null) {
            clients.put("deepseek", portfolioClient(deepSeekModel));
        }
        OpenAiChatModel openAiModel = openAi.getIfAvailable();
        if (openAiModel != null) {
            clients.put("openai", portfolioClient(openAiModel));
        }
        if (clients.isEmpty()) {
            throw new IllegalStateException("No ChatModel beans are available to build a ChatClient");
        }
        return new ChatClientResolver(clients);
    }

    private static ChatClient portfolioClient(ChatModel model) {
        return ChatClient.builder(model)
                .defaultSystem(DEFAULT_SYSTEM)
                .build();
    }
}
