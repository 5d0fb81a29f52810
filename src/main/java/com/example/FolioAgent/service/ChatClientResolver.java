package com.example.FolioAgent.service;

import com.example.FolioAgent.model.PortfolioQueryRequest;
import org.springframework.ai.chat.client.ChatClient;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Picks the chat client for a request's model hint. Built by {@code AiConfig}.
 */
public class ChatClientResolver {

    private final Map<String, ChatClient> chatClients;

    /**
     * @param chatClients clients keyed by lower-case model name, preferred first
     */
    public ChatClientResolver(Map<String, ChatClient> chatClients) {
        if (chatClients == null || chatClients.isEmpty()) {
            throw new IllegalArgumentException("At least one ChatClient is required");
        }
        this.chatClients = new LinkedHashMap<>(chatClients);
    }

    /**
     * Client for the requested model. Falls back to the default model, then to the
     * first available client, when the requested one is not configured.
     */
    public ChatClient resolve(String model) {
        String key = model == null || model.isBlank()
                ? PortfolioQueryRequest.DEFAULT_MODEL
                : model.trim().toLowerCase(Locale.ROOT);
        ChatClient client = chatClients.get(key);
        if (client != null) {
            return client;
        }
        ChatClient fallback = chatClients.get(PortfolioQueryRequest.DEFAULT_MODEL);
        if (fallback != null) {
            return fallback;
        }
        return chatClients.values().iterator().next();
    }

    public Set<String> availableModels() {
        return Set.copyOf(chatClients.keySet());
    }
}
