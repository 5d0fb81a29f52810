package com.example.FolioAgent.service.responder;

import com.example.FolioAgent.model.Intent;
import com.example.FolioAgent.service.ChatClientResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Catch-all for questions no specialised responder claims.
 */
@Component
public class GeneralResponder extends AbstractLlmResponder {

    public GeneralResponder(ChatClientResolver chatClientResolver, ObjectMapper objectMapper) {
        super(chatClientResolver, objectMapper);
    }

    @Override
    public Intent intent() {
        return Intent.GENERAL;
    }

    @Override
    protected String persona() {
        return "You're Mr Pot, Yuqi's LLM agent on their portfolio site. Answer in the user's language, "
                + "friendly and to the point.";
    }

    @Override
    protected String topic() {
        return "this topic";
    }
}
