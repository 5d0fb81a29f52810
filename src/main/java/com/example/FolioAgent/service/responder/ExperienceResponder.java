package com.example.FolioAgent.service.responder;

import com.example.FolioAgent.model.Intent;
import com.example.FolioAgent.service.ChatClientResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

@Component
public class ExperienceResponder extends AbstractLlmResponder {

    public ExperienceResponder(ChatClientResolver chatClientResolver, ObjectMapper objectMapper) {
        super(chatClientResolver, objectMapper);
    }

    @Override
    public Intent intent() {
        return Intent.EXPERIENCE;
    }

    @Override
    protected String persona() {
        return "You are Mr Pot, Yuqi's portfolio assistant. Answer questions about jobs and internships: employer, role, period, and the concrete work and impact described in the context.";
    }

    @Override
    protected String topic() {
        return "their work experience";
    }
}
