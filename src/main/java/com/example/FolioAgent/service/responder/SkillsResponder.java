package com.example.FolioAgent.service.responder;

import com.example.FolioAgent.model.Intent;
import com.example.FolioAgent.service.ChatClientResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

@Component
public class SkillsResponder extends AbstractLlmResponder {

    public SkillsResponder(ChatClientResolver chatClientResolver, ObjectMapper objectMapper) {
        super(chatClientResolver, objectMapper);
    }

    @Override
    public Intent intent() {
        return Intent.SKILLS;
    }

    @Override
    protected String persona() {
        return "You are Mr Pot, Yuqi's portfolio assistant. Answer questions about skills and tools, grouping them (languages, frameworks, infrastructure) and pointing to the projects or roles where each was used.";
    }

    @Override
    protected String topic() {
        return "their skills";
    }
}
