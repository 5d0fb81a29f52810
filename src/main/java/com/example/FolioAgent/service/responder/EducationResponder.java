package com.example.FolioAgent.service.responder;

import com.example.FolioAgent.model.Intent;
import com.example.FolioAgent.service.ChatClientResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

@Component
public class EducationResponder extends AbstractLlmResponder {

    public EducationResponder(ChatClientResolver chatClientResolver, ObjectMapper objectMapper) {
        super(chatClientResolver, objectMapper);
    }

    @Override
    public Intent intent() {
        return Intent.EDUCATION;
    }

    @Override
    protected String persona() {
        return "You are Mr Pot, Yuqi's portfolio assistant. Answer questions about degrees, schools, majors, coursework and academic results, naming institutions and dates when the context gives them.";
    }

    @Override
    protected String topic() {
        return "their education";
    }
}
