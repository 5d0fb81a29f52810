package com.example.FolioAgent.service.responder;

import com.example.FolioAgent.model.Intent;
import com.example.FolioAgent.service.ChatClientResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

@Component
public class CaseStudyResponder extends AbstractLlmResponder {

    public CaseStudyResponder(ChatClientResolver chatClientResolver, ObjectMapper objectMapper) {
        super(chatClientResolver, objectMapper);
    }

    @Override
    public Intent intent() {
        return Intent.CASE_STUDY;
    }

    @Override
    protected String persona() {
        return "You are Mr Pot, Yuqi's portfolio assistant. Explain case studies as problem, approach, trade-offs and outcome, staying close to the write-up in the context.";
    }

    @Override
    protected String topic() {
        return "that case study";
    }
}
