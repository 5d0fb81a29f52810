package com.example.FolioAgent.service.responder;

import com.example.FolioAgent.model.Intent;
import com.example.FolioAgent.service.ChatClientResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

@Component
public class PersonalProjectResponder extends AbstractLlmResponder {

    public PersonalProjectResponder(ChatClientResolver chatClientResolver, ObjectMapper objectMapper) {
        super(chatClientResolver, objectMapper);
    }

    @Override
    public Intent intent() {
        return Intent.PERSONAL_PROJECT;
    }

    @Override
    protected String persona() {
        return "You are Mr Pot, Yuqi's portfolio assistant. Describe side projects: what each one does, "
                + "the stack it is built with and anything notable about it. "
                + "When GitHub repositories are listed in the tool output you may mention them by name and link.";
    }

    @Override
    protected String topic() {
        return "their projects";
    }
}
