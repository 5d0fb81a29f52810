package com.example.FolioAgent.service.responder;

import com.example.FolioAgent.exception.ResponseGenerationException;
import com.example.FolioAgent.model.DraftResponse;
import com.example.FolioAgent.model.ResponderInput;
import com.example.FolioAgent.model.ResponseStrategy;
import com.example.FolioAgent.model.ToolInvocation;
import com.example.FolioAgent.service.ChatClientResolver;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Chat-model backed responder. Subclasses supply the persona for their intent.
 */
public abstract class AbstractLlmResponder implements PortfolioResponder {

    static final String CITATION_RULES = """
            Use only the retrieved context and tool output below. \
            Cite every chunk you rely on right after the sentence, as [docId=N] with the id shown in its header. \
            Never cite an id that is not in the context. \
            If the context does not cover the question, say what is known and stop.""";

    static final String ALTERNATE_SYSTEM = """
            You are Mr Pot, a portfolio assistant. Answer by extracting facts from the retrieved context only. \
            Write two to five complete sentences in the user's language, each followed by its [docId=N] citation. \
            Do not speculate and do not add information that is not in the context.""";

    protected final ChatClientResolver chatClientResolver;
    protected final ObjectMapper objectMapper;

    protected AbstractLlmResponder(ChatClientResolver chatClientResolver, ObjectMapper objectMapper) {
        this.chatClientResolver = chatClientResolver;
        this.objectMapper = objectMapper;
    }

    /**
     * System prompt for the PRIMARY strategy.
     */
    protected abstract String persona();

    /**
     * Short noun phrase naming what this responder covers, used in the no-context answer.
     */
    protected abstract String topic();

    @Override
    public DraftResponse respond(ResponderInput input) {
        boolean noContext = input.context() == null || input.context().isEmpty();
        boolean noTool = input.tool() == null || !input.tool().succeeded();
        if (noContext && noTool) {
            return DraftResponse.of(noContextAnswer(), input.strategy());
        }

        String system = input.strategy() == ResponseStrategy.ALTERNATE
                ? ALTERNATE_SYSTEM
                : persona() + " " + CITATION_RULES;

        String content;
        try {
            content = chatClientResolver.resolve(input.model()).prompt()
                    .system(system)
                    .user(buildPrompt(input))
                    .call()
                    .content();
        } catch (RuntimeException ex) {
            throw new ResponseGenerationException("Chat model call failed: " + ex.getMessage(), ex);
        }
        if (content == null || content.isBlank()) {
            throw new ResponseGenerationException("Chat model returned no text");
        }
        return DraftResponse.of(content, input.strategy());
    }

    /**
     * Deterministic answer when there is nothing to ground a model call on.
     */
    protected String noContextAnswer() {
        return "I couldn't find anything in the portfolio about " + topic()
                + " that answers this yet. You can ask about education, work experience, projects, skills or case studies instead.";
    }

    /**
     * Build the combined prompt:
     *  - retrieved KB context
     *  - tool output, when a tool ran
     *  - user question
     */
    protected String buildPrompt(ResponderInput input) {
        StringBuilder sb = new StringBuilder();
        String contextText = input.context() == null || input.context().isEmpty()
                ? "(no results)"
                : input.context().text();
        sb.append("Retrieved Context:\n").append(contextText).append("\n\n");

        ToolInvocation tool = input.tool();
        if (tool != null && tool.succeeded()) {
            sb.append("Tool Output (").append(tool.toolId()).append("):\n")
                    .append(renderToolOutput(tool.output())).append("\n\n");
        }
        sb.append("User Question: ").append(input.query()).append("\n");
        sb.append("Answer clearly and concisely.");
        return sb.toString();
    }

    protected String renderToolOutput(Object output) {
        try {
            return objectMapper.writeValueAsString(output);
        } catch (JsonProcessingException e) {
            return String.valueOf(output);
        }
    }
}
