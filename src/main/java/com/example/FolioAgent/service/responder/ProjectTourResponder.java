package com.example.FolioAgent.service.responder;

import com.example.FolioAgent.model.DraftResponse;
import com.example.FolioAgent.model.Intent;
import com.example.FolioAgent.model.ResponderInput;
import com.example.FolioAgent.model.ResponseStrategy;
import com.example.FolioAgent.model.RetrievalResult;
import com.example.FolioAgent.model.ToolInvocation;
import com.example.FolioAgent.service.ChatClientResolver;
import com.example.FolioAgent.tools.WebGuideToolFunction;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders the site tour from the web guide tool without a model call.
 * Falls back to the chat model when the guide did not run or when asked for the alternate strategy.
 */
@Component
public class ProjectTourResponder extends AbstractLlmResponder {

    static final int HIGHLIGHTS = 3;
    private static final int HIGHLIGHT_CHARS = 140;

    public ProjectTourResponder(ChatClientResolver chatClientResolver, ObjectMapper objectMapper) {
        super(chatClientResolver, objectMapper);
    }

    @Override
    public Intent intent() {
        return Intent.PROJECT_TOUR;
    }

    @Override
    public DraftResponse respond(ResponderInput input) {
        ToolInvocation tool = input.tool();
        if (input.strategy() == ResponseStrategy.PRIMARY
                && tool != null && tool.succeeded()
                && tool.output() instanceof WebGuideToolFunction.Response guide) {
            return DraftResponse.of(renderTour(guide, input.context() == null ? List.of() : input.context().sources()),
                    input.strategy());
        }
        return super.respond(input);
    }

    String renderTour(WebGuideToolFunction.Response guide, List<RetrievalResult> sources) {
        StringBuilder sb = new StringBuilder();
        if ("INIT".equals(guide.currentStep())) {
            sb.append("Welcome! Here's a quick tour of the portfolio site:\n");
        } else {
            sb.append("You're on the ").append(guide.currentStep()).append(" section. The full tour:\n");
        }
        int step = 1;
        for (WebGuideToolFunction.Section section : guide.steps()) {
            sb.append(step++).append(". ").append(section.title())
                    .append(" (").append(section.path()).append(") - ").append(section.summary()).append('\n');
        }
        sb.append(guide.nextStepHint());

        List<RetrievalResult> highlights = sources.stream().limit(HIGHLIGHTS).toList();
        if (!highlights.isEmpty()) {
            sb.append("\n\nWorth a look along the way:");
            for (RetrievalResult hit : highlights) {
                sb.append("\n- ").append(firstLine(hit.document().getContent()))
                        .append(" [docId=").append(hit.id()).append(']');
            }
        }
        return sb.toString();
    }

    private static String firstLine(String content) {
        if (content == null) {
            return "";
        }
        String line = content.strip().lines().findFirst().orElse("");
        return line.length() > HIGHLIGHT_CHARS ? line.substring(0, HIGHLIGHT_CHARS) + "..." : line;
    }

    @Override
    protected String persona() {
        return "You are Mr Pot, Yuqi's portfolio assistant and tour guide. Walk the visitor through the site "
                + "section by section and point out the projects worth opening.";
    }

    @Override
    protected String topic() {
        return "the site tour";
    }
}
