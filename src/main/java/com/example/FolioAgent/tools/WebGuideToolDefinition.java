package com.example.FolioAgent.tools;

import com.example.FolioAgent.model.Intent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Metadata for the portfolio site tour tool.
 * Real logic lives in WebGuideToolFunction.
 */
@Component
public class WebGuideToolDefinition implements AiToolDefinition {

    public static final String NAME = "webGuideTool";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return """
                Web guide tool. Use this when the user asks for a tour of the portfolio site
                or for help finding a section. It guides the user section by section.
                """;
    }

    @Override
    public Set<Intent> intents() {
        return Set.of(Intent.PROJECT_TOUR);
    }

    @Override
    public List<String> triggerKeywords() {
        return List.of("tour", "site guide", "website guide", "walk me through");
    }
}
