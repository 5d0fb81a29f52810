package com.example.FolioAgent.tools;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Walks a visitor through the portfolio site, one section at a time.
 * The current step is the first section the question mentions, else the start of the tour.
 */
@Component(WebGuideToolDefinition.NAME)
public class WebGuideToolFunction implements ToolFunction {

    static final List<Section> SECTIONS = List.of(
            new Section("home", "Home", "/", "Short introduction and highlights."),
            new Section("about", "About", "/about", "Background, interests and contact links."),
            new Section("experience", "Experience", "/experience", "Roles, internships and responsibilities."),
            new Section("projects", "Projects", "/projects", "Side projects with demos and source links."),
            new Section("case-studies", "Case Studies", "/case-studies", "Deep dives into selected work."),
            new Section("contact", "Contact", "/contact", "How to get in touch.")
    );

    public record Section(String id, String title, String path, String summary) {
    }

    public record Response(
            String currentStep,
            String nextStepHint,
            List<Section> steps,
            boolean completed
    ) {
    }

    @Override
    public Response invoke(ToolRequest request) {
        String question = request.query() == null ? "" : request.query().toLowerCase(Locale.ROOT);

        int current = -1;
        for (int i = 0; i < SECTIONS.size(); i++) {
            Section section = SECTIONS.get(i);
            if (question.contains(section.title().toLowerCase(Locale.ROOT))
                    || question.contains(section.id().replace('-', ' '))) {
                current = i;
                break;
            }
        }

        if (current < 0) {
            Section first = SECTIONS.get(0);
            return new Response("INIT",
                    "Start at " + first.title() + " (" + first.path() + "), then continue to "
                            + SECTIONS.get(1).title() + ".",
                    SECTIONS, false);
        }

        Section section = SECTIONS.get(current);
        boolean last = current == SECTIONS.size() - 1;
        String hint = last
                ? "That's the end of the tour. Ask about any section to go deeper."
                : "Next up: " + SECTIONS.get(current + 1).title() + " (" + SECTIONS.get(current + 1).path() + ").";
        return new Response(section.title(), hint, SECTIONS, last);
    }
}
