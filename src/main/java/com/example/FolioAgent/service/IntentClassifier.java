package com.example.FolioAgent.service;

import com.example.FolioAgent.config.AgentProperties;
import com.example.FolioAgent.model.Classification;
import com.example.FolioAgent.model.Intent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maps a question to exactly one {@link Intent}.
 * <p>
 * A weighted keyword ruleset decides first. Only when no rule fires is the chat model asked,
 * and anything it says that is not a known label, or any error it raises, resolves to the
 * configured default intent.
 */
@Service
public class IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    /** Tie-break order when two intents score the same. */
    private static final List<Intent> PRIORITY = List.of(
            Intent.CASE_STUDY,
            Intent.PROJECT_TOUR,
            Intent.EDUCATION,
            Intent.EXPERIENCE,
            Intent.PERSONAL_PROJECT,
            Intent.SKILLS
    );

    private static final Map<Intent, List<Rule>> RULES = new EnumMap<>(Intent.class);

    static {
        RULES.put(Intent.EDUCATION, rules(
                "degree", "degrees", "university", "college", "school", "major", "minor", "gpa",
                "graduate", "graduated", "graduation", "study", "studied", "studying", "bachelor",
                "bachelors", "master", "masters", "phd", "coursework", "courses", "thesis",
                "education", "academic", "campus"));
        RULES.put(Intent.EXPERIENCE, rules(
                "job", "jobs", "intern", "internship", "internships", "employer", "company",
                "companies", "role", "roles", "position", "career", "worked", "working",
                "responsibilities", "hired", "employment", "work experience", "professional experience"));
        RULES.put(Intent.PERSONAL_PROJECT, rules(
                "project", "projects", "side project", "side projects", "built", "app", "apps",
                "github", "repo", "repos", "repository", "repositories", "open source",
                "hackathon", "source code"));
        RULES.put(Intent.SKILLS, rules(
                "skill", "skills", "language", "languages", "framework", "frameworks", "stack",
                "tech stack", "proficient", "proficiency", "technologies", "tooling", "expertise",
                "good at", "strengths"));
        RULES.put(Intent.CASE_STUDY, rules(
                "case study", "case studies", "case-study", "deep dive", "write-up", "writeup",
                "post-mortem", "postmortem", "lessons learned", "trade-offs", "tradeoffs", "architecture of"));
        RULES.put(Intent.PROJECT_TOUR, rules(
                "tour", "walk me through", "walkthrough", "guide me", "show me around", "navigate",
                "where can i find", "website guide", "site guide", "get started", "onboarding"));
    }

    private final ChatClientResolver chatClientResolver;
    private final AgentProperties properties;

    public IntentClassifier(ChatClientResolver chatClientResolver, AgentProperties properties) {
        this.chatClientResolver = chatClientResolver;
        this.properties = properties;
    }

    public Classification classify(String query) {
        return classify(query, null);
    }

    /**
     * Never returns null and never throws.
     *
     * @param model model hint used only for the fallback call
     */
    public Classification classify(String query, String model) {
        Intent defaultIntent = properties.getClassifier().getDefaultIntent();
        if (query == null || query.isBlank()) {
            return Classification.of(defaultIntent, "default");
        }

        Intent byRules = classifyByRules(query);
        if (byRules != null) {
            return Classification.of(byRules, "rules");
        }

        if (!properties.getClassifier().isLlmFallbackEnabled()) {
            return Classification.of(defaultIntent, "default");
        }

        try {
            String label = chatClientResolver.resolve(model).prompt()
                    .system(classificationSystemPrompt())
                    .user(query)
                    .call()
                    .content();
            return Intent.parse(label)
                    .map(intent -> Classification.of(intent, "model"))
                    .orElseGet(() -> {
                        log.debug("Intent model answered '{}', using default {}", label, defaultIntent);
                        return Classification.of(defaultIntent, "default");
                    });
        } catch (RuntimeException ex) {
            log.warn("Intent classification degraded to {}: {}", defaultIntent, ex.toString());
            return new Classification(defaultIntent, "default", "classifier model unavailable: " + ex.getMessage());
        }
    }

    /**
     * Keyword scoring: multi-word phrases weigh 2, single words 1. Null when nothing matched.
     */
    Intent classifyByRules(String query) {
        String normalized = " " + query.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9'\\- ]", " ") + " ";
        Intent best = null;
        int bestScore = 0;
        for (Intent intent : PRIORITY) {
            int score = 0;
            for (Rule rule : RULES.getOrDefault(intent, List.of())) {
                if (rule.pattern().matcher(normalized).find()) {
                    score += rule.weight();
                }
            }
            // Strictly greater keeps the earlier intent in PRIORITY on ties
            if (score > bestScore) {
                best = intent;
                bestScore = score;
            }
        }
        return best;
    }

    private String classificationSystemPrompt() {
        String labels = Arrays.stream(Intent.values())
                .map(i -> "- " + i.name() + ": " + i.description())
                .collect(Collectors.joining("\n"));
        return """
                You route questions asked to a personal portfolio assistant.
                Reply with exactly one label from the list below and nothing else.
                %s
                """.formatted(labels);
    }

    private static List<Rule> rules(String... phrases) {
        return Arrays.stream(phrases)
                .map(p -> new Rule(
                        Pattern.compile("(?<![a-z0-9])" + Pattern.quote(p) + "(?![a-z0-9])"),
                        p.contains(" ") ? 2 : 1))
                .toList();
    }

    private record Rule(Pattern pattern, int weight) { }
}
