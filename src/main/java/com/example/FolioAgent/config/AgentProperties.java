package com.example.FolioAgent.config;

import com.example.FolioAgent.model.Intent;
import com.example.FolioAgent.model.SourceCategory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for the query pipeline, bound from {@code folio.agent.*}.
 * Defaults here are the values the pipeline is tested against.
 */
@Data
@ConfigurationProperties(prefix = "folio.agent")
public class AgentProperties {

    private Classifier classifier = new Classifier();
    private Retrieval retrieval = new Retrieval();
    private Context context = new Context();
    private Validation validation = new Validation();
    private Timeouts timeouts = new Timeouts();
    private Tools tools = new Tools();

    @Data
    public static class Classifier {
        /** Ask the chat model when no keyword rule fires. */
        private boolean llmFallbackEnabled = true;
        private Intent defaultIntent = Intent.GENERAL;
    }

    @Data
    public static class Retrieval {
        /** Semantic hits below this cosine similarity are dropped. */
        private double similarityThreshold = 0.7;
        /** Added to the score of a chunk found by both search methods. */
        private double bothMethodsBoost = 0.05;
        /** Upper bound for k after widening on retry. */
        private int maxK = 48;
        /** Tie-break order between equally scored chunks, highest priority first. */
        private List<SourceCategory> sourcePriority = new ArrayList<>(List.of(
                SourceCategory.EDUCATION,
                SourceCategory.EXPERIENCE,
                SourceCategory.PROJECTS,
                SourceCategory.CASE_STUDY,
                SourceCategory.SKILLS,
                SourceCategory.RESUME,
                SourceCategory.ABOUT,
                SourceCategory.OTHER
        ));
    }

    @Data
    public static class Context {
        private int maxChars = 6000;
    }

    @Data
    public static class Validation {
        private int minLength = 50;
        private int maxRetries = 2;
        private int minDistinctWords = 5;
        private List<String> blockedTerms = new ArrayList<>();
        private String fallbackResponse =
                "Sorry, I couldn't put together a reliable answer about that part of the portfolio right now. "
                        + "Try rephrasing, or ask about education, work experience, projects or skills.";
    }

    @Data
    public static class Timeouts {
        private Duration classify = Duration.ofSeconds(2);
        private Duration retrieve = Duration.ofSeconds(3);
        private Duration dispatch = Duration.ofSeconds(4);
        private Duration respond = Duration.ofSeconds(5);
    }

    @Data
    public static class Tools {
        private int maxInvocationsPerRequest = 1;
        private Github github = new Github();
        private Weather weather = new Weather();
    }

    @Data
    public static class Github {
        private String baseUrl = "https://api.github.com";
        private String username = "YuqiGuo105";
        private int maxRepos = 10;
    }

    @Data
    public static class Weather {
        private String baseUrl = "https://api.open-meteo.com";
        private String locationName = "New York";
        private double latitude = 40.7128;
        private double longitude = -74.0060;
    }
}
