package com.example.FolioAgent.tools;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Metadata for the code-hosting catalog tool.
 */
@Component
public class GithubReposToolDefinition implements AiToolDefinition {

    public static final String NAME = "githubReposTool";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return """
                GitHub catalog tool. Lists the portfolio owner's public repositories,
                most recently updated first, with language, stars and link.
                """;
    }

    @Override
    public List<String> triggerKeywords() {
        return List.of("github", "repo", "repos", "repository", "repositories", "source code");
    }
}
