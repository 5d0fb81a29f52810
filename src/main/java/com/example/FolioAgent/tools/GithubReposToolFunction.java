package com.example.FolioAgent.tools;

import com.example.FolioAgent.config.AgentProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;

/**
 * Public repositories of the configured GitHub user, via the GitHub REST API.
 */
@Component(GithubReposToolDefinition.NAME)
public class GithubReposToolFunction implements ToolFunction {

    private final RestClient githubRestClient;
    private final AgentProperties properties;

    public GithubReposToolFunction(@Qualifier("githubRestClient") RestClient githubRestClient,
                                   AgentProperties properties) {
        this.githubRestClient = githubRestClient;
        this.properties = properties;
    }

    public record Repo(
            String name,
            String description,
            String language,
            int stars,
            String url
    ) {
    }

    public record Response(String owner, List<Repo> repositories) {
    }

    @Override
    public Response invoke(ToolRequest request) {
        AgentProperties.Github github = properties.getTools().getGithub();

        JsonNode body = githubRestClient.get()
                .uri(uri -> uri.path("/users/{user}/repos")
                        .queryParam("sort", "updated")
                        .queryParam("per_page", github.getMaxRepos())
                        .build(github.getUsername()))
                .retrieve()
                .body(JsonNode.class);

        List<Repo> repos = new ArrayList<>();
        if (body != null && body.isArray()) {
            for (JsonNode node : body) {
                if (node.path("fork").asBoolean(false)) {
                    continue;
                }
                repos.add(new Repo(
                        node.path("name").asText(""),
                        node.path("description").isNull() ? "" : node.path("description").asText(""),
                        node.path("language").isNull() ? "" : node.path("language").asText(""),
                        node.path("stargazers_count").asInt(0),
                        node.path("html_url").asText("")
                ));
            }
        }
        return new Response(github.getUsername(), repos);
    }
}
