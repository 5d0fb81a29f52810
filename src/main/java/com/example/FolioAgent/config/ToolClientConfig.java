package com.example.FolioAgent.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;

/**
 * HTTP clients for the external tool providers.
 */
@Configuration
public class ToolClientConfig {

    @Bean
    public RestClient githubRestClient(RestClient.Builder builder, AgentProperties properties) {
        return builder.clone()
                .baseUrl(properties.getTools().getGithub().getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .build();
    }

    @Bean
    public RestClient weatherRestClient(RestClient.Builder builder, AgentProperties properties) {
        return builder.clone()
                .baseUrl(properties.getTools().getWeather().getBaseUrl())
                .build();
    }
}
