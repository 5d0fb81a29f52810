package com.example.FolioAgent.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "FolioAgent API",
                version = "v1",
                description = "Portfolio question answering: query, streamed thinking events and retrieval debug endpoints"
        )
)
public class OpenApiConfig {
}
