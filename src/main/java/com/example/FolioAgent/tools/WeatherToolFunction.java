package com.example.FolioAgent.tools;

import com.example.FolioAgent.config.AgentProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Current conditions from Open-Meteo for the configured location.
 */
@Component(WeatherToolDefinition.NAME)
public class WeatherToolFunction implements ToolFunction {

    private final RestClient weatherRestClient;
    private final AgentProperties properties;

    public WeatherToolFunction(@Qualifier("weatherRestClient") RestClient weatherRestClient,
                               AgentProperties properties) {
        this.weatherRestClient = weatherRestClient;
        this.properties = properties;
    }

    public record Response(
            String location,
            double temperatureC,
            double windSpeedKmh,
            int weatherCode,
            String observedAt
    ) {
    }

    @Override
    public Response invoke(ToolRequest request) {
        AgentProperties.Weather weather = properties.getTools().getWeather();

        JsonNode body = weatherRestClient.get()
                .uri(uri -> uri.path("/v1/forecast")
                        .queryParam("latitude", weather.getLatitude())
                        .queryParam("longitude", weather.getLongitude())
                        .queryParam("current_weather", true)
                        .build())
                .retrieve()
                .body(JsonNode.class);

        JsonNode current = body == null ? null : body.get("current_weather");
        if (current == null || current.isNull()) {
            throw new IllegalStateException("Weather provider returned no current_weather block");
        }
        return new Response(
                weather.getLocationName(),
                current.path("temperature").asDouble(),
                current.path("windspeed").asDouble(),
                current.path("weathercode").asInt(),
                current.path("time").asText("")
        );
    }
}
