package com.example.FolioAgent.tools;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Metadata for the local weather tool.
 */
@Component
public class WeatherToolDefinition implements AiToolDefinition {

    public static final String NAME = "weatherTool";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Current weather where the portfolio owner is based.";
    }

    @Override
    public List<String> triggerKeywords() {
        return List.of("weather", "temperature", "forecast");
    }
}
