package com.example.FolioAgent.tools;

import com.example.FolioAgent.model.Intent;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Central registry for all tool providers.
 * It knows which tools are available, which intents they serve and how to invoke them.
 */
@Component
public class ToolRegistry {

    private final Map<String, AiToolDefinition> toolsByName;
    private final Map<Intent, List<AiToolDefinition>> toolsByIntent;
    private final Map<String, ToolFunction> functionsByBeanName;

    public ToolRegistry(List<AiToolDefinition> definitions, Map<String, ToolFunction> functions) {
        // Index by name, sorted so iteration order is stable
        this.toolsByName = Collections.unmodifiableMap(definitions.stream()
                .collect(Collectors.toMap(
                        AiToolDefinition::name,
                        d -> d,
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate tool name: " + a.name());
                        },
                        TreeMap::new
                )));

        // Index by intent
        Map<Intent, List<AiToolDefinition>> tmp = new EnumMap<>(Intent.class);
        for (AiToolDefinition def : toolsByName.values()) {
            for (Intent intent : def.intents()) {
                tmp.computeIfAbsent(intent, i -> new ArrayList<>()).add(def);
            }
        }
        this.toolsByIntent = Collections.unmodifiableMap(tmp);
        this.functionsByBeanName = Map.copyOf(functions);
    }

    /**
     * Get all tool definitions that run by default for an intent.
     */
    public List<AiToolDefinition> getToolsForIntent(Intent intent) {
        return toolsByIntent.getOrDefault(intent, List.of());
    }

    /**
     * Look up a tool definition by its name.
     */
    public Optional<AiToolDefinition> findByName(String name) {
        return Optional.ofNullable(name).map(toolsByName::get);
    }

    /**
     * Look up the function bean that executes a tool.
     */
    public Optional<ToolFunction> findFunction(AiToolDefinition definition) {
        return Optional.ofNullable(functionsByBeanName.get(definition.functionBeanName()));
    }

    /**
     * Get all registered tools, ordered by name.
     */
    public Collection<AiToolDefinition> allTools() {
        return toolsByName.values();
    }
}
