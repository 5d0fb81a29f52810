package com.example.FolioAgent.tools;

import com.example.FolioAgent.model.Intent;

import java.util.List;
import java.util.Set;

/**
 * Common metadata for a tool provider.
 * This does NOT require the tool to be the ToolFunction itself.
 * Domain logic stays in the function, selection rules live here.
 */
public interface AiToolDefinition {
    /**
     * Unique tool name, also the id callers dispatch by.
     */
    String name();

    /**
     * Natural language description, shown in tool summaries.
     */
    String description();

    /**
     * Intents for which this tool runs even without an explicit request in the question.
     */
    default Set<Intent> intents() {
        return Set.of();
    }

    /**
     * Words or phrases in a question that explicitly ask for this tool.
     */
    default List<String> triggerKeywords() {
        return List.of();
    }

    /**
     * Underlying ToolFunction bean name (usually same as name()).
     */
    default String functionBeanName() {
        // In most cases we keep tool name == function bean name
        return name();
    }
}
