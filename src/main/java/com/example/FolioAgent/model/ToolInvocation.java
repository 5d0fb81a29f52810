package com.example.FolioAgent.model;

/**
 * Record of one tool provider call made for a request.
 */
public record ToolInvocation(
        String toolId,
        String input,
        Object output,
        boolean succeeded,
        String error,
        long durationMs
) {
    public static ToolInvocation success(String toolId, String input, Object output, long durationMs) {
        return new ToolInvocation(toolId, input, output, true, null, durationMs);
    }

    public static ToolInvocation failure(String toolId, String input, String error, long durationMs) {
        return new ToolInvocation(toolId, input, null, false, error, durationMs);
    }
}
