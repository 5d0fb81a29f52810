package com.example.FolioAgent.tools;

/**
 * Executable side of a tool. Implementations are registered as beans named after the tool.
 */
public interface ToolFunction {

    /**
     * @return structured output, serialized as JSON for the responder and the client
     * @throws Exception any provider failure; the dispatcher isolates it
     */
    Object invoke(ToolRequest request) throws Exception;
}
