package com.example.FolioAgent.tools;

import com.example.FolioAgent.model.Intent;

/**
 * Input handed to a tool provider.
 *
 * @param query  the user's question
 * @param intent resolved intent of the request
 */
public record ToolRequest(String query, Intent intent) {
}
