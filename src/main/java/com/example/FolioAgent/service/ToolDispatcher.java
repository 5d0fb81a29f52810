package com.example.FolioAgent.service;

import com.example.FolioAgent.config.AgentProperties;
import com.example.FolioAgent.exception.RequestCancelledException;
import com.example.FolioAgent.model.EventType;
import com.example.FolioAgent.model.Intent;
import com.example.FolioAgent.model.RequestState;
import com.example.FolioAgent.model.ToolInvocation;
import com.example.FolioAgent.tools.AiToolDefinition;
import com.example.FolioAgent.tools.ToolFunction;
import com.example.FolioAgent.tools.ToolRegistry;
import com.example.FolioAgent.tools.ToolRequest;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Picks and invokes tool providers for a request.
 * <p>
 * Each call is isolated: a failing or slow provider produces a failed {@link ToolInvocation}
 * and a note in the request metadata, never an exception to the orchestrator.
 */
@Service
@RequiredArgsConstructor
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    static final String STAGE = "dispatch";
    static final String TOOLS_KEY = "tools";
    static final String TOOL_ERRORS_KEY = "toolErrors";

    private final ToolRegistry toolRegistry;
    private final StageExecutor stageExecutor;
    private final EventEmitter eventEmitter;
    private final AgentProperties properties;

    /**
     * Tool the question explicitly asks for, else the default tool of the intent.
     */
    public Optional<String> select(Intent intent, String query) {
        String normalized = query == null ? "" : query.toLowerCase(Locale.ROOT);
        for (AiToolDefinition def : toolRegistry.allTools()) {
            for (String keyword : def.triggerKeywords()) {
                if (containsPhrase(normalized, keyword)) {
                    return Optional.of(def.name());
                }
            }
        }
        if (intent == null) {
            return Optional.empty();
        }
        return toolRegistry.getToolsForIntent(intent).stream()
                .findFirst()
                .map(AiToolDefinition::name);
    }

    /**
     * @return the invocation record, or empty when there is no such tool or the per-request cap is reached
     * @throws RequestCancelledException when the request is cancelled while the tool runs
     */
    public Optional<ToolInvocation> dispatch(String toolId, RequestState state) {
        if (toolId == null || toolId.isBlank()) {
            return Optional.empty();
        }
        Optional<AiToolDefinition> definition = toolRegistry.findByName(toolId);
        Optional<ToolFunction> function = definition.flatMap(toolRegistry::findFunction);
        if (function.isEmpty()) {
            log.debug("No tool registered under '{}'", toolId);
            appendNote(state, TOOL_ERRORS_KEY, toolId + ": no such tool");
            return Optional.empty();
        }

        int cap = properties.getTools().getMaxInvocationsPerRequest();
        if (state.toolInvocations().size() >= cap) {
            log.debug("Tool '{}' skipped: {} invocation(s) already made, cap is {}",
                    toolId, state.toolInvocations().size(), cap);
            appendNote(state, TOOL_ERRORS_KEY, toolId + ": per-request tool cap of " + cap + " reached");
            return Optional.empty();
        }

        ToolRequest request = new ToolRequest(state.userQuery(), state.intent());
        long started = System.currentTimeMillis();
        ToolInvocation invocation;
        try {
            Object output = stageExecutor.run(state, STAGE, properties.getTimeouts().getDispatch(),
                    () -> function.get().invoke(request));
            invocation = ToolInvocation.success(toolId, state.userQuery(), output, System.currentTimeMillis() - started);
        } catch (RequestCancelledException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("Tool '{}' failed: {}", toolId, ex.toString());
            invocation = ToolInvocation.failure(toolId, state.userQuery(), ex.getMessage(), System.currentTimeMillis() - started);
            appendNote(state, TOOL_ERRORS_KEY, toolId + ": " + ex.getMessage());
        }

        state.addToolInvocation(invocation);
        appendNote(state, TOOLS_KEY, summarize(invocation));

        eventEmitter.emit(state, EventType.TOOL,
                invocation.succeeded() ? "Called tool " + toolId + "." : "Tool " + toolId + " was unavailable.",
                summarize(invocation));
        return Optional.of(invocation);
    }

    private Map<String, Object> summarize(ToolInvocation invocation) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("toolId", invocation.toolId());
        summary.put("succeeded", invocation.succeeded());
        summary.put("durationMs", invocation.durationMs());
        if (invocation.error() != null) {
            summary.put("error", invocation.error());
        }
        return summary;
    }

    @SuppressWarnings("unchecked")
    private static void appendNote(RequestState state, String key, Object note) {
        Object existing = state.metadata(key);
        List<Object> notes = existing instanceof List<?> list ? new ArrayList<>((List<Object>) list) : new ArrayList<>();
        notes.add(note);
        state.putMetadata(key, List.copyOf(notes));
    }

    private static boolean containsPhrase(String text, String phrase) {
        return Pattern.compile("(?<![a-z0-9])" + Pattern.quote(phrase.toLowerCase(Locale.ROOT)) + "(?![a-z0-9])")
                .matcher(text)
                .find();
    }
}
