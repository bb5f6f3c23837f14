package me.golemcore.exterm.domain.tool;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.exterm.domain.component.ToolComponent;
import me.golemcore.exterm.domain.model.ToolDefinition;
import me.golemcore.exterm.domain.model.ToolFailureKind;
import me.golemcore.exterm.domain.model.ToolResult;
import me.golemcore.exterm.infrastructure.config.ExtermProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dispatch table from {@link ToolKind} to its handler.
 *
 * <p>
 * {@link #execute} never throws: malformed arguments, unknown names, handler
 * exceptions and timeouts all come back as failed {@link ToolResult}s so the
 * tool loop can feed them to the model and keep going.
 */
@Component
@Slf4j
public class ToolDispatcher {

    public static final String INVALID_ARGUMENTS = "Invalid function arguments";

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final Map<ToolKind, ToolComponent> handlers = new EnumMap<>(ToolKind.class);
    private final ObjectMapper objectMapper;
    private final Duration toolTimeout;

    public ToolDispatcher(List<ToolComponent> tools, ObjectMapper objectMapper, ExtermProperties properties) {
        this.objectMapper = objectMapper;
        this.toolTimeout = properties.getSession().getToolTimeout();
        for (ToolComponent tool : tools) {
            if (!tool.isEnabled()) {
                log.info("[Tools] Skipping disabled {}: {}", tool.getComponentType(), tool.getToolName());
                continue;
            }
            ToolComponent previous = handlers.put(tool.getKind(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for tool " + tool.getToolName());
            }
        }
        log.info("[Tools] Registered {} tools: {}", handlers.size(), handlers.keySet());
    }

    /**
     * Definitions advertised to the model, in {@link ToolKind} declaration order.
     */
    public List<ToolDefinition> getDefinitions() {
        return handlers.values().stream()
                .map(ToolComponent::getDefinition)
                .toList();
    }

    public Map<ToolKind, ToolComponent> getHandlers() {
        return Collections.unmodifiableMap(handlers);
    }

    public ToolResult execute(String name, String arguments, ToolContext context) {
        Map<String, Object> parameters;
        try {
            parameters = parseArguments(arguments);
        } catch (JsonProcessingException e) {
            log.warn("[Tools] Invalid arguments for '{}': {}", name, e.getOriginalMessage());
            parameters = null;
        }
        if (parameters == null) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, INVALID_ARGUMENTS);
        }

        ToolKind kind = ToolKind.fromName(name);
        ToolComponent handler = handlers.get(kind);
        if (kind == ToolKind.UNKNOWN || handler == null) {
            log.warn("[Tools] Unknown tool requested: '{}'", name);
            return ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL, "Unknown tool: " + (name != null ? name : ""));
        }

        log.debug("[Tools] Executing '{}' for session {}", name, context.getSessionId());
        try {
            CompletableFuture<ToolResult> future = handler.execute(parameters, context);
            ToolResult result = future.get(toolTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return ToolResult.failure("Tool returned no result: " + name);
            }
            return result;
        } catch (TimeoutException e) {
            log.warn("[Tools] Tool '{}' timed out after {}", name, toolTimeout);
            return ToolResult.failure(ToolFailureKind.TIMEOUT,
                    "Tool execution timed out after " + toolTimeout.toSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure("Tool execution interrupted");
        } catch (ExecutionException e) {
            log.error("[Tools] Tool execution failed: {}", name, e.getCause());
            return ToolResult.failure("Tool execution failed: " + safeCauseMessage(e));
        } catch (RuntimeException e) { // NOSONAR - handler bugs must not escape the tool loop
            log.error("[Tools] Tool execution failed: {}", name, e);
            return ToolResult.failure("Tool execution failed: " + safeCauseMessage(e));
        }
    }

    private Map<String, Object> parseArguments(String arguments) throws JsonProcessingException {
        if (arguments == null || arguments.isBlank()) {
            return Map.of();
        }
        // a literal "null" parses to null and is rejected by the caller
        return objectMapper.readValue(arguments, ARGUMENTS_TYPE);
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && !cause.equals(cursor)) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
