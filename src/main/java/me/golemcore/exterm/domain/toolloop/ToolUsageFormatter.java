package me.golemcore.exterm.domain.toolloop;

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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.exterm.domain.model.ToolCall;
import me.golemcore.exterm.domain.tool.ToolKind;

import java.net.URI;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the short human-readable line shown in the chat while tools run.
 */
public class ToolUsageFormatter {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public String summarize(List<ToolCall> toolCalls) {
        if (toolCalls.size() == 1) {
            return summarize(toolCalls.get(0));
        }
        String names = toolCalls.stream()
                .map(ToolCall::getName)
                .collect(Collectors.joining(", "));
        return "Using " + toolCalls.size() + " tools: " + names;
    }

    private String summarize(ToolCall toolCall) {
        ToolKind kind = ToolKind.fromName(toolCall.getName());
        return switch (kind) {
        case BROWSE_WEB -> "Browsing web: " + extractHost(argument(toolCall, "url", "")) + "...";
        case SEARCH_WEB -> "Searching web for \"" + argument(toolCall, "query", "information") + "\"...";
        default -> "Using " + toolCall.getName() + " tool";
        };
    }

    private String argument(ToolCall toolCall, String field, String fallback) {
        String arguments = toolCall.getArguments();
        if (arguments == null || arguments.isBlank()) {
            return fallback;
        }
        try {
            JsonNode node = objectMapper.readTree(arguments).path(field);
            return node.isTextual() ? node.asText() : fallback;
        } catch (JsonProcessingException e) {
            return fallback;
        }
    }

    static String extractHost(String url) {
        if (!url.contains(".")) {
            return url;
        }
        try {
            String absolute = url.startsWith("http") ? url : "https://" + url;
            String host = URI.create(absolute).getHost();
            return host != null ? host : url;
        } catch (IllegalArgumentException e) {
            return url;
        }
    }
}
