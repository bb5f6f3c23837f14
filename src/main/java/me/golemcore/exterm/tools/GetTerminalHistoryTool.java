package me.golemcore.exterm.tools;

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

import me.golemcore.exterm.domain.component.ToolComponent;
import me.golemcore.exterm.domain.model.ToolDefinition;
import me.golemcore.exterm.domain.model.ToolResult;
import me.golemcore.exterm.domain.tool.ToolContext;
import me.golemcore.exterm.domain.tool.ToolKind;
import me.golemcore.exterm.infrastructure.config.ExtermProperties;
import me.golemcore.exterm.port.outbound.TerminalPort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
public class GetTerminalHistoryTool implements ToolComponent {

    private static final int DEFAULT_LINES = 20;

    private final TerminalPort terminalPort;
    private final int maxLines;

    public GetTerminalHistoryTool(TerminalPort terminalPort, ExtermProperties properties) {
        this.terminalPort = terminalPort;
        this.maxLines = properties.getTools().getTerminal().getMaxHistoryLines();
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.GET_TERMINAL_HISTORY;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Get recent terminal command history and outputs for context")
                .inputSchema(ToolDefinition.objectSchema(Map.of(
                        "lines", ToolDefinition.property("integer",
                                "Number of recent entries to retrieve (default: " + DEFAULT_LINES
                                        + ", max: " + maxLines + ")")),
                        null))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolContext context) {
        return CompletableFuture.supplyAsync(() -> {
            int lines = ToolArguments.clamp(ToolArguments.integer(parameters, "lines", DEFAULT_LINES), 1, maxLines);
            TerminalPort.ReadResult read = terminalPort.read(context.getSessionId(), lines);
            if (!read.success()) {
                return ToolResult.failure(read.error());
            }
            return ToolResult.success()
                    .with("history", TerminalEntryFormatter.format(read.entries()))
                    .with("entry_count", read.entries().size());
        });
    }
}
