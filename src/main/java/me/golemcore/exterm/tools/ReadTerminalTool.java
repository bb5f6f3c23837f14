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

import lombok.extern.slf4j.Slf4j;
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

/**
 * Reads recent output and commands from the terminal attached to the chat.
 */
@Component
@Slf4j
public class ReadTerminalTool implements ToolComponent {

    private final TerminalPort terminalPort;
    private final int defaultLines;
    private final int maxLines;

    public ReadTerminalTool(TerminalPort terminalPort, ExtermProperties properties) {
        this.terminalPort = terminalPort;
        ExtermProperties.TerminalToolProperties config = properties.getTools().getTerminal();
        this.defaultLines = config.getDefaultReadLines();
        this.maxLines = config.getMaxReadLines();
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.READ_TERMINAL;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Read the current terminal output and recent command history "
                        + "to understand what's happening in the terminal")
                .inputSchema(ToolDefinition.objectSchema(Map.of(
                        "lines", ToolDefinition.property("integer",
                                "Number of recent output lines to read (default: " + defaultLines
                                        + ", max: " + maxLines + ")")),
                        null))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolContext context) {
        return CompletableFuture.supplyAsync(() -> {
            int lines = ToolArguments.clamp(ToolArguments.integer(parameters, "lines", defaultLines), 1, maxLines);
            TerminalPort.ReadResult read = terminalPort.read(context.getSessionId(), lines);
            if (!read.success()) {
                return ToolResult.failure(read.error());
            }
            log.debug("[Tools] read_terminal returned {} entries", read.entries().size());
            return ToolResult.success()
                    .with("terminal_output", TerminalEntryFormatter.format(read.entries()))
                    .with("entry_count", read.entries().size())
                    .with("note", "Recent terminal output and commands");
        });
    }
}
