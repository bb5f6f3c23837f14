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
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Proposes a command for the user to approve. Nothing is executed.
 */
@Component
public class SuggestTerminalCommandTool implements ToolComponent {

    @Override
    public ToolKind getKind() {
        return ToolKind.SUGGEST_TERMINAL_COMMAND;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Suggest a terminal command for user approval. The command will not be executed "
                        + "immediately - user must approve it first.")
                .inputSchema(ToolDefinition.objectSchema(Map.of(
                        "command", ToolDefinition.property("string",
                                "The command to suggest (e.g., 'ls -la', 'pwd', 'cat filename.txt')"),
                        "reason", ToolDefinition.property("string",
                                "Explanation of why this command would be helpful")),
                        List.of("command", "reason")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolContext context) {
        String command = ToolArguments.string(parameters, "command");
        if (command == null || command.isBlank()) {
            return CompletableFuture.completedFuture(ToolResult.failure("Missing required parameter: 'command'"));
        }
        return CompletableFuture.completedFuture(ToolResult.success("Command suggestion created")
                .with("command", command)
                .with("reason", ToolArguments.string(parameters, "reason"))
                .with("status", "awaiting_approval")
                .with("note", "This command is awaiting user approval before execution."));
    }
}
