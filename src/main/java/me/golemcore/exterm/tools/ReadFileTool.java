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

import me.golemcore.exterm.domain.model.ToolDefinition;
import me.golemcore.exterm.domain.model.ToolResult;
import me.golemcore.exterm.domain.tool.ToolKind;
import me.golemcore.exterm.infrastructure.config.ExtermProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Reads a text file, optionally a window of lines from it. A window is capped
 * at the configured maximum; without one the whole file is returned.
 */
@Component
public class ReadFileTool extends AbstractFileTool {

    private final int maxLines;

    public ReadFileTool(WorkspacePaths workspace, ExtermProperties properties) {
        super(workspace);
        this.maxLines = properties.getTools().getFilesystem().getMaxReadLines();
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.READ_FILE;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Read content from a file. Use this instead of cat/less/more commands.")
                .inputSchema(ToolDefinition.objectSchema(Map.of(
                        PARAM_PATH, ToolDefinition.property("string", PATH_DESCRIPTION),
                        "lines", ToolDefinition.property("integer",
                                "Number of lines to read (default: all, max: " + maxLines + ")"),
                        "start_line", ToolDefinition.property("integer",
                                "Starting line number (1-based, default: 1)")),
                        List.of(PARAM_PATH)))
                .build();
    }

    @Override
    protected String failurePrefix() {
        return "Failed to read file";
    }

    @Override
    protected ToolResult apply(Path path, Map<String, Object> parameters) throws IOException {
        if (!Files.exists(path)) {
            return ToolResult.failure("File not found: " + relative(path));
        }
        if (!Files.isRegularFile(path)) {
            return ToolResult.failure("Not a file: " + relative(path));
        }

        String content = Files.readString(path, StandardCharsets.UTF_8);
        List<String> lines = Arrays.asList(content.split("\n", -1));
        int totalLines = lines.size();

        Integer startLine = ToolArguments.optionalInteger(parameters, "start_line");
        Integer count = ToolArguments.optionalInteger(parameters, "lines");
        if (startLine == null && count == null) {
            return ToolResult.success()
                    .with("content", content)
                    .with("path", relative(path))
                    .with("total_lines", totalLines);
        }

        int startIdx = Math.max(0, (startLine != null ? startLine : 1) - 1);
        if (startIdx >= totalLines) {
            return ToolResult.failure("Start line " + (startIdx + 1) + " is beyond end of file ("
                    + totalLines + " lines)");
        }
        int window = ToolArguments.clamp(count != null ? count : maxLines, 1, maxLines);
        int endIdx = Math.min(totalLines, startIdx + window);

        return ToolResult.success()
                .with("content", String.join("\n", lines.subList(startIdx, endIdx)))
                .with("path", relative(path))
                .with("lines_shown", (startIdx + 1) + "-" + endIdx)
                .with("total_lines", totalLines);
    }
}
