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
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Replaces an inclusive, 1-based range of lines with new content. An end line
 * past the end of the file is clamped.
 */
@Component
public class EditLinesTool extends AbstractFileTool {

    public EditLinesTool(WorkspacePaths workspace) {
        super(workspace);
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.EDIT_LINES;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Replace a range of lines in a file with new content.")
                .inputSchema(ToolDefinition.objectSchema(Map.of(
                        PARAM_PATH, ToolDefinition.property("string", PATH_DESCRIPTION),
                        "start_line", ToolDefinition.property("integer", "First line to replace (1-based)"),
                        "end_line", ToolDefinition.property("integer", "Last line to replace (inclusive)"),
                        "new_content", ToolDefinition.property("string", "Replacement text for the range")),
                        List.of(PARAM_PATH, "start_line", "end_line", "new_content")))
                .build();
    }

    @Override
    protected String failurePrefix() {
        return "Failed to edit lines";
    }

    @Override
    protected ToolResult apply(Path path, Map<String, Object> parameters) throws IOException {
        Integer startLine = ToolArguments.optionalInteger(parameters, "start_line");
        Integer endLine = ToolArguments.optionalInteger(parameters, "end_line");
        String newContent = ToolArguments.string(parameters, "new_content");
        if (startLine == null) {
            return missing("start_line");
        }
        if (endLine == null) {
            return missing("end_line");
        }
        if (newContent == null) {
            return missing("new_content");
        }
        if (!Files.isRegularFile(path)) {
            return ToolResult.failure("File not found: " + relative(path));
        }

        List<String> lines = Arrays.asList(Files.readString(path, StandardCharsets.UTF_8).split("\n", -1));
        int totalLines = lines.size();
        if (startLine < 1 || endLine < startLine || startLine > totalLines) {
            return ToolResult.failure("Invalid line numbers. File has " + totalLines + " lines. Start: "
                    + startLine + ", End: " + endLine);
        }

        int startIdx = startLine - 1;
        int endIdx = Math.min(endLine - 1, totalLines - 1);
        List<String> edited = new ArrayList<>(lines.subList(0, startIdx));
        edited.addAll(Arrays.asList(newContent.split("\n", -1)));
        edited.addAll(lines.subList(endIdx + 1, totalLines));
        Files.writeString(path, String.join("\n", edited), StandardCharsets.UTF_8);

        return ToolResult.success("Lines " + startLine + "-" + endLine + " edited successfully")
                .with("path", relative(path))
                .with("lines_affected", endIdx - startIdx + 1)
                .with("new_total_lines", edited.size());
    }
}
