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
import java.util.List;
import java.util.Map;

/**
 * Literal search and replace. Matches are taken left to right without
 * overlapping, and replacement text is never searched again.
 */
@Component
public class FindAndReplaceInFileTool extends AbstractFileTool {

    public FindAndReplaceInFileTool(WorkspacePaths workspace) {
        super(workspace);
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.FIND_AND_REPLACE_IN_FILE;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Find and replace text in a file using exact literal matching. "
                        + "Use this instead of sed for targeted edits.")
                .inputSchema(ToolDefinition.objectSchema(Map.of(
                        PARAM_PATH, ToolDefinition.property("string", PATH_DESCRIPTION),
                        "search_text", ToolDefinition.property("string",
                                "Exact text to find and replace (literal match)"),
                        "replace_text", ToolDefinition.property("string", "Text to replace it with"),
                        "max_replacements", ToolDefinition.property("integer",
                                "Maximum number of replacements to make (default: all)")),
                        List.of(PARAM_PATH, "search_text", "replace_text")))
                .build();
    }

    @Override
    protected String failurePrefix() {
        return "Error processing file";
    }

    @Override
    protected ToolResult apply(Path path, Map<String, Object> parameters) throws IOException {
        String searchText = ToolArguments.string(parameters, "search_text");
        String replaceText = ToolArguments.string(parameters, "replace_text");
        if (searchText == null || searchText.isEmpty()) {
            return missing("search_text");
        }
        if (replaceText == null) {
            return missing("replace_text");
        }
        if (!Files.isRegularFile(path)) {
            return ToolResult.failure("File not found: " + relative(path));
        }

        Integer limit = ToolArguments.optionalInteger(parameters, "max_replacements");
        int maxReplacements = limit != null && limit > 0 ? limit : Integer.MAX_VALUE;

        String content = Files.readString(path, StandardCharsets.UTF_8);
        StringBuilder result = new StringBuilder(content.length());
        int count = 0;
        int from = 0;
        int match = content.indexOf(searchText);
        while (match >= 0 && count < maxReplacements) {
            result.append(content, from, match).append(replaceText);
            from = match + searchText.length();
            count++;
            match = content.indexOf(searchText, from);
        }
        result.append(content, from, content.length());

        if (count == 0) {
            return ToolResult.success("No occurrences of '" + searchText + "' found in " + relative(path))
                    .with("replacements_made", 0);
        }
        Files.writeString(path, result.toString(), StandardCharsets.UTF_8);
        return ToolResult.success("Successfully replaced " + count + " occurrence(s) in " + relative(path))
                .with("replacements_made", count);
    }
}
