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

@Component
public class CreateFileTool extends AbstractFileTool {

    public CreateFileTool(WorkspacePaths workspace) {
        super(workspace);
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.CREATE_FILE;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Create a new file with specified content. Use this instead of interactive "
                        + "editors like nano/vim.")
                .inputSchema(ToolDefinition.objectSchema(Map.of(
                        PARAM_PATH, ToolDefinition.property("string", PATH_DESCRIPTION),
                        "content", ToolDefinition.property("string", "File content to write")),
                        List.of(PARAM_PATH, "content")))
                .build();
    }

    @Override
    protected String failurePrefix() {
        return "Failed to create file";
    }

    @Override
    protected ToolResult apply(Path path, Map<String, Object> parameters) throws IOException {
        String content = ToolArguments.string(parameters, "content");
        if (content == null) {
            return missing("content");
        }
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        Files.write(path, bytes);
        return ToolResult.success("File created successfully at " + relative(path))
                .with("path", relative(path))
                .with("size", bytes.length);
    }
}
