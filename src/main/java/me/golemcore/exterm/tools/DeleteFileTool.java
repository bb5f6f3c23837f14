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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Deletes a single file. Directories are refused.
 */
@Component
public class DeleteFileTool extends AbstractFileTool {

    public DeleteFileTool(WorkspacePaths workspace) {
        super(workspace);
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.DELETE_FILE;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Delete a file from the filesystem")
                .inputSchema(ToolDefinition.objectSchema(Map.of(
                        PARAM_PATH, ToolDefinition.property("string", PATH_DESCRIPTION)),
                        List.of(PARAM_PATH)))
                .build();
    }

    @Override
    protected String failurePrefix() {
        return "Failed to delete file";
    }

    @Override
    protected ToolResult apply(Path path, Map<String, Object> parameters) throws IOException {
        if (!Files.exists(path)) {
            return ToolResult.failure("File not found: " + relative(path));
        }
        if (Files.isDirectory(path)) {
            return ToolResult.failure("Not a file: " + relative(path));
        }
        Files.delete(path);
        return ToolResult.success("File deleted successfully")
                .with("path", relative(path));
    }
}
