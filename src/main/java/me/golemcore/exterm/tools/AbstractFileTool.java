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
import me.golemcore.exterm.domain.model.ToolResult;
import me.golemcore.exterm.domain.tool.ToolContext;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Common flow for the workspace file tools: read {@code path}, resolve it
 * inside the workspace, run the operation and turn I/O failures into failed
 * results.
 */
@Slf4j
abstract class AbstractFileTool implements ToolComponent {

    static final String PARAM_PATH = "path";
    static final String PATH_DESCRIPTION = "File path (relative to the workspace directory)";

    protected final WorkspacePaths workspace;

    protected AbstractFileTool(WorkspacePaths workspace) {
        this.workspace = workspace;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolContext context) {
        return CompletableFuture.supplyAsync(() -> {
            String pathStr = ToolArguments.string(parameters, PARAM_PATH);
            if (pathStr == null || pathStr.isBlank()) {
                pathStr = defaultPath();
            }
            if (pathStr == null) {
                return ToolResult.failure("Missing required parameter: 'path'");
            }

            Path path = workspace.resolve(pathStr);
            if (path == null) {
                log.warn("[Tools] {} rejected path outside workspace: {}", getToolName(), pathStr);
                return ToolResult.failure("Invalid path: must be within workspace");
            }

            try {
                ToolResult result = apply(path, parameters);
                log.debug("[Tools] {} on {}: success={}", getToolName(), pathStr, result.isSuccess());
                return result;
            } catch (IOException e) {
                log.warn("[Tools] {} failed on {}: {}", getToolName(), pathStr, e.getMessage());
                return ToolResult.failure(failurePrefix() + ": " + describe(e));
            }
        });
    }

    /**
     * Path used when the model omits {@code path}; {@code null} makes it
     * required.
     */
    protected String defaultPath() {
        return null;
    }

    protected abstract String failurePrefix();

    protected abstract ToolResult apply(Path path, Map<String, Object> parameters) throws IOException;

    protected String relative(Path path) {
        return workspace.relative(path);
    }

    protected static ToolResult missing(String parameter) {
        return ToolResult.failure("Missing required parameter: '" + parameter + "'");
    }

    private static String describe(IOException e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }
}
