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
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Lists a directory, optionally recursively. Directories sort before files.
 */
@Component
public class ListFilesTool extends AbstractFileTool {

    static final int DEFAULT_MAX_DEPTH = 3;
    static final int MAX_ENTRIES = 500;

    private static final String TYPE_DIRECTORY = "directory";
    private static final String TYPE_FILE = "file";

    public ListFilesTool(WorkspacePaths workspace) {
        super(workspace);
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.LIST_FILES;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("List files and directories in a specified path")
                .inputSchema(ToolDefinition.objectSchema(Map.of(
                        PARAM_PATH, ToolDefinition.property("string",
                                "Directory path to list (default: workspace root)"),
                        "recursive", ToolDefinition.property("boolean",
                                "Whether to list files recursively (default: false)"),
                        "max_depth", ToolDefinition.property("integer",
                                "Maximum depth for recursive listing (default: " + DEFAULT_MAX_DEPTH + ")"),
                        "show_hidden", ToolDefinition.property("boolean",
                                "Whether to show hidden files (default: false)")),
                        null))
                .build();
    }

    @Override
    protected String defaultPath() {
        return ".";
    }

    @Override
    protected String failurePrefix() {
        return "Failed to list directory";
    }

    @Override
    protected ToolResult apply(Path path, Map<String, Object> parameters) throws IOException {
        if (!Files.exists(path)) {
            return ToolResult.failure("Failed to list directory: no such directory: " + relative(path));
        }
        if (!Files.isDirectory(path)) {
            return ToolResult.failure("Failed to list directory: not a directory: " + relative(path));
        }

        boolean recursive = ToolArguments.bool(parameters, "recursive", false);
        boolean showHidden = ToolArguments.bool(parameters, "show_hidden", false);
        int depth = recursive ? Math.max(1, ToolArguments.integer(parameters, "max_depth", DEFAULT_MAX_DEPTH)) : 1;

        List<Map<String, Object>> files;
        try (Stream<Path> stream = Files.walk(path, depth)) {
            files = stream
                    .filter(p -> !p.equals(path))
                    .filter(p -> showHidden || !isHidden(path.relativize(p)))
                    .map(p -> describe(path, p))
                    .sorted(Comparator.<Map<String, Object>, String>comparing(e -> (String) e.get("type"))
                            .thenComparing(e -> (String) e.get("name")))
                    .toList();
        }

        boolean truncated = files.size() > MAX_ENTRIES;
        if (truncated) {
            files = files.subList(0, MAX_ENTRIES);
        }
        return ToolResult.success()
                .with("path", relative(path))
                .with("files", files)
                .with("count", files.size())
                .with("truncated", truncated ? Boolean.TRUE : null);
    }

    private static boolean isHidden(Path relative) {
        for (Path segment : relative) {
            if (segment.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, Object> describe(Path base, Path file) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name", base.relativize(file).toString());
        try {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            entry.put("type", attrs.isDirectory() ? TYPE_DIRECTORY : TYPE_FILE);
            entry.put("size", attrs.size());
            entry.put("modified", attrs.lastModifiedTime().toInstant().toString());
        } catch (IOException e) {
            entry.put("type", TYPE_FILE);
            entry.put("modified", "unknown");
        }
        return entry;
    }
}
