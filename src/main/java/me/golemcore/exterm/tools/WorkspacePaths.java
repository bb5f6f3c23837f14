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
import me.golemcore.exterm.infrastructure.config.ExtermProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves tool-supplied paths inside the sandboxed workspace.
 *
 * <p>
 * Relative paths are resolved against the workspace root; absolute paths are
 * accepted only if they already point inside it. Existing paths are checked
 * again after following symlinks.
 */
@Component
@Slf4j
public class WorkspacePaths {

    private final Path workspaceRoot;

    public WorkspacePaths(ExtermProperties properties) {
        this(Paths.get(properties.getTools().getFilesystem().getWorkspace()));
    }

    WorkspacePaths(Path root) {
        this.workspaceRoot = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(workspaceRoot);
            log.info("[Tools] File workspace: {}", workspaceRoot);
        } catch (IOException e) {
            log.error("[Tools] Failed to create workspace directory: {}", workspaceRoot, e);
        }
    }

    public Path getRoot() {
        return workspaceRoot;
    }

    /**
     * Returns the resolved path, or {@code null} if it escapes the workspace or
     * is not a valid path.
     */
    public Path resolve(String pathStr) {
        try {
            Path resolved = workspaceRoot.resolve(pathStr).normalize();
            if (!resolved.startsWith(workspaceRoot)) {
                return null;
            }

            if (Files.exists(resolved)) {
                Path realPath = resolved.toRealPath();
                Path realWorkspace = workspaceRoot.toRealPath();
                if (!realPath.startsWith(realWorkspace)) {
                    log.warn("[Tools] Symlink escape blocked: {} -> {}", resolved, realPath);
                    return null;
                }
            }
            return resolved;
        } catch (InvalidPathException e) {
            return null;
        } catch (IOException e) {
            log.warn("[Tools] Failed to resolve real path: {}", pathStr);
            return null;
        }
    }

    public String relative(Path path) {
        String relative = workspaceRoot.relativize(path).toString();
        return relative.isEmpty() ? "." : relative;
    }
}
