package me.golemcore.agent.tools;

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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Resolves tool-supplied paths inside the workspace root. Returns null for
 * anything that escapes it, logically or through a symlink.
 */
@Slf4j
final class WorkspacePaths {

    private WorkspacePaths() {
    }

    static Path resolveSafePath(Path workspaceRoot, String pathStr) {
        if (pathStr == null || pathStr.isBlank()) {
            return null;
        }
        try {
            Path resolved = workspaceRoot.resolve(pathStr).normalize();
            if (!resolved.startsWith(workspaceRoot)) {
                return null;
            }

            // Follow symlinks of the deepest existing ancestor
            Path existing = resolved;
            while (existing != null && !Files.exists(existing)) {
                existing = existing.getParent();
            }
            if (existing != null && Files.exists(workspaceRoot)) {
                Path realPath = existing.toRealPath();
                if (!realPath.startsWith(workspaceRoot.toRealPath())) {
                    log.warn("[Workspace] Symlink escape blocked: {} -> {}", resolved, realPath);
                    return null;
                }
            }
            return resolved;
        } catch (InvalidPathException e) {
            return null;
        } catch (IOException e) {
            log.warn("[Workspace] Failed to resolve real path: {}", pathStr);
            return null;
        }
    }

    static String relativePath(Path workspaceRoot, Path path) {
        return workspaceRoot.relativize(path).toString();
    }
}
