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

package me.golemcore.toolrunner.tools;

import me.golemcore.toolrunner.domain.model.ToolContext;
import me.golemcore.toolrunner.infrastructure.config.ToolRunnerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves tool path arguments. Relative paths are taken against the call's
 * working directory, falling back to the configured workspace; absolute paths
 * are used as given.
 */
@Component
@Slf4j
public class WorkspacePathResolver {

    private static final String USER_HOME_PLACEHOLDER = "${user.home}";

    private final Path workspaceRoot;

    public WorkspacePathResolver(ToolRunnerProperties properties) {
        String workspace = properties.getTools().getWorkspace();
        if (workspace == null || workspace.isBlank()) {
            workspace = ".";
        }
        this.workspaceRoot = Paths.get(workspace.replace(USER_HOME_PLACEHOLDER, System.getProperty("user.home")))
                .toAbsolutePath()
                .normalize();

        try {
            Files.createDirectories(workspaceRoot);
            log.info("[FileSystem] Workspace: {}", workspaceRoot);
        } catch (IOException e) {
            log.error("[FileSystem] Failed to create workspace directory: {}", workspaceRoot, e);
        }
    }

    public Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    /**
     * Base directory for a call: its working directory, or the workspace.
     */
    public Path baseDirectory(ToolContext context) {
        if (context != null && context.getWorkingDirectory() != null) {
            return context.getWorkingDirectory().toAbsolutePath().normalize();
        }
        return workspaceRoot;
    }

    /**
     * @throws java.nio.file.InvalidPathException
     *             if the argument is not a valid path
     */
    public Path resolve(String path, ToolContext context) {
        Path base = baseDirectory(context);
        if (path == null || path.isBlank()) {
            return base;
        }
        Path candidate = Paths.get(path.strip());
        return candidate.isAbsolute() ? candidate.normalize() : base.resolve(candidate).normalize();
    }
}
