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

import me.golemcore.toolrunner.domain.component.ToolComponent;
import me.golemcore.toolrunner.domain.model.ToolContext;
import me.golemcore.toolrunner.domain.model.ToolDefinition;
import me.golemcore.toolrunner.domain.model.ToolFailureKind;
import me.golemcore.toolrunner.domain.model.ToolOutput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Starts a long-running shell command without waiting for it. The returned
 * process id is used with {@code bash_output}, {@code kill_bash} and
 * {@code list_background}.
 */
@Component
@Slf4j
public class BashBackgroundTool implements ToolComponent {

    static final String NAME = "bash_background";

    private static final String TYPE = "type";
    private static final String STRING = "string";
    private static final String DESCRIPTION = "description";

    private final BackgroundProcessStore store;
    private final WorkspacePathResolver pathResolver;

    public BashBackgroundTool(BackgroundProcessStore store, WorkspacePathResolver pathResolver) {
        this.store = store;
        this.pathResolver = pathResolver;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("""
                        Start a long-running shell command in the background (dev servers, watchers, builds).
                        Returns a process id immediately. Read its output with bash_output and stop it with kill_bash.
                        """)
                .inputSchema(Map.of(
                        TYPE, "object",
                        "properties", Map.of(
                                "command", Map.of(TYPE, STRING, DESCRIPTION, "Shell command to run"),
                                DESCRIPTION, Map.of(TYPE, STRING,
                                        DESCRIPTION, "Short description of what the command does"),
                                "workdir", Map.of(TYPE, STRING, DESCRIPTION, "Working directory (optional)")),
                        "required", List.of("command")))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return store.isEnabled();
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> arguments, ToolContext context) {
        return CompletableFuture.supplyAsync(() -> {
            Object rawCommand = arguments.get("command");
            String command = rawCommand != null ? rawCommand.toString() : null;
            if (command == null || command.isBlank()) {
                return ToolOutput.failure("Missing required parameter: command");
            }
            if (ShellCommandPolicy.isBlocked(command)) {
                log.warn("[Background] Blocked command: {}", command);
                return ToolOutput.failure(ShellCommandPolicy.BLOCKED_MESSAGE);
            }
            if (context != null && context.isCancelled()) {
                return ToolOutput.failure(ToolFailureKind.CANCELLED, "Command cancelled before start");
            }

            Path workDir;
            try {
                Object workdirArg = arguments.get("workdir");
                workDir = pathResolver.resolve(workdirArg != null ? workdirArg.toString() : null, context);
            } catch (InvalidPathException e) {
                return ToolOutput.failure("Invalid working directory");
            }
            if (!Files.isDirectory(workDir)) {
                return ToolOutput.failure("Working directory does not exist: " + workDir);
            }

            Object rawDescription = arguments.get(DESCRIPTION);
            String description = rawDescription != null ? rawDescription.toString() : command;
            String session = BackgroundProcessStore.sessionOf(context);
            try {
                BackgroundProcess process = store.start(session, command, description, workDir);
                return ToolOutput.success("Started background process " + process.getId() + " (pid "
                        + process.getPid() + "): " + description
                        + "\nUse bash_output to check its output and kill_bash to stop it.",
                        Map.of("processId", process.getId(), "pid", process.getPid()));
            } catch (IllegalStateException e) {
                return ToolOutput.failure(ToolFailureKind.LIMIT_EXCEEDED, e.getMessage());
            } catch (IOException e) {
                return ToolOutput.failure("Failed to start command: " + e.getMessage());
            }
        });
    }
}
