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
import me.golemcore.toolrunner.domain.model.CancellationSignal;
import me.golemcore.toolrunner.domain.model.ToolContext;
import me.golemcore.toolrunner.domain.model.ToolDefinition;
import me.golemcore.toolrunner.domain.model.ToolFailureKind;
import me.golemcore.toolrunner.domain.model.ToolOutput;
import me.golemcore.toolrunner.infrastructure.config.ToolRunnerProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tool for executing shell commands.
 *
 * <p>
 * Commands execute via {@code /bin/sh -c} in the call's working directory (or
 * the workspace) with a sanitized environment. Each output line is reported as
 * progress while the command runs. Raising the call's cancellation signal
 * terminates the child process.
 *
 * <p>
 * Security:
 * <ul>
 * <li>Blocked commands: rm -rf /, sudo su, mkfs, shutdown, etc.
 * <li>Blocked patterns: curl|sh, eval, writes to /dev, etc.
 * <li>Configurable timeout (default 30s, max 300s)
 * <li>Output truncation (max 100K characters)
 * </ul>
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code toolrunner.tools.shell.enabled} - Enable/disable
 * <li>{@code toolrunner.tools.shell.default-timeout} - Default timeout
 * (seconds)
 * <li>{@code toolrunner.tools.shell.max-timeout} - Max timeout (seconds)
 * </ul>
 */
@Component
@Slf4j
public class ShellTool implements ToolComponent {

    static final String NAME = "run_command";

    private static final String PARAM_TYPE = "type";
    private static final String PARAM_COMMAND = "command";
    private static final String TYPE_STRING = "string";
    private static final String TYPE_INTEGER = "integer";

    private static final int MAX_OUTPUT_LENGTH = 100_000;

    private final WorkspacePathResolver pathResolver;
    private final boolean enabled;
    private final int defaultTimeout;
    private final int maxTimeout;
    private final ExecutorService executor;

    public ShellTool(WorkspacePathResolver pathResolver, ToolRunnerProperties properties) {
        ToolRunnerProperties.ShellToolProperties config = properties.getTools().getShell();
        this.pathResolver = pathResolver;
        this.enabled = config.isEnabled();
        this.defaultTimeout = config.getDefaultTimeout();
        this.maxTimeout = config.getMaxTimeout();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "shell-tool");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Shell] Executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("""
                        Execute a shell command and return its combined stdout/stderr.
                        Commands run with timeout protection (default 30s, max 300s).
                        Dangerous system commands are blocked (rm -rf /, shutdown, passwd, etc.).
                        """)
                .inputSchema(Map.of(
                        PARAM_TYPE, "object",
                        "properties", Map.of(
                                PARAM_COMMAND, Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        "description", "Shell command to execute"),
                                "timeout", Map.of(
                                        PARAM_TYPE, TYPE_INTEGER,
                                        "description", "Timeout in seconds (default: 30, max: 300)"),
                                "workdir", Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        "description", "Working directory (optional)")),
                        "required", List.of(PARAM_COMMAND)))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> arguments, ToolContext context) {
        return CompletableFuture.supplyAsync(() -> {
            Object rawCommand = arguments.get(PARAM_COMMAND);
            String command = rawCommand != null ? rawCommand.toString() : null;
            if (command == null || command.isBlank()) {
                return ToolOutput.failure("Missing required parameter: command");
            }
            log.info("[Shell] Command: '{}'", truncate(command, 200));

            if (ShellCommandPolicy.isBlocked(command)) {
                log.warn("[Shell] Blocked command: {}", command);
                return ToolOutput.failure(ShellCommandPolicy.BLOCKED_MESSAGE);
            }

            int timeout = defaultTimeout;
            Object timeoutObj = arguments.get("timeout");
            if (timeoutObj instanceof Number number) {
                timeout = Math.max(1, Math.min(number.intValue(), maxTimeout));
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

            return executeCommand(command, workDir, timeout, context);
        }, executor);
    }

    private ToolOutput executeCommand(String command, Path workDir, int timeoutSeconds, ToolContext context) {
        ProcessBuilder pb = ShellCommandPolicy.processBuilder(command, workDir);
        pb.redirectErrorStream(true);

        CancellationSignal cancellation = context != null && context.getCancellation() != null
                ? context.getCancellation()
                : CancellationSignal.create();
        if (cancellation.isCancelled()) {
            return ToolOutput.failure(ToolFailureKind.CANCELLED, "Command cancelled before start");
        }

        long startTime = System.currentTimeMillis();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return ToolOutput.failure("Failed to start command: " + e.getMessage());
        }

        try (CancellationSignal.Registration ignored = cancellation
                .onCancel(() -> ShellCommandPolicy.terminate(process))) {
            Future<String> outputFuture = executor.submit(() -> readOutput(process, context));

            boolean completed = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            long duration = System.currentTimeMillis() - startTime;

            if (cancellation.isCancelled()) {
                ShellCommandPolicy.terminate(process);
                log.info("[Shell] Command cancelled after {}ms", duration);
                return ToolOutput.failure(ToolFailureKind.CANCELLED, "Command cancelled");
            }
            if (!completed) {
                ShellCommandPolicy.terminate(process);
                return ToolOutput.failure("Command timed out after " + timeoutSeconds + " seconds");
            }

            String output;
            try {
                output = outputFuture.get(1, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                output = "[Output read timeout]";
            } catch (ExecutionException e) {
                output = "[Output read failed: " + e.getCause().getMessage() + "]";
            }

            int exitCode = process.exitValue();
            if (output.length() > MAX_OUTPUT_LENGTH) {
                output = output.substring(0, MAX_OUTPUT_LENGTH) + "\n[Output truncated...]";
            }
            log.info("[Shell] Command finished: exitCode={}, duration={}ms", exitCode, duration);

            Map<String, Object> metadata = Map.of(
                    "exitCode", exitCode,
                    "duration", duration,
                    "workdir", workDir.toString());
            if (exitCode == 0) {
                return ToolOutput.success(output.isEmpty() ? "(no output)" : output, metadata);
            }
            return ToolOutput.failure("Exit code: " + exitCode + "\n" + output).toBuilder()
                    .metadata(Map.of(
                            ToolOutput.FAILURE_KIND, ToolFailureKind.EXECUTION_FAILED.name(),
                            "exitCode", exitCode,
                            "duration", duration))
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ShellCommandPolicy.terminate(process);
            return ToolOutput.failure(ToolFailureKind.CANCELLED, "Command interrupted");
        }
    }

    private String readOutput(Process process, ToolContext context) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                if (output.length() < MAX_OUTPUT_LENGTH) {
                    output.append(line).append("\n");
                }
                if (context != null) {
                    context.reportProgress(line);
                }
                line = reader.readLine();
            }
        }
        return output.toString();
    }

    private String truncate(String text, int maxLen) {
        if (text.length() <= maxLen) {
            return text;
        }
        return text.substring(0, maxLen) + "...";
    }
}
