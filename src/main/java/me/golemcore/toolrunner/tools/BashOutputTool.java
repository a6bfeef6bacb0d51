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
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads the recent output of a background process.
 */
@Component
public class BashOutputTool implements ToolComponent {

    static final String NAME = "bash_output";
    static final int DEFAULT_TAIL_LINES = 50;

    private static final String TYPE = "type";
    private static final String DESCRIPTION = "description";

    private final BackgroundProcessStore store;

    public BashOutputTool(BackgroundProcessStore store) {
        this.store = store;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Get the status and recent stdout/stderr of a background process.")
                .inputSchema(Map.of(
                        TYPE, "object",
                        "properties", Map.of(
                                "processId", Map.of(TYPE, "string",
                                        DESCRIPTION, "Id returned by bash_background"),
                                "tailLines", Map.of(TYPE, "integer",
                                        DESCRIPTION, "Number of recent lines to return (default: 50)"),
                                "filter", Map.of(TYPE, "string",
                                        DESCRIPTION, "Only return lines matching this regex")),
                        "required", List.of("processId")))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return store.isEnabled();
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> arguments, ToolContext context) {
        Object processId = arguments.get("processId");
        if (processId == null || processId.toString().isBlank()) {
            return CompletableFuture.completedFuture(ToolOutput.failure("Missing required parameter: processId"));
        }
        Optional<BackgroundProcess> found = store.find(BackgroundProcessStore.sessionOf(context),
                processId.toString());
        if (found.isEmpty()) {
            return CompletableFuture.completedFuture(ToolOutput.failure(ToolFailureKind.NOT_FOUND,
                    "Process " + processId + " not found. Use list_background to see running processes."));
        }

        int tailLines = DEFAULT_TAIL_LINES;
        if (arguments.get("tailLines") instanceof Number number) {
            tailLines = Math.max(1, number.intValue());
        }
        Pattern filter = null;
        Object rawFilter = arguments.get("filter");
        if (rawFilter != null && !rawFilter.toString().isEmpty()) {
            try {
                filter = Pattern.compile(rawFilter.toString());
            } catch (PatternSyntaxException e) {
                return CompletableFuture.completedFuture(
                        ToolOutput.failure("Invalid filter pattern: " + e.getDescription()));
            }
        }
        return CompletableFuture.completedFuture(render(found.get(), tailLines, filter));
    }

    private ToolOutput render(BackgroundProcess process, int tailLines, Pattern filter) {
        List<String> stdout = process.stdoutTail(tailLines, filter);
        List<String> stderr = process.stderrTail(tailLines, filter);

        StringBuilder text = new StringBuilder();
        text.append("Process ").append(process.getId()).append(": ").append(process.getDescription()).append('\n');
        text.append("Status: ").append(process.getStatus());
        if (process.getExitCode() != null) {
            text.append(" (exit code ").append(process.getExitCode()).append(')');
        }
        text.append("\nRuntime: ").append(process.runtimeSeconds(store.getClock())).append("s\n");
        text.append("\n--- stdout (").append(stdout.size()).append(" of ")
                .append(process.stdoutLineCount()).append(" lines) ---\n");
        stdout.forEach(line -> text.append(line).append('\n'));
        if (!stderr.isEmpty()) {
            text.append("\n--- stderr (").append(stderr.size()).append(" of ")
                    .append(process.stderrLineCount()).append(" lines) ---\n");
            stderr.forEach(line -> text.append(line).append('\n'));
        }
        return ToolOutput.success(text.toString(), Map.of(
                "processId", process.getId(),
                "status", process.getStatus().name()));
    }
}
