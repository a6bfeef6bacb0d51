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

/**
 * Stops a background process. {@code SIGTERM} gives the process two seconds
 * to exit before it is killed; {@code SIGKILL} kills it at once.
 */
@Component
public class KillBashTool implements ToolComponent {

    static final String NAME = "kill_bash";

    private final BackgroundProcessStore store;

    public KillBashTool(BackgroundProcessStore store) {
        this.store = store;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Stop a background process started with bash_background.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "processId", Map.of("type", "string",
                                        "description", "Id returned by bash_background"),
                                "signal", Map.of("type", "string",
                                        "enum", List.of("SIGTERM", "SIGKILL"),
                                        "description", "Signal to send (default: SIGTERM)")),
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
                    "Process " + processId + " not found"));
        }
        BackgroundProcess process = found.get();
        boolean force = "SIGKILL".equalsIgnoreCase(String.valueOf(arguments.getOrDefault("signal", "SIGTERM")));
        if (!store.kill(process, force)) {
            return CompletableFuture.completedFuture(ToolOutput.success(
                    "Process " + process.getId() + " is not running (status: " + process.getStatus() + ")"));
        }
        return CompletableFuture.completedFuture(ToolOutput.success(
                "Stopped process " + process.getId() + " (" + process.getDescription() + ")",
                Map.of("processId", process.getId(), "signal", force ? "SIGKILL" : "SIGTERM")));
    }
}
