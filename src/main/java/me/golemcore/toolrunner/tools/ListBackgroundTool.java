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
import me.golemcore.toolrunner.domain.model.ToolOutput;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Lists the background processes of the calling session.
 */
@Component
public class ListBackgroundTool implements ToolComponent {

    static final String NAME = "list_background";

    private final BackgroundProcessStore store;

    public ListBackgroundTool(BackgroundProcessStore store) {
        this.store = store;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("List background processes with their status and runtime.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "showCompleted", Map.of("type", "boolean",
                                        "description", "Include finished processes (default: true)"))))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return store.isEnabled();
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> arguments, ToolContext context) {
        boolean showCompleted = !Boolean.FALSE.equals(arguments.get("showCompleted"));
        List<BackgroundProcess> processes = store.list(BackgroundProcessStore.sessionOf(context)).stream()
                .filter(process -> showCompleted || process.isRunning())
                .toList();
        if (processes.isEmpty()) {
            return CompletableFuture.completedFuture(ToolOutput.success(
                    showCompleted ? "No background processes" : "No running background processes",
                    Map.of("count", 0)));
        }

        StringBuilder text = new StringBuilder("Background processes (" + processes.size() + "):\n");
        for (BackgroundProcess process : processes) {
            text.append("- ").append(process.getId())
                    .append(" [").append(process.getStatus()).append("] ")
                    .append(process.getDescription())
                    .append(" (").append(process.runtimeSeconds(store.getClock())).append("s)");
            if (process.getExitCode() != null) {
                text.append(" exit ").append(process.getExitCode());
            }
            text.append('\n');
        }
        return CompletableFuture.completedFuture(ToolOutput.success(text.toString(),
                Map.of("count", processes.size())));
    }
}
