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
import me.golemcore.toolrunner.infrastructure.config.ToolRunnerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Lists the entries of a directory, directories first, then files by name.
 */
@Component
@Slf4j
public class ListFilesTool implements ToolComponent {

    static final String NAME = "list_files";

    private final WorkspacePathResolver pathResolver;
    private final int maxEntries;

    public ListFilesTool(WorkspacePathResolver pathResolver, ToolRunnerProperties properties) {
        this.pathResolver = pathResolver;
        this.maxEntries = Math.max(1, properties.getTools().getMaxFilesList());
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("""
                        List files and directories at a path.
                        Relative paths are resolved against the working directory.
                        """)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "path", Map.of(
                                        "type", "string",
                                        "description", "Directory to list (default: working directory)"))))
                .build();
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> arguments, ToolContext context) {
        return CompletableFuture.supplyAsync(() -> {
            Object rawPath = arguments.get("path");
            String pathStr = rawPath != null ? rawPath.toString() : null;
            log.debug("[FileSystem] list_files: {}", pathStr);

            Path path;
            try {
                path = pathResolver.resolve(pathStr, context);
            } catch (InvalidPathException e) {
                return ToolOutput.failure("Invalid path: " + pathStr);
            }
            return listDirectory(path);
        });
    }

    private ToolOutput listDirectory(Path path) {
        if (!Files.exists(path)) {
            return ToolOutput.failure("Directory not found: " + path);
        }
        if (!Files.isDirectory(path)) {
            return ToolOutput.failure("Not a directory: " + path);
        }

        List<Entry> entries;
        int total;
        try (Stream<Path> stream = Files.list(path)) {
            List<Entry> all = stream.map(ListFilesTool::describe)
                    .sorted(Comparator.comparing(Entry::directory).reversed().thenComparing(Entry::name))
                    .toList();
            total = all.size();
            entries = all.subList(0, Math.min(total, maxEntries));
        } catch (IOException e) {
            return ToolOutput.failure("Failed to list directory: " + e.getMessage());
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Directory: ").append(path).append("\n");
        sb.append("Entries: ").append(total).append("\n\n");
        for (Entry entry : entries) {
            if (entry.directory()) {
                sb.append("[DIR]  ").append(entry.name()).append("/\n");
            } else {
                sb.append("[FILE] ").append(entry.name()).append(" (").append(formatSize(entry.size())).append(")\n");
            }
        }
        if (total > entries.size()) {
            sb.append("... ").append(total - entries.size()).append(" more entries not shown\n");
        }
        return ToolOutput.success(sb.toString(), Map.of("path", path.toString(), "entries", total));
    }

    private static Entry describe(Path path) {
        String name = path.getFileName().toString();
        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
            return new Entry(name, attrs.isDirectory(), attrs.size());
        } catch (IOException e) {
            return new Entry(name, false, 0);
        }
    }

    static String formatSize(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        if (bytes < 1024 * 1024) {
            return String.format(Locale.ROOT, "%.1f KB", bytes / 1024.0);
        }
        if (bytes < 1024 * 1024 * 1024) {
            return String.format(Locale.ROOT, "%.1f MB", bytes / (1024.0 * 1024));
        }
        return String.format(Locale.ROOT, "%.1f GB", bytes / (1024.0 * 1024 * 1024));
    }

    private record Entry(String name, boolean directory, long size) {
    }
}
