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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Writes or appends UTF-8 text to a file, creating parent directories.
 */
@Component
@Slf4j
public class WriteFileTool implements ToolComponent {

    static final String NAME = "write_file";

    private final WorkspacePathResolver pathResolver;

    public WriteFileTool(WorkspacePathResolver pathResolver) {
        this.pathResolver = pathResolver;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Write text to a file. Creates the file and missing parent directories.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "path", Map.of(
                                        "type", "string",
                                        "description", "File to write"),
                                "content", Map.of(
                                        "type", "string",
                                        "description", "Content to write"),
                                "append", Map.of(
                                        "type", "boolean",
                                        "description", "Append instead of overwriting (default: false)")),
                        "required", List.of("path", "content")))
                .build();
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> arguments, ToolContext context) {
        return CompletableFuture.supplyAsync(() -> {
            Object rawPath = arguments.get("path");
            Object content = arguments.get("content");
            if (rawPath == null || rawPath.toString().isBlank()) {
                return ToolOutput.failure("Missing required parameter: path");
            }
            if (content == null) {
                return ToolOutput.failure("Missing required parameter: content");
            }
            Path path;
            try {
                path = pathResolver.resolve(rawPath.toString(), context);
            } catch (InvalidPathException e) {
                return ToolOutput.failure("Invalid path: " + rawPath);
            }
            boolean append = Boolean.TRUE.equals(arguments.get("append"));
            log.debug("[FileSystem] write_file: {} (append: {})", path, append);
            return writeFile(path, content.toString(), append);
        });
    }

    private ToolOutput writeFile(Path path, String content, boolean append) {
        try {
            Path parent = path.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
            if (append) {
                Files.writeString(path, content, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } else {
                Files.writeString(path, content, StandardCharsets.UTF_8);
            }

            long size = Files.size(path);
            String action = append ? "appended to" : "written to";
            return ToolOutput.success("Successfully " + action + " file: " + path, Map.of(
                    "path", path.toString(),
                    "size", size));
        } catch (IOException e) {
            return ToolOutput.failure("Failed to write file: " + e.getMessage());
        }
    }
}
