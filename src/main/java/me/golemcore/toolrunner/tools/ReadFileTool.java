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
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Reads a UTF-8 text file.
 */
@Component
@Slf4j
public class ReadFileTool implements ToolComponent {

    static final String NAME = "read_file";
    private static final long MAX_FILE_SIZE = 10 * 1024 * 1024; // 10 MB

    private final WorkspacePathResolver pathResolver;

    public ReadFileTool(WorkspacePathResolver pathResolver) {
        this.pathResolver = pathResolver;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Read the contents of a text file.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "path", Map.of(
                                        "type", "string",
                                        "description", "File to read")),
                        "required", List.of("path")))
                .build();
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> arguments, ToolContext context) {
        return CompletableFuture.supplyAsync(() -> {
            Object rawPath = arguments.get("path");
            if (rawPath == null || rawPath.toString().isBlank()) {
                return ToolOutput.failure("Missing required parameter: path");
            }
            Path path;
            try {
                path = pathResolver.resolve(rawPath.toString(), context);
            } catch (InvalidPathException e) {
                return ToolOutput.failure("Invalid path: " + rawPath);
            }
            log.debug("[FileSystem] read_file: {}", path);
            return readFile(path);
        });
    }

    private ToolOutput readFile(Path path) {
        if (!Files.exists(path)) {
            return ToolOutput.failure("File not found: " + path);
        }
        if (!Files.isRegularFile(path)) {
            return ToolOutput.failure("Not a file: " + path);
        }

        try {
            long size = Files.size(path);
            if (size > MAX_FILE_SIZE) {
                return ToolOutput.failure("File too large (max " + (MAX_FILE_SIZE / 1024 / 1024) + " MB)");
            }
            String content = Files.readString(path, StandardCharsets.UTF_8);
            return ToolOutput.success(content, Map.of(
                    "path", path.toString(),
                    "size", size,
                    "lines", content.lines().count()));
        } catch (MalformedInputException e) {
            return ToolOutput.failure("Not a UTF-8 text file: " + path);
        } catch (IOException e) {
            return ToolOutput.failure("Failed to read file: " + e.getMessage());
        }
    }
}
