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
 * Replaces an exact text fragment in a UTF-8 file.
 *
 * <p>
 * The fragment must occur exactly once unless {@code replaceAll} is set; zero
 * matches or an ambiguous match leave the file untouched and fail the call so
 * the model can retry with more context.
 */
@Component
@Slf4j
public class EditFileTool implements ToolComponent {

    static final String NAME = "edit_file";

    private static final String TYPE = "type";
    private static final String STRING = "string";
    private static final String DESCRIPTION = "description";

    private final WorkspacePathResolver pathResolver;

    public EditFileTool(WorkspacePathResolver pathResolver) {
        this.pathResolver = pathResolver;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("""
                        Make a targeted edit by replacing exact text in a file.
                        oldText must match exactly, including whitespace and indentation,
                        and must be unique in the file unless replaceAll is true.
                        """)
                .inputSchema(Map.of(
                        TYPE, "object",
                        "properties", Map.of(
                                "path", Map.of(TYPE, STRING, DESCRIPTION, "File to edit"),
                                "oldText", Map.of(TYPE, STRING, DESCRIPTION, "Exact text to find"),
                                "newText", Map.of(TYPE, STRING, DESCRIPTION, "Replacement text"),
                                "replaceAll", Map.of(TYPE, "boolean",
                                        DESCRIPTION, "Replace every occurrence (default: false)")),
                        "required", List.of("path", "oldText", "newText")))
                .build();
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> arguments, ToolContext context) {
        return CompletableFuture.supplyAsync(() -> {
            Object rawPath = arguments.get("path");
            Object oldText = arguments.get("oldText");
            Object newText = arguments.get("newText");
            if (rawPath == null || rawPath.toString().isBlank()) {
                return ToolOutput.failure("Missing required parameter: path");
            }
            if (oldText == null || oldText.toString().isEmpty()) {
                return ToolOutput.failure("Missing required parameter: oldText");
            }
            if (newText == null) {
                return ToolOutput.failure("Missing required parameter: newText");
            }
            Path path;
            try {
                path = pathResolver.resolve(rawPath.toString(), context);
            } catch (InvalidPathException e) {
                return ToolOutput.failure("Invalid path: " + rawPath);
            }
            boolean replaceAll = Boolean.TRUE.equals(arguments.get("replaceAll"));
            log.debug("[FileSystem] edit_file: {} (replaceAll: {})", path, replaceAll);
            return editFile(path, oldText.toString(), newText.toString(), replaceAll);
        });
    }

    private ToolOutput editFile(Path path, String oldText, String newText, boolean replaceAll) {
        if (!Files.isRegularFile(path)) {
            return ToolOutput.failure("File not found: " + path);
        }
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            int occurrences = countOccurrences(content, oldText);
            if (occurrences == 0) {
                return ToolOutput.failure("Could not find the specified text in " + path
                        + ". Make sure oldText matches exactly, including whitespace and indentation.");
            }
            if (occurrences > 1 && !replaceAll) {
                return ToolOutput.failure("Found " + occurrences + " occurrences of the text in " + path
                        + ". Provide more context to make the match unique, or set replaceAll.");
            }

            String updated = replaceAll
                    ? content.replace(oldText, newText)
                    : replaceFirst(content, oldText, newText);
            Files.writeString(path, updated, StandardCharsets.UTF_8);

            int line = lineOf(content, content.indexOf(oldText));
            log.info("[FileSystem] Edited {}: {} replacement(s)", path, occurrences);
            return ToolOutput.success("Successfully edited " + path + ": replaced " + occurrences
                    + (occurrences == 1 ? " occurrence" : " occurrences") + " (first at line " + line + ")",
                    Map.of("path", path.toString(), "replacements", occurrences, "line", line));
        } catch (MalformedInputException e) {
            return ToolOutput.failure("File is not valid UTF-8 text: " + path);
        } catch (IOException e) {
            return ToolOutput.failure("Failed to edit file: " + e.getMessage());
        }
    }

    static int countOccurrences(String content, String fragment) {
        int count = 0;
        int index = content.indexOf(fragment);
        while (index >= 0) {
            count++;
            index = content.indexOf(fragment, index + fragment.length());
        }
        return count;
    }

    private static String replaceFirst(String content, String oldText, String newText) {
        int index = content.indexOf(oldText);
        return content.substring(0, index) + newText + content.substring(index + oldText.length());
    }

    private static int lineOf(String content, int index) {
        int line = 1;
        for (int i = 0; i < index; i++) {
            if (content.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }
}
