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

package me.golemcore.toolrunner.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a tool invocation. Always returned, never thrown: failures are
 * encoded as {@code error = true} with a human-readable {@code content}, so
 * the agent loop can always append a result message.
 */
@Data
@Builder(toBuilder = true)
public class ToolOutput {

    public static final String FAILURE_KIND = "failureKind";

    private String content;
    private boolean error;
    private Map<String, Object> metadata;

    /**
     * Creates a successful output with content text.
     */
    public static ToolOutput success(String content) {
        return ToolOutput.builder()
                .content(content)
                .error(false)
                .build();
    }

    /**
     * Creates a successful output with content text and metadata.
     */
    public static ToolOutput success(String content, Map<String, Object> metadata) {
        return ToolOutput.builder()
                .content(content)
                .error(false)
                .metadata(metadata)
                .build();
    }

    /**
     * Creates an execution failure with an error message.
     */
    public static ToolOutput failure(String message) {
        return failure(ToolFailureKind.EXECUTION_FAILED, message);
    }

    /**
     * Creates a failure of the given kind.
     */
    public static ToolOutput failure(ToolFailureKind kind, String message) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(FAILURE_KIND, kind.name());
        return ToolOutput.builder()
                .content(message)
                .error(true)
                .metadata(metadata)
                .build();
    }

    /**
     * Returns the failure kind, or null for successful outputs.
     */
    public ToolFailureKind getFailureKind() {
        if (!error) {
            return null;
        }
        Object kind = metadata != null ? metadata.get(FAILURE_KIND) : null;
        if (kind instanceof ToolFailureKind failureKind) {
            return failureKind;
        }
        if (kind instanceof String name) {
            try {
                return ToolFailureKind.valueOf(name);
            } catch (IllegalArgumentException e) {
                return ToolFailureKind.EXECUTION_FAILED;
            }
        }
        return ToolFailureKind.EXECUTION_FAILED;
    }
}
