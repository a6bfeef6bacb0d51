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

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One conversation entry. A tool-result message carries the
 * {@code toolCallId} of the assistant tool call that produced it.
 */
@Data
@Builder(toBuilder = true)
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private String id;
    private String role; // system, user, assistant, tool
    private String content;

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool response messages
    private String toolName; // Tool name for tool response messages

    private Map<String, Object> metadata;
    private Instant timestamp;

    public static Message system(String content) {
        return of(ROLE_SYSTEM, content);
    }

    public static Message user(String content) {
        return of(ROLE_USER, content);
    }

    public static Message assistant(String content) {
        return of(ROLE_ASSISTANT, content);
    }

    private static Message of(String role, String content) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(role)
                .content(content)
                .timestamp(Instant.now())
                .build();
    }

    /**
     * Checks if this message is from the user.
     */
    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    /**
     * Checks if this message is from the assistant.
     */
    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    /**
     * Checks if this is a system message.
     */
    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    /**
     * Checks if this is a tool result message.
     */
    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    /**
     * Checks if this message contains tool calls from the LLM.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * Represents a function call requested by the LLM. Contains the tool name, ID
     * for correlation, and parsed JSON arguments.
     */
    @Data
    @Builder
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
    }
}
