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

import java.util.Map;

/**
 * Provider-agnostic event emitted by the stream normalizer and surfaced by the
 * agent loop. Every {@code TOOL_*} event carries the id of the call it belongs
 * to so that start, progress, and completion can be correlated.
 */
@Data
@Builder(toBuilder = true)
public class StreamEvent {

    private StreamEventType type;

    // TEXT, THINKING, TOOL_PROGRESS
    private String text;

    // TOOL_*
    private String toolCallId;
    private String toolName;
    private Map<String, Object> arguments;
    private String output;
    private Long durationMs;

    // TOOL_ERROR, ERROR
    private String error;

    // USAGE
    private LlmUsage usage;

    // DONE emitted by the agent loop
    private AgentTerminalState terminalState;

    public static StreamEvent text(String text) {
        return StreamEvent.builder().type(StreamEventType.TEXT).text(text).build();
    }

    public static StreamEvent thinking(String text) {
        return StreamEvent.builder().type(StreamEventType.THINKING).text(text).build();
    }

    public static StreamEvent toolStart(String toolCallId, String toolName, Map<String, Object> arguments) {
        return StreamEvent.builder()
                .type(StreamEventType.TOOL_START)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .arguments(arguments)
                .build();
    }

    public static StreamEvent toolProgress(String toolCallId, String toolName, String output) {
        return StreamEvent.builder()
                .type(StreamEventType.TOOL_PROGRESS)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .text(output)
                .build();
    }

    public static StreamEvent toolComplete(String toolCallId, String toolName, String output, long durationMs) {
        return StreamEvent.builder()
                .type(StreamEventType.TOOL_COMPLETE)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .output(output)
                .durationMs(durationMs)
                .build();
    }

    public static StreamEvent toolError(String toolCallId, String toolName, String error, Long durationMs) {
        return StreamEvent.builder()
                .type(StreamEventType.TOOL_ERROR)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .error(error)
                .durationMs(durationMs)
                .build();
    }

    public static StreamEvent usage(LlmUsage usage) {
        return StreamEvent.builder().type(StreamEventType.USAGE).usage(usage).build();
    }

    public static StreamEvent done() {
        return StreamEvent.builder().type(StreamEventType.DONE).build();
    }

    public static StreamEvent done(AgentTerminalState terminalState) {
        return StreamEvent.builder().type(StreamEventType.DONE).terminalState(terminalState).build();
    }

    public static StreamEvent error(String error) {
        return StreamEvent.builder()
                .type(StreamEventType.ERROR)
                .error(error)
                .terminalState(AgentTerminalState.ERROR)
                .build();
    }

    public boolean isTerminal() {
        return type != null && type.isTerminal();
    }
}
