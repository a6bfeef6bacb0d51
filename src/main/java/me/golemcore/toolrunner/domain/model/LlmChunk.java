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

import java.util.List;

/**
 * One provider-native streaming delta, already decoded from the wire format
 * but not yet normalized. A chunk may carry any combination of text,
 * reasoning text, tool-call fragments, usage and a finish reason.
 */
@Data
@Builder
public class LlmChunk {

    private String text;
    private String reasoning;
    private List<ToolCallDelta> toolCallDeltas;
    private LlmUsage usage;

    /**
     * Provider-signaled end of the round ("stop", "tool_calls", "length", ...).
     */
    private String finishReason;

    public boolean hasToolCallDeltas() {
        return toolCallDeltas != null && !toolCallDeltas.isEmpty();
    }

    /**
     * Fragment of a single tool call. The name usually arrives once; the JSON
     * argument text is split across many fragments keyed by {@code index}.
     */
    @Data
    @Builder
    public static class ToolCallDelta {
        private int index;
        private String id;
        private String name;
        private String argumentsFragment;
    }
}
