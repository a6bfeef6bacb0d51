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

package me.golemcore.toolrunner.domain.stream;

import me.golemcore.toolrunner.domain.model.LlmChunk;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collects structured tool-call deltas for one round, keyed by the
 * provider-assigned index. Argument fragments are appended as raw text and only
 * parsed once the round has finished.
 */
@Slf4j
public class ToolCallAccumulator {

    static final String UNKNOWN_NAME = "unknown";

    private final ObjectMapper objectMapper;
    private final Map<Integer, PartialCall> calls = new TreeMap<>();

    public ToolCallAccumulator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void append(LlmChunk.ToolCallDelta delta) {
        PartialCall call = calls.computeIfAbsent(delta.getIndex(), index -> new PartialCall());
        if (call.id == null && hasText(delta.getId())) {
            call.id = delta.getId();
        }
        if (call.name == null && hasText(delta.getName())) {
            call.name = delta.getName();
        }
        if (delta.getArgumentsFragment() != null) {
            call.arguments.append(delta.getArgumentsFragment());
        }
    }

    public boolean isEmpty() {
        return calls.isEmpty();
    }

    /**
     * Parses every accumulated call and clears the accumulator. Entries without an
     * id get a generated one. A nameless entry with an id becomes a malformed call;
     * one with neither is dropped.
     */
    public List<NormalizedToolCall> drain() {
        List<NormalizedToolCall> result = new ArrayList<>();
        for (Map.Entry<Integer, PartialCall> entry : calls.entrySet()) {
            PartialCall call = entry.getValue();
            String raw = call.arguments.toString();
            if (call.name == null) {
                if (call.id == null) {
                    log.warn("[Normalizer] Dropping tool call at index {} without id and name", entry.getKey());
                    continue;
                }
                log.warn("[Normalizer] Tool call {} at index {} has no name", call.id, entry.getKey());
                result.add(NormalizedToolCall.builder()
                        .id(call.id)
                        .name(UNKNOWN_NAME)
                        .arguments(Map.of())
                        .rawArguments(raw)
                        .error("malformed tool arguments: missing tool name")
                        .build());
                continue;
            }
            String id = call.id != null ? call.id : ToolCallIds.generate();
            NormalizedToolCall.NormalizedToolCallBuilder builder = NormalizedToolCall.builder()
                    .id(id)
                    .name(call.name)
                    .rawArguments(raw);
            try {
                builder.arguments(ToolCallArguments.parse(objectMapper, raw));
            } catch (IllegalArgumentException e) {
                log.warn("[Normalizer] Malformed arguments for '{}' ({}): {}", call.name, id, e.getMessage());
                builder.arguments(Map.of()).error("malformed tool arguments: " + e.getMessage());
            }
            result.add(builder.build());
        }
        calls.clear();
        return result;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    private static final class PartialCall {
        private String id;
        private String name;
        private final StringBuilder arguments = new StringBuilder();
    }
}
