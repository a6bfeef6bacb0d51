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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Extracts tool calls that a provider writes into the text channel using
 * sentinel markers:
 *
 * <pre>
 * &lt;｜tool▁calls▁begin｜&gt;
 *   &lt;｜tool▁call▁begin｜&gt;name&lt;｜tool▁sep｜&gt;{"json":"args"}&lt;｜tool▁call▁end｜&gt;
 *   ...
 * &lt;｜tool▁calls▁end｜&gt;
 * </pre>
 *
 * <p>
 * Text is fed incrementally. Everything outside a marker block is passed
 * through as visible text, except a trailing fragment that could still grow
 * into a marker, which is held back until the next feed. Blocks are cut out by
 * position, so marker text never leaks into the visible output.
 */
@Slf4j
public class InlineToolCallParser {

    static final String CALLS_BEGIN = "<｜tool▁calls▁begin｜>";
    static final String CALLS_END = "<｜tool▁calls▁end｜>";
    static final String CALL_BEGIN = "<｜tool▁call▁begin｜>";
    static final String CALL_END = "<｜tool▁call▁end｜>";
    static final String SEP = "<｜tool▁sep｜>";

    private static final List<String> MARKERS = List.of(CALLS_BEGIN, CALLS_END, CALL_BEGIN, CALL_END, SEP);
    private static final String FUNCTION_TYPE = "function";

    private final ObjectMapper objectMapper;
    private final StringBuilder buffer = new StringBuilder();
    private String blockEnd;
    private boolean detected;

    public InlineToolCallParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Whether an opening marker has been seen in this round.
     */
    public boolean isDetected() {
        return detected;
    }

    public Result feed(String text) {
        Result result = new Result();
        if (text == null || text.isEmpty()) {
            return result;
        }
        buffer.append(text);
        drainBuffer(result);
        return result;
    }

    /**
     * Flushes held-back text and resolves an unterminated block. Complete calls in
     * it are kept, the truncated tail becomes a malformed call.
     */
    public Result finish() {
        Result result = new Result();
        if (blockEnd == null) {
            result.text.append(buffer);
        } else if (CALLS_END.equals(blockEnd)) {
            log.warn("[Normalizer] Inline tool-call block not terminated");
            parseCallList(buffer.toString(), true, result.calls);
        } else {
            log.warn("[Normalizer] Inline tool call not terminated");
            result.calls.add(malformed(buffer.toString(), "truncated inline tool call"));
        }
        buffer.setLength(0);
        blockEnd = null;
        return result;
    }

    private void drainBuffer(Result result) {
        while (true) {
            if (blockEnd == null) {
                int[] marker = findFirstMarker(buffer);
                if (marker == null) {
                    int keep = partialMarkerSuffix(buffer);
                    result.text.append(buffer, 0, buffer.length() - keep);
                    buffer.delete(0, buffer.length() - keep);
                    return;
                }
                int position = marker[0];
                String found = MARKERS.get(marker[1]);
                result.text.append(buffer, 0, position);
                buffer.delete(0, position + found.length());
                if (CALLS_BEGIN.equals(found)) {
                    blockEnd = CALLS_END;
                    detected = true;
                } else if (CALL_BEGIN.equals(found)) {
                    blockEnd = CALL_END;
                    detected = true;
                } else {
                    log.debug("[Normalizer] Dropping stray inline marker");
                }
            } else {
                int end = buffer.indexOf(blockEnd);
                if (end < 0) {
                    return;
                }
                String block = buffer.substring(0, end);
                buffer.delete(0, end + blockEnd.length());
                if (CALLS_END.equals(blockEnd)) {
                    parseCallList(block, false, result.calls);
                } else {
                    result.calls.add(parseCall(block));
                }
                blockEnd = null;
            }
        }
    }

    /**
     * Walks a calls block by position. A call whose end marker is missing, or
     * that is interrupted by the next begin marker, is reported as malformed.
     */
    private void parseCallList(String block, boolean truncated, List<NormalizedToolCall> calls) {
        int position = 0;
        while (true) {
            int begin = block.indexOf(CALL_BEGIN, position);
            if (begin < 0) {
                if (truncated && !block.substring(position).isBlank()) {
                    log.debug("[Normalizer] Ignoring trailing text in truncated block");
                }
                return;
            }
            int contentStart = begin + CALL_BEGIN.length();
            int end = block.indexOf(CALL_END, contentStart);
            int nextBegin = block.indexOf(CALL_BEGIN, contentStart);
            if (end < 0 || (nextBegin >= 0 && nextBegin < end)) {
                int contentEnd = nextBegin >= 0 ? nextBegin : block.length();
                calls.add(malformed(block.substring(contentStart, contentEnd), "truncated inline tool call"));
                if (nextBegin < 0) {
                    return;
                }
                position = nextBegin;
                continue;
            }
            calls.add(parseCall(block.substring(contentStart, end)));
            position = end + CALL_END.length();
        }
    }

    NormalizedToolCall parseCall(String content) {
        String[] parts = content.split(SEP, -1);
        String name;
        String rawArguments;
        if (parts.length >= 3 && FUNCTION_TYPE.equals(parts[0].strip())) {
            name = parts[1];
            rawArguments = parts[2];
        } else if (parts.length == 2 && FUNCTION_TYPE.equals(parts[0].strip())) {
            // function<sep>name\n```json\n{...}\n```
            String rest = parts[1].strip();
            int newline = rest.indexOf('\n');
            name = newline >= 0 ? rest.substring(0, newline) : rest;
            rawArguments = newline >= 0 ? rest.substring(newline + 1) : "";
        } else if (parts.length >= 2) {
            name = parts[0];
            rawArguments = parts[1];
        } else {
            return malformed(content, "missing tool separator");
        }
        name = name.strip();
        if (name.isEmpty()) {
            return malformed(content, "missing tool name");
        }
        String json = stripCodeFence(rawArguments.strip());
        String id = ToolCallIds.generate();
        try {
            Map<String, Object> arguments = ToolCallArguments.parse(objectMapper, json);
            log.debug("[Normalizer] Parsed inline tool call '{}' ({})", name, id);
            return NormalizedToolCall.builder()
                    .id(id)
                    .name(name)
                    .arguments(arguments)
                    .rawArguments(json)
                    .build();
        } catch (IllegalArgumentException e) {
            log.warn("[Normalizer] Malformed inline arguments for '{}': {}", name, e.getMessage());
            return NormalizedToolCall.builder()
                    .id(id)
                    .name(name)
                    .arguments(Map.of())
                    .rawArguments(json)
                    .error("malformed tool arguments: " + e.getMessage())
                    .build();
        }
    }

    private NormalizedToolCall malformed(String content, String reason) {
        String[] parts = content.split(SEP, -1);
        String name = "";
        if (parts.length > 1) {
            name = FUNCTION_TYPE.equals(parts[0].strip()) ? parts[1].strip() : parts[0].strip();
            int newline = name.indexOf('\n');
            if (newline >= 0) {
                name = name.substring(0, newline).strip();
            }
        }
        return NormalizedToolCall.builder()
                .id(ToolCallIds.generate())
                .name(name.isEmpty() ? ToolCallAccumulator.UNKNOWN_NAME : name)
                .arguments(Map.of())
                .rawArguments(content)
                .error("malformed tool arguments: " + reason)
                .build();
    }

    private static String stripCodeFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstLine = text.indexOf('\n');
        String body = firstLine >= 0 ? text.substring(firstLine + 1) : "";
        if (body.endsWith("```")) {
            body = body.substring(0, body.length() - 3);
        }
        return body.strip();
    }

    private static int[] findFirstMarker(CharSequence text) {
        String value = text.toString();
        int best = -1;
        int bestMarker = -1;
        for (int i = 0; i < MARKERS.size(); i++) {
            int position = value.indexOf(MARKERS.get(i));
            if (position >= 0 && (best < 0 || position < best)) {
                best = position;
                bestMarker = i;
            }
        }
        return best < 0 ? null : new int[] { best, bestMarker };
    }

    /**
     * Length of the longest suffix of {@code text} that is a proper prefix of some
     * marker.
     */
    private static int partialMarkerSuffix(CharSequence text) {
        int length = text.length();
        int longest = 0;
        for (String marker : MARKERS) {
            int max = Math.min(length, marker.length() - 1);
            for (int size = max; size > longest; size--) {
                if (marker.startsWith(text.subSequence(length - size, length).toString())) {
                    longest = size;
                    break;
                }
            }
        }
        return longest;
    }

    /**
     * Output of one feed: visible text and the calls completed by it.
     */
    @Getter
    public static class Result {
        private final StringBuilder text = new StringBuilder();
        private final List<NormalizedToolCall> calls = new ArrayList<>();

        public String visibleText() {
            return text.toString();
        }
    }
}
