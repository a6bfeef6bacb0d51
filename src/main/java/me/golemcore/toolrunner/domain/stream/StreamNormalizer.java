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
import me.golemcore.toolrunner.domain.model.LlmUsage;
import me.golemcore.toolrunner.domain.model.StreamEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Converts one provider round of {@link LlmChunk}s into normalized
 * {@link StreamEvent}s.
 *
 * <p>
 * Text and thinking are emitted as they arrive. Structured tool-call deltas and
 * inline marker calls are collected and emitted as {@code TOOL_START} events
 * when the round finishes; a call whose arguments do not parse is followed
 * immediately by a {@code TOOL_ERROR}. Exactly one terminal event ends the
 * round and nothing is emitted after it.
 *
 * <p>
 * Not thread-safe; one instance per round.
 */
@Slf4j
public class StreamNormalizer {

    private final ToolCallAccumulator accumulator;
    private final InlineToolCallParser inlineParser;
    private final List<NormalizedToolCall> inlineCalls = new ArrayList<>();
    private final List<NormalizedToolCall> toolCalls = new ArrayList<>();
    private final StringBuilder text = new StringBuilder();
    private final StringBuilder reasoning = new StringBuilder();
    private LlmUsage usage;
    private String finishReason;
    private boolean terminated;

    public StreamNormalizer(ObjectMapper objectMapper) {
        this.accumulator = new ToolCallAccumulator(objectMapper);
        this.inlineParser = new InlineToolCallParser(objectMapper);
    }

    public List<StreamEvent> accept(LlmChunk chunk) {
        if (terminated) {
            log.debug("[Normalizer] Ignoring chunk after terminal event");
            return List.of();
        }
        if (chunk == null) {
            return List.of();
        }
        List<StreamEvent> events = new ArrayList<>();
        if (chunk.getReasoning() != null && !chunk.getReasoning().isEmpty()) {
            reasoning.append(chunk.getReasoning());
            events.add(StreamEvent.thinking(chunk.getReasoning()));
        }
        if (chunk.getText() != null && !chunk.getText().isEmpty()) {
            InlineToolCallParser.Result parsed = inlineParser.feed(chunk.getText());
            emitText(parsed, events);
        }
        if (chunk.hasToolCallDeltas()) {
            chunk.getToolCallDeltas().forEach(accumulator::append);
        }
        if (chunk.getUsage() != null) {
            usage = chunk.getUsage();
            events.add(StreamEvent.usage(chunk.getUsage()));
        }
        if (chunk.getFinishReason() != null) {
            finishReason = chunk.getFinishReason();
        }
        return events;
    }

    /**
     * Ends the round normally: flushes held-back text, emits every detected tool
     * call, then {@code DONE}.
     */
    public List<StreamEvent> finish() {
        if (terminated) {
            return List.of();
        }
        List<StreamEvent> events = new ArrayList<>();
        emitText(inlineParser.finish(), events);

        toolCalls.addAll(accumulator.drain());
        toolCalls.addAll(inlineCalls);
        inlineCalls.clear();
        for (NormalizedToolCall call : toolCalls) {
            events.add(StreamEvent.toolStart(call.getId(), call.getName(), call.getArguments()));
            if (call.isMalformed()) {
                events.add(StreamEvent.toolError(call.getId(), call.getName(), call.getError(), null));
            }
        }
        if (inlineParser.isDetected()) {
            log.info("[Normalizer] Extracted inline tool calls, total calls this round: {}", toolCalls.size());
        }
        terminated = true;
        events.add(StreamEvent.done());
        return events;
    }

    /**
     * Ends the round with a transport or provider fault. Pending tool calls are
     * discarded; they were never surfaced.
     */
    public List<StreamEvent> fail(Throwable error) {
        if (terminated) {
            return List.of();
        }
        terminated = true;
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        log.warn("[Normalizer] Stream failed: {}", message);
        return List.of(StreamEvent.error(message));
    }

    public boolean isTerminated() {
        return terminated;
    }

    /**
     * Calls detected this round, in emission order. Populated by
     * {@link #finish()}.
     */
    public List<NormalizedToolCall> getToolCalls() {
        return Collections.unmodifiableList(toolCalls);
    }

    public String getText() {
        return text.toString();
    }

    public String getReasoning() {
        return reasoning.toString();
    }

    public LlmUsage getUsage() {
        return usage;
    }

    public String getFinishReason() {
        return finishReason;
    }

    private void emitText(InlineToolCallParser.Result parsed, List<StreamEvent> events) {
        String visible = parsed.visibleText();
        if (!visible.isEmpty()) {
            text.append(visible);
            events.add(StreamEvent.text(visible));
        }
        inlineCalls.addAll(parsed.getCalls());
    }
}
