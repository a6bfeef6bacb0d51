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

package me.golemcore.toolrunner.domain.loop;

import me.golemcore.toolrunner.domain.model.AgentRunRequest;
import me.golemcore.toolrunner.domain.model.AgentRunResult;
import me.golemcore.toolrunner.domain.model.AgentTerminalState;
import me.golemcore.toolrunner.domain.model.CancellationSignal;
import me.golemcore.toolrunner.domain.model.LlmChunk;
import me.golemcore.toolrunner.domain.model.LlmRequest;
import me.golemcore.toolrunner.domain.model.LlmUsage;
import me.golemcore.toolrunner.domain.model.Message;
import me.golemcore.toolrunner.domain.model.StreamEvent;
import me.golemcore.toolrunner.domain.model.StreamEventType;
import me.golemcore.toolrunner.domain.model.ToolContext;
import me.golemcore.toolrunner.domain.model.ToolFailureKind;
import me.golemcore.toolrunner.domain.model.ToolOutput;
import me.golemcore.toolrunner.domain.service.ToolRegistry;
import me.golemcore.toolrunner.domain.stream.NormalizedToolCall;
import me.golemcore.toolrunner.domain.stream.StreamNormalizer;
import me.golemcore.toolrunner.port.outbound.LlmPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Drives one agent run: stream a completion, execute the tool calls it
 * produced, feed the results back, and repeat until the model answers without
 * tools or a ceiling is reached.
 *
 * <p>
 * All events reach the {@link AgentEventListener} from the thread calling
 * {@link #run}. Tool calls of one round run concurrently, bounded by
 * {@link AgentLoopConfig#getMaxParallelTools()}, and their results are appended
 * to history in completion order. Every detected tool call receives exactly one
 * {@code TOOL_COMPLETE} or {@code TOOL_ERROR}, and every run ends with exactly
 * one terminal event.
 */
public class AgentLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AgentLoop.class);

    static final String SUMMARY_PROMPT = "The tool call limit for this task has been reached. "
            + "Do not call any more tools. Provide a brief summary of what was done.";

    static final String ERROR_GUIDANCE_TEMPLATE = """
            IMPORTANT: %d tool calls failed in the previous turn. Please carefully check:
            1. Tool parameters must be direct key-value pairs, NOT wrapped in a "value" object
            2. Read the error messages carefully before retrying
            3. If a tool keeps failing, try an alternative approach

            Stop and explain what went wrong before retrying.""";

    private final LlmPort llmPort;
    private final ToolRegistry toolRegistry;
    private final ObjectMapper objectMapper;
    private final AgentLoopConfig config;
    private final Clock clock;
    private final ExecutorService toolExecutor;

    public AgentLoop(LlmPort llmPort, ToolRegistry toolRegistry, ObjectMapper objectMapper, AgentLoopConfig config) {
        this(llmPort, toolRegistry, objectMapper, config, Clock.systemUTC());
    }

    // Visible for testing
    public AgentLoop(LlmPort llmPort, ToolRegistry toolRegistry, ObjectMapper objectMapper, AgentLoopConfig config,
            Clock clock) {
        this.llmPort = llmPort;
        this.toolRegistry = toolRegistry;
        this.objectMapper = objectMapper;
        this.config = config;
        this.clock = clock;
        this.toolExecutor = Executors.newCachedThreadPool(new ToolThreadFactory());
    }

    /**
     * Runs to completion on the calling thread.
     */
    public AgentRunResult run(AgentRunRequest request, AgentEventListener listener) {
        Run run = new Run(request, listener != null ? listener : AgentEventListener.NOOP);
        try (CancellationSignal.Registration ignored = run.cancellation.onCancel(run::wakeUp)) {
            return run.execute();
        }
    }

    /**
     * Runs on a bounded-elastic worker and publishes the events. Cancelling the
     * subscription cancels the run.
     */
    public Flux<StreamEvent> stream(AgentRunRequest request) {
        AgentRunRequest effective = request.getCancellation() != null ? request
                : request.toBuilder().cancellation(CancellationSignal.create()).build();
        return Flux.<StreamEvent>create(sink -> {
            CancellationSignal cancellation = effective.getCancellation();
            sink.onCancel(() -> cancellation.cancel("subscriber cancelled"));
            try {
                run(effective, sink::next);
                sink.complete();
            } catch (RuntimeException e) {
                sink.error(e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public void close() {
        toolExecutor.shutdownNow();
    }

    private final class Run {

        private final AgentRunRequest request;
        private final AgentEventListener listener;
        private final CancellationSignal cancellation;
        private final BlockingQueue<Signal> inbox = new LinkedBlockingQueue<>();
        private final List<Message> messages = new ArrayList<>();
        private final int maxIterations;
        private final int maxToolCalls;
        private final AtomicInteger callSequence = new AtomicInteger();
        private int iterations;
        private int toolCallCount;
        private LlmUsage usage = LlmUsage.empty();
        private String finalAnswer;

        Run(AgentRunRequest request, AgentEventListener listener) {
            this.request = request;
            this.listener = listener;
            this.cancellation = request.getCancellation() != null ? request.getCancellation()
                    : CancellationSignal.create();
            this.maxIterations = Math.max(1, request.getMaxIterations() != null ? request.getMaxIterations()
                    : config.getMaxIterations());
            this.maxToolCalls = Math.max(0, request.getMaxToolCalls() != null ? request.getMaxToolCalls()
                    : config.getMaxToolCalls());
        }

        void wakeUp() {
            inbox.add(Wakeup.INSTANCE);
        }

        AgentRunResult execute() {
            if (request.getHistory() != null) {
                messages.addAll(request.getHistory());
            }
            if (request.getPrompt() != null && !request.getPrompt().isBlank()) {
                messages.add(Message.user(request.getPrompt()));
            }
            log.info("[AgentLoop] Run started (maxIterations: {}, maxToolCalls: {})", maxIterations, maxToolCalls);

            boolean finalizing = false;
            while (true) {
                if (cancellation.isCancelled()) {
                    return finish(AgentTerminalState.CANCELLED, null);
                }
                iterations++;
                RoundResult round = streamRound(!finalizing);
                if (round.error() != null) {
                    appendAssistant(round.text(), List.of());
                    return finish(AgentTerminalState.ERROR, round.error());
                }
                if (round.cancelled()) {
                    appendAssistant(round.text(), List.of());
                    return finish(AgentTerminalState.CANCELLED, null);
                }

                List<NormalizedToolCall> calls = round.calls();
                appendAssistant(round.text(), calls);
                int errors = appendMalformed(calls);
                List<NormalizedToolCall> executable = calls.stream()
                        .filter(call -> !call.isMalformed())
                        .toList();

                if (cancellation.isCancelled()) {
                    reject(executable, ToolFailureKind.CANCELLED, "Tool call cancelled before start");
                    return finish(AgentTerminalState.CANCELLED, null);
                }
                if (calls.isEmpty()) {
                    finalAnswer = round.text();
                    return finish(finalizing ? AgentTerminalState.LIMIT_REACHED : AgentTerminalState.DONE, null);
                }
                if (finalizing) {
                    finalAnswer = blankToNull(round.text());
                    reject(executable, ToolFailureKind.LIMIT_EXCEEDED,
                            "Tool call rejected: tool call limit (" + maxToolCalls + ") reached");
                    return finish(AgentTerminalState.LIMIT_REACHED, null);
                }
                if (iterations >= maxIterations) {
                    finalAnswer = blankToNull(round.text());
                    reject(executable, ToolFailureKind.LIMIT_EXCEEDED,
                            "Tool call not executed: iteration limit (" + maxIterations + ") reached");
                    return finish(AgentTerminalState.LIMIT_REACHED, null);
                }

                errors += executeTools(executable);
                if (cancellation.isCancelled()) {
                    return finish(AgentTerminalState.CANCELLED, null);
                }
                if (config.getErrorGuidanceThreshold() > 0 && errors >= config.getErrorGuidanceThreshold()) {
                    log.debug("[AgentLoop] Adding error recovery guidance after {} tool errors", errors);
                    messages.add(Message.user(String.format(ERROR_GUIDANCE_TEMPLATE, errors)));
                }
                if (toolCallCount >= maxToolCalls) {
                    log.info("[AgentLoop] Tool call limit reached ({}), forcing summary", toolCallCount);
                    messages.add(Message.user(SUMMARY_PROMPT));
                    finalizing = true;
                }
            }
        }

        private RoundResult streamRound(boolean withTools) {
            int round = iterations;
            StreamNormalizer normalizer = new StreamNormalizer(objectMapper);
            LlmRequest llmRequest = buildRequest(withTools);
            log.debug("[AgentLoop] Round {}: {} messages, {} tools", round, llmRequest.getMessages().size(),
                    llmRequest.getTools().size());

            Disposable subscription;
            try {
                subscription = llmPort.chatStream(llmRequest).subscribe(
                        chunk -> inbox.add(new StreamChunk(round, chunk)),
                        error -> inbox.add(new StreamFailed(round, error)),
                        () -> inbox.add(new StreamCompleted(round)));
            } catch (RuntimeException e) {
                log.error("[AgentLoop] Failed to open provider stream: {}", e.getMessage(), e);
                return RoundResult.failed("", forward(normalizer.fail(e)));
            }

            try {
                while (true) {
                    if (cancellation.isCancelled()) {
                        subscription.dispose();
                        log.info("[AgentLoop] Cancelled while streaming round {}", round);
                        return RoundResult.cancelled(normalizer.getText());
                    }
                    Signal signal = takeSignal();
                    if (signal instanceof StreamChunk chunk && chunk.round() == round) {
                        forward(normalizer.accept(chunk.chunk()));
                    } else if (signal instanceof StreamCompleted completed && completed.round() == round) {
                        forward(normalizer.finish());
                        return RoundResult.completed(normalizer.getText(), normalizer.getToolCalls());
                    } else if (signal instanceof StreamFailed failed && failed.round() == round) {
                        log.warn("[AgentLoop] Provider stream failed in round {}: {}", round,
                                failed.error().getMessage());
                        return RoundResult.failed(normalizer.getText(), forward(normalizer.fail(failed.error())));
                    }
                }
            } finally {
                subscription.dispose();
            }
        }

        /**
         * Emits non-terminal events and returns the error text of a terminal
         * {@code ERROR}, if any.
         */
        private String forward(List<StreamEvent> events) {
            String error = null;
            for (StreamEvent event : events) {
                if (event.getType() == StreamEventType.ERROR) {
                    error = event.getError();
                } else if (event.getType() == StreamEventType.USAGE) {
                    usage = usage.plus(event.getUsage());
                    emit(event);
                } else if (!event.isTerminal()) {
                    emit(event);
                }
            }
            return error;
        }

        private int executeTools(List<NormalizedToolCall> calls) {
            int budget = Math.max(0, maxToolCalls - toolCallCount);
            Deque<NormalizedToolCall> queue = new ArrayDeque<>(calls.subList(0, Math.min(budget, calls.size())));
            List<NormalizedToolCall> overBudget = calls.subList(queue.size(), calls.size());
            int errors = overBudget.size();
            reject(overBudget, ToolFailureKind.LIMIT_EXCEEDED,
                    "Tool call rejected: tool call limit (" + maxToolCalls + ") reached");

            int parallel = Math.max(1, config.getMaxParallelTools());
            int round = iterations;
            Map<Integer, PendingCall> inFlight = new LinkedHashMap<>();

            while ((!queue.isEmpty() || !inFlight.isEmpty()) && !cancellation.isCancelled()) {
                while (inFlight.size() < parallel && !queue.isEmpty()) {
                    PendingCall pending = dispatch(round, queue.poll());
                    inFlight.put(pending.sequence(), pending);
                }
                Signal signal = takeSignal();
                errors += handleToolSignal(round, signal, inFlight);
            }

            if (cancellation.isCancelled()) {
                errors += queue.size();
                reject(new ArrayList<>(queue), ToolFailureKind.CANCELLED, "Tool call cancelled before start");
                errors += awaitCancelled(round, inFlight);
            }
            return errors;
        }

        /**
         * Gives in-flight tools the grace period to observe their own cancellation,
         * then resolves the rest with synthetic results.
         */
        private int awaitCancelled(int round, Map<Integer, PendingCall> inFlight) {
            int errors = 0;
            long deadline = clock.millis() + Math.max(0, config.getCancelGraceMs());
            while (!inFlight.isEmpty()) {
                long remaining = deadline - clock.millis();
                if (remaining <= 0) {
                    break;
                }
                Signal signal;
                try {
                    signal = inbox.poll(remaining, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                if (signal == null) {
                    break;
                }
                errors += handleToolSignal(round, signal, inFlight);
            }
            for (PendingCall pending : inFlight.values()) {
                log.warn("[AgentLoop] Tool '{}' ({}) did not finish within the cancellation grace period",
                        pending.call().getName(), pending.call().getId());
                recordResult(pending.call(), ToolOutput.failure(ToolFailureKind.CANCELLED, "Tool call cancelled"),
                        clock.millis() - pending.startedAt());
                errors++;
            }
            inFlight.clear();
            return errors;
        }

        private int handleToolSignal(int round, Signal signal, Map<Integer, PendingCall> inFlight) {
            if (signal instanceof ToolProgress progress && progress.round() == round
                    && inFlight.containsKey(progress.sequence())) {
                NormalizedToolCall call = inFlight.get(progress.sequence()).call();
                emit(StreamEvent.toolProgress(call.getId(), call.getName(), progress.output()));
            } else if (signal instanceof ToolFinished finished && finished.round() == round) {
                PendingCall pending = inFlight.remove(finished.sequence());
                if (pending != null) {
                    recordResult(pending.call(), finished.output(), finished.durationMs());
                    return finished.output().isError() ? 1 : 0;
                }
            }
            return 0;
        }

        private PendingCall dispatch(int round, NormalizedToolCall call) {
            int sequence = callSequence.incrementAndGet();
            toolCallCount++;
            CancellationSignal callCancellation = cancellation.child();
            ToolContext context = ToolContext.builder()
                    .workingDirectory(request.getWorkingDirectory())
                    .sessionId(request.getSessionId())
                    .cancellation(callCancellation)
                    .progressListener(output -> inbox.add(new ToolProgress(round, sequence, output)))
                    .build();
            long startedAt = clock.millis();
            log.debug("[AgentLoop] Executing tool '{}' ({})", call.getName(), call.getId());

            CompletableFuture
                    .supplyAsync(() -> toolRegistry.execute(call.getName(), call.getArguments(), context),
                            toolExecutor)
                    .thenCompose(Function.identity())
                    .whenComplete((output, error) -> {
                        ToolOutput result = output;
                        if (error != null) {
                            result = ToolOutput.failure("Tool execution failed: " + error.getMessage());
                        } else if (result == null) {
                            result = ToolOutput.failure("Tool returned no result");
                        }
                        inbox.add(new ToolFinished(round, sequence, result, clock.millis() - startedAt));
                    });
            return new PendingCall(sequence, call, startedAt);
        }

        private void recordResult(NormalizedToolCall call, ToolOutput output, long durationMs) {
            String content = output.getContent() != null ? output.getContent() : "";
            if (output.isError()) {
                emit(StreamEvent.toolError(call.getId(), call.getName(), content, durationMs));
            } else {
                emit(StreamEvent.toolComplete(call.getId(), call.getName(), content, durationMs));
            }
            appendToolResult(call, content);
        }

        /**
         * Resolves calls that will never run with a synthetic error result.
         */
        private void reject(List<NormalizedToolCall> calls, ToolFailureKind kind, String reason) {
            for (NormalizedToolCall call : calls) {
                log.debug("[AgentLoop] {} '{}' ({}): {}", kind, call.getName(), call.getId(), reason);
                recordResult(call, ToolOutput.failure(kind, reason), 0);
            }
        }

        private int appendMalformed(List<NormalizedToolCall> calls) {
            int count = 0;
            for (NormalizedToolCall call : calls) {
                if (call.isMalformed()) {
                    appendToolResult(call, call.getError());
                    count++;
                }
            }
            return count;
        }

        private void appendAssistant(String text, List<NormalizedToolCall> calls) {
            if ((text == null || text.isEmpty()) && calls.isEmpty()) {
                return;
            }
            List<Message.ToolCall> toolCalls = calls.isEmpty() ? null
                    : calls.stream()
                            .map(call -> Message.ToolCall.builder()
                                    .id(call.getId())
                                    .name(call.getName())
                                    .arguments(call.getArguments())
                                    .build())
                            .toList();
            messages.add(Message.builder()
                    .id(UUID.randomUUID().toString())
                    .role(Message.ROLE_ASSISTANT)
                    .content(text)
                    .toolCalls(toolCalls)
                    .timestamp(Instant.now(clock))
                    .build());
        }

        private void appendToolResult(NormalizedToolCall call, String content) {
            messages.add(Message.builder()
                    .id(UUID.randomUUID().toString())
                    .role(Message.ROLE_TOOL)
                    .toolCallId(call.getId())
                    .toolName(call.getName())
                    .content(content)
                    .timestamp(Instant.now(clock))
                    .build());
        }

        private LlmRequest buildRequest(boolean withTools) {
            return LlmRequest.builder()
                    .model(request.getModel() != null ? request.getModel() : config.getModel())
                    .systemPrompt(request.getSystemPrompt() != null ? request.getSystemPrompt()
                            : config.getSystemPrompt())
                    .messages(new ArrayList<>(messages))
                    .tools(withTools ? toolRegistry.list() : new ArrayList<>())
                    .temperature(config.getTemperature())
                    .maxTokens(config.getMaxTokens())
                    .stream(true)
                    .sessionId(request.getSessionId())
                    .build();
        }

        private Signal takeSignal() {
            try {
                return inbox.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancellation.cancel("interrupted");
                return Wakeup.INSTANCE;
            }
        }

        private void emit(StreamEvent event) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("[AgentLoop] Event listener failed on {}: {}", event.getType(), e.getMessage(), e);
            }
        }

        private AgentRunResult finish(AgentTerminalState state, String error) {
            if (state == AgentTerminalState.ERROR) {
                emit(StreamEvent.error(error));
            } else {
                emit(StreamEvent.done(state));
            }
            log.info("[AgentLoop] Run finished: {} (iterations: {}, tool calls: {}, tokens: {})",
                    state, iterations, toolCallCount, usage.getTotalTokens());
            return AgentRunResult.builder()
                    .terminalState(state)
                    .finalAnswer(finalAnswer)
                    .messages(new ArrayList<>(messages))
                    .toolCallCount(toolCallCount)
                    .iterations(iterations)
                    .usage(usage)
                    .error(error)
                    .build();
        }
    }

    private static String blankToNull(String text) {
        return text == null || text.isBlank() ? null : text;
    }

    private interface Signal {
    }

    private enum Wakeup implements Signal {
        INSTANCE
    }

    private record StreamChunk(int round, LlmChunk chunk) implements Signal {
    }

    private record StreamCompleted(int round) implements Signal {
    }

    private record StreamFailed(int round, Throwable error) implements Signal {
    }

    private record ToolProgress(int round, int sequence, String output) implements Signal {
    }

    private record ToolFinished(int round, int sequence, ToolOutput output, long durationMs) implements Signal {
    }

    private record PendingCall(int sequence, NormalizedToolCall call, long startedAt) {
    }

    private record RoundResult(String text, List<NormalizedToolCall> calls, boolean cancelled, String error) {

        static RoundResult completed(String text, List<NormalizedToolCall> calls) {
            return new RoundResult(text, List.copyOf(calls), false, null);
        }

        static RoundResult cancelled(String text) {
            return new RoundResult(text, List.of(), true, null);
        }

        static RoundResult failed(String text, String error) {
            return new RoundResult(text, List.of(), false, error != null ? error : "provider stream failed");
        }
    }

    private static final class ToolThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "agent-tool-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
