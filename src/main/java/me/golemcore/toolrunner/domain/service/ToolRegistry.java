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

package me.golemcore.toolrunner.domain.service;

import me.golemcore.toolrunner.domain.component.ToolComponent;
import me.golemcore.toolrunner.domain.model.CancellationSignal;
import me.golemcore.toolrunner.domain.model.ToolContext;
import me.golemcore.toolrunner.domain.model.ToolDefinition;
import me.golemcore.toolrunner.domain.model.ToolFailureKind;
import me.golemcore.toolrunner.domain.model.ToolOutput;
import me.golemcore.toolrunner.infrastructure.config.ToolRunnerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * In-process mapping from tool name to {@link ToolComponent}.
 *
 * <p>
 * Local tools are discovered through dependency injection; remote tools are
 * published and withdrawn by the tool-server bridge. The mapping is an
 * immutable snapshot swapped atomically on every mutation, so lookups during a
 * run never block and never observe a half-applied refresh. Execution is not
 * serialized: concurrent calls to the same or different tools run in parallel,
 * each cancellable through its own {@link ToolContext}.
 *
 * <p>
 * {@link #execute} never throws and never completes exceptionally; unknown
 * tools, handler exceptions, and timeouts all become failed {@link ToolOutput}
 * values.
 */
@Component
@Slf4j
public class ToolRegistry {

    private static final Set<String> ARGUMENT_WRAPPER_KEYS = Set.of("value", "arguments");

    private final AtomicReference<Map<String, ToolComponent>> tools = new AtomicReference<>(Map.of());
    private final ToolRunnerProperties.ToolsProperties settings;

    public ToolRegistry(List<ToolComponent> toolComponents, ToolRunnerProperties properties) {
        this.settings = properties.getTools();
        List<String> registered = registerAll(toolComponents);
        log.info("[Registry] Registered {} local tools: {}", registered.size(), registered);
    }

    /**
     * Registers a tool.
     *
     * @throws DuplicateToolNameException
     *             if the name is taken by a different owner
     */
    public void register(ToolComponent tool) {
        String name = tool.getToolName();
        update(current -> {
            ToolComponent existing = current.get(name);
            if (existing != null && !existing.getOwner().equals(tool.getOwner())) {
                throw new DuplicateToolNameException(name, existing.getOwner(), tool.getOwner());
            }
            Map<String, ToolComponent> next = new LinkedHashMap<>(current);
            next.put(name, tool);
            return next;
        });
        log.debug("[Registry] Registered '{}' (owner: {})", name, tool.getOwner());
    }

    /**
     * Registers each tool independently. A rejected entry is logged and skipped.
     *
     * @return names that were registered
     */
    public List<String> registerAll(Collection<? extends ToolComponent> toolComponents) {
        if (toolComponents == null) {
            return List.of();
        }
        List<String> registered = new ArrayList<>();
        for (ToolComponent tool : toolComponents) {
            try {
                register(tool);
                registered.add(tool.getToolName());
            } catch (DuplicateToolNameException e) {
                log.warn("[Registry] Skipping tool: {}", e.getMessage());
            } catch (RuntimeException e) {
                log.warn("[Registry] Skipping invalid tool: {}", e.getMessage(), e);
            }
        }
        return registered;
    }

    /**
     * Makes the set of tools owned by {@code owner} exactly equal to
     * {@code replacement}: entries the owner no longer provides are removed,
     * others are added or replaced. Names held by other owners are left alone.
     *
     * @return names owned by {@code owner} after the swap
     */
    public List<String> replaceOwnerTools(String owner, Collection<? extends ToolComponent> replacement) {
        List<String> rejected = new ArrayList<>();
        Map<String, ToolComponent> result = update(current -> {
            rejected.clear();
            Map<String, ToolComponent> next = new LinkedHashMap<>();
            for (Map.Entry<String, ToolComponent> entry : current.entrySet()) {
                if (!owner.equals(entry.getValue().getOwner())) {
                    next.put(entry.getKey(), entry.getValue());
                }
            }
            for (ToolComponent tool : replacement) {
                ToolComponent holder = next.get(tool.getToolName());
                if (holder != null) {
                    rejected.add(tool.getToolName());
                    continue;
                }
                next.put(tool.getToolName(), tool);
            }
            return next;
        });
        for (String name : rejected) {
            log.warn("[Registry] '{}' from '{}' collides with an existing tool, skipped", name, owner);
        }
        return namesOwnedBy(result, owner);
    }

    /**
     * Removes every tool owned by {@code owner}.
     *
     * @return the removed names
     */
    public List<String> unregisterOwner(String owner) {
        Map<String, ToolComponent> before = tools.get();
        List<String> removed = new ArrayList<>(namesOwnedBy(before, owner));
        update(current -> {
            Map<String, ToolComponent> next = new LinkedHashMap<>();
            current.forEach((name, tool) -> {
                if (!owner.equals(tool.getOwner())) {
                    next.put(name, tool);
                }
            });
            return next;
        });
        if (!removed.isEmpty()) {
            log.debug("[Registry] Unregistered tools of '{}': {}", owner, removed);
        }
        return removed;
    }

    public boolean unregister(String name) {
        boolean[] removed = new boolean[1];
        update(current -> {
            removed[0] = current.containsKey(name);
            if (!removed[0]) {
                return current;
            }
            Map<String, ToolComponent> next = new LinkedHashMap<>(current);
            next.remove(name);
            return next;
        });
        return removed[0];
    }

    /**
     * Returns all enabled tools as definitions, without handlers.
     */
    public List<ToolDefinition> list() {
        return tools.get().values().stream()
                .filter(ToolComponent::isEnabled)
                .map(ToolComponent::getDefinition)
                .toList();
    }

    public Optional<ToolComponent> get(String name) {
        return Optional.ofNullable(tools.get().get(name));
    }

    public Set<String> getToolNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(tools.get().keySet()));
    }

    public List<String> namesOwnedBy(String owner) {
        return namesOwnedBy(tools.get(), owner);
    }

    /**
     * Resolves and executes a tool. Never throws; the returned future never
     * completes exceptionally.
     */
    public CompletableFuture<ToolOutput> execute(String name, Map<String, Object> arguments, ToolContext context) {
        String toolName = sanitizeToolName(name);
        ToolComponent tool = toolName != null ? tools.get().get(toolName) : null;

        if (tool == null) {
            log.warn("[Registry] Tool not found: {}", name);
            return CompletableFuture.completedFuture(
                    ToolOutput.failure(ToolFailureKind.NOT_FOUND, "tool not found: " + name));
        }
        if (!tool.isEnabled()) {
            return CompletableFuture.completedFuture(
                    ToolOutput.failure(ToolFailureKind.NOT_FOUND, "tool is disabled: " + toolName));
        }
        if (context != null && context.isCancelled()) {
            return CompletableFuture.completedFuture(
                    ToolOutput.failure(ToolFailureKind.CANCELLED, "Tool call cancelled before start"));
        }

        Map<String, Object> args = unwrapArguments(arguments);
        CancellationSignal callSignal = context != null && context.getCancellation() != null
                ? context.getCancellation().child()
                : CancellationSignal.create();
        ToolContext callContext = (context != null ? context.toBuilder() : ToolContext.builder())
                .cancellation(callSignal)
                .build();
        CompletableFuture<ToolOutput> future;
        try {
            future = tool.execute(args, callContext);
        } catch (RuntimeException e) {
            log.error("[Registry] Tool '{}' threw: {}", toolName, e.getMessage(), e);
            return CompletableFuture.completedFuture(ToolOutput.failure(messageOf(e)));
        }
        if (future == null) {
            return CompletableFuture.completedFuture(ToolOutput.failure("Tool returned no result: " + toolName));
        }

        int timeoutSeconds = settings.getExecutionTimeout();
        if (timeoutSeconds > 0) {
            ToolOutput timedOut = ToolOutput.failure("Tool execution timed out after " + timeoutSeconds + "s");
            future = future.completeOnTimeout(timedOut, timeoutSeconds, TimeUnit.SECONDS)
                    .thenApply(output -> {
                        if (output == timedOut) {
                            log.warn("[Registry] Tool '{}' timed out after {}s, cancelling", toolName,
                                    timeoutSeconds);
                            callSignal.cancel("timed out");
                        }
                        return output;
                    });
        }

        return future.handle((output, ex) -> {
            if (ex != null) {
                Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                log.warn("[Registry] Tool '{}' failed: {}", toolName, cause.getMessage());
                return ToolOutput.failure(messageOf(cause));
            }
            if (output == null) {
                return ToolOutput.failure("Tool returned no result: " + toolName);
            }
            return truncate(output, toolName);
        });
    }

    /**
     * Strip special tokens and garbage from tool names. Some models leak special
     * tokens like {@code <|channel|>} into tool call names, producing e.g.
     * {@code "list_files<|channel|>commentary"}.
     */
    String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.trim().replaceAll("[^a-zA-Z0-9_.-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Registry] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    /**
     * Some models wrap the real arguments in a single {@code value} or
     * {@code arguments} object.
     */
    @SuppressWarnings("unchecked")
    Map<String, Object> unwrapArguments(Map<String, Object> arguments) {
        if (arguments == null) {
            return Map.of();
        }
        if (arguments.size() == 1) {
            Map.Entry<String, Object> only = arguments.entrySet().iterator().next();
            if (ARGUMENT_WRAPPER_KEYS.contains(only.getKey()) && only.getValue() instanceof Map<?, ?> inner) {
                log.debug("[Registry] Unwrapped '{}' argument wrapper", only.getKey());
                return (Map<String, Object>) inner;
            }
        }
        return arguments;
    }

    /**
     * Truncate tool output that exceeds the configured max length. Prevents huge
     * responses from blowing up the model context window.
     */
    ToolOutput truncate(ToolOutput output, String toolName) {
        String content = output.getContent();
        int maxChars = settings.getMaxToolResultChars();
        if (content == null || maxChars <= 0 || content.length() <= maxChars) {
            return output;
        }
        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxChars + " chars. Try a more specific query or process the data in smaller chunks.]";
        int cutPoint = Math.max(0, maxChars - suffix.length());
        log.warn("[Registry] Truncating '{}' result: {} chars -> ~{} chars",
                toolName, content.length(), cutPoint + suffix.length());
        return output.toBuilder().content(content.substring(0, cutPoint) + suffix).build();
    }

    private Map<String, ToolComponent> update(UnaryOperator<Map<String, ToolComponent>> mutation) {
        return tools.updateAndGet(current -> Collections.unmodifiableMap(mutation.apply(current)));
    }

    private static List<String> namesOwnedBy(Map<String, ToolComponent> snapshot, String owner) {
        return snapshot.entrySet().stream()
                .filter(entry -> owner.equals(entry.getValue().getOwner()))
                .map(Map.Entry::getKey)
                .toList();
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
