package me.golemcore.toolrunner.testsupport.tools;

import me.golemcore.toolrunner.domain.component.ToolComponent;
import me.golemcore.toolrunner.domain.model.ToolContext;
import me.golemcore.toolrunner.domain.model.ToolDefinition;
import me.golemcore.toolrunner.domain.model.ToolOutput;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiFunction;

/**
 * Configurable in-memory tool for tests. Records every invocation.
 */
public final class StubTool implements ToolComponent {

    private final String name;
    private final String owner;
    private final BiFunction<Map<String, Object>, ToolContext, CompletableFuture<ToolOutput>> handler;
    private final List<Map<String, Object>> invocations = new CopyOnWriteArrayList<>();
    private volatile boolean enabled = true;

    private StubTool(String name, String owner,
            BiFunction<Map<String, Object>, ToolContext, CompletableFuture<ToolOutput>> handler) {
        this.name = name;
        this.owner = owner;
        this.handler = handler;
    }

    public static StubTool returning(String name, String output) {
        return new StubTool(name, LOCAL_OWNER,
                (args, ctx) -> CompletableFuture.completedFuture(ToolOutput.success(output)));
    }

    public static StubTool of(String name,
            BiFunction<Map<String, Object>, ToolContext, CompletableFuture<ToolOutput>> handler) {
        return new StubTool(name, LOCAL_OWNER, handler);
    }

    public static StubTool owned(String name, String owner, String output) {
        return new StubTool(name, owner,
                (args, ctx) -> CompletableFuture.completedFuture(ToolOutput.success(output)));
    }

    public StubTool disabled() {
        this.enabled = false;
        return this;
    }

    public List<Map<String, Object>> getInvocations() {
        return invocations;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.simple(name, "Stub tool " + name);
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> arguments, ToolContext context) {
        invocations.add(arguments);
        return handler.apply(arguments, context);
    }

    @Override
    public String getOwner() {
        return owner;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }
}
