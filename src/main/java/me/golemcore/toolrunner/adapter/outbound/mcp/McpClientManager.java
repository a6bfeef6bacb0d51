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

package me.golemcore.toolrunner.adapter.outbound.mcp;

import me.golemcore.toolrunner.domain.model.McpServerConfig;
import me.golemcore.toolrunner.domain.model.McpServerState;
import me.golemcore.toolrunner.domain.model.ToolContext;
import me.golemcore.toolrunner.domain.model.ToolDefinition;
import me.golemcore.toolrunner.domain.model.ToolFailureKind;
import me.golemcore.toolrunner.domain.model.ToolOutput;
import me.golemcore.toolrunner.domain.service.ToolRegistry;
import me.golemcore.toolrunner.infrastructure.config.ToolRunnerProperties;
import me.golemcore.toolrunner.port.outbound.McpConnectionException;
import me.golemcore.toolrunner.port.outbound.McpPort;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Manages MCP client lifecycles: one {@link McpClient} per connected server,
 * keyed by server name.
 *
 * <p>
 * This manager provides:
 * <ul>
 * <li>Per-server state: {@code DISCONNECTED → CONNECTING → CONNECTED}
 * <li>Namespacing: remote tools are registered as {@code <server>__<tool>}
 * <li>Diff-based refresh: a refresh makes the server's registry entries match
 * its current tool list exactly
 * <li>Exit handling: a server process that dies has its tools purged
 * <li>@PreDestroy shutdown: closes every client on application shutdown
 * </ul>
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code toolrunner.mcp.enabled} - Enable/disable MCP feature
 * <li>{@code toolrunner.mcp.default-startup-timeout} - Handshake timeout
 * (seconds)
 * <li>{@code toolrunner.mcp.request-timeout} - Per-request timeout (seconds)
 * </ul>
 */
@Component
@Slf4j
public class McpClientManager implements McpPort {

    private static final Pattern SERVER_NAME = Pattern.compile("[a-zA-Z0-9.-]+(_[a-zA-Z0-9.-]+)*");

    private final ToolRegistry toolRegistry;
    private final McpClientFactory clientFactory;
    private final ToolRunnerProperties.McpProperties settings;

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    public McpClientManager(ToolRegistry toolRegistry, McpClientFactory clientFactory,
            ToolRunnerProperties properties) {
        this.toolRegistry = toolRegistry;
        this.clientFactory = clientFactory;
        this.settings = properties.getMcp();
    }

    @Override
    @SuppressWarnings("PMD.CloseResource")
    public List<String> connect(McpServerConfig config) {
        String name = config.getName();
        if (!settings.isEnabled()) {
            throw new McpConnectionException(name, "MCP support is disabled");
        }
        if (name == null || !SERVER_NAME.matcher(name).matches()) {
            throw new McpConnectionException(name, "Invalid server name: '" + name
                    + "' (letters, digits, '.', '-' and single '_' only)");
        }

        if (connections.containsKey(name)) {
            throw new McpConnectionException(name, "Server already connected: " + name);
        }

        McpClient client = clientFactory.create(config);
        Connection connection = new Connection(client);
        if (connections.putIfAbsent(name, connection) != null) {
            client.close();
            throw new McpConnectionException(name, "Server already connected: " + name);
        }

        client.setExitListener(() -> handleExit(name, connection));
        try {
            client.connect(startupTimeout(config));
        } catch (McpConnectionException e) {
            connections.remove(name, connection);
            throw e;
        } catch (RuntimeException e) {
            connections.remove(name, connection);
            client.close();
            throw new McpConnectionException(name, "Failed to connect: " + e.getMessage(), e);
        }
        connection.state = McpServerState.CONNECTED;

        try {
            List<String> tools = refreshTools(name);
            log.info("[McpManager] Connected '{}', {} tools", name, tools.size());
            return tools;
        } catch (McpConnectionException e) {
            disconnect(name);
            throw e;
        }
    }

    @Override
    public List<String> refreshTools(String serverName) {
        Connection connection = connections.get(serverName);
        if (connection == null || connection.state != McpServerState.CONNECTED) {
            throw new McpConnectionException(serverName, "Server not connected: " + serverName);
        }

        List<ToolDefinition> remoteTools;
        try {
            remoteTools = connection.client.listTools()
                    .get(settings.getRequestTimeout(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new McpConnectionException(serverName, "Tool listing interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new McpConnectionException(serverName, "Failed to list tools: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new McpConnectionException(serverName, "Tool listing timed out", e);
        }

        List<McpToolAdapter> adapters = new ArrayList<>();
        for (ToolDefinition definition : remoteTools) {
            adapters.add(new McpToolAdapter(serverName, definition, this));
        }
        // A concurrent disconnect may have removed the connection meanwhile.
        if (connections.get(serverName) != connection) {
            throw new McpConnectionException(serverName, "Server disconnected during refresh: " + serverName);
        }
        List<String> registered = toolRegistry.replaceOwnerTools(McpToolAdapter.ownerOf(serverName), adapters);
        if (connections.get(serverName) != connection) {
            toolRegistry.unregisterOwner(McpToolAdapter.ownerOf(serverName));
            throw new McpConnectionException(serverName, "Server disconnected during refresh: " + serverName);
        }
        log.debug("[McpManager] Refreshed '{}': {}", serverName, registered);
        return registered;
    }

    @Override
    @SuppressWarnings("PMD.CloseResource")
    public void disconnect(String serverName) {
        Connection connection = connections.remove(serverName);
        List<String> removed = toolRegistry.unregisterOwner(McpToolAdapter.ownerOf(serverName));
        if (connection != null) {
            connection.state = McpServerState.DISCONNECTED;
            connection.client.close();
            log.info("[McpManager] Disconnected '{}', removed {} tools", serverName, removed.size());
        }
    }

    @Override
    public CompletableFuture<ToolOutput> executeTool(String qualifiedName, Map<String, Object> arguments,
            ToolContext context) {
        int separator = qualifiedName != null ? qualifiedName.indexOf(NAMESPACE_SEPARATOR) : -1;
        if (separator <= 0) {
            return CompletableFuture.completedFuture(ToolOutput.failure(ToolFailureKind.NOT_FOUND,
                    "Not an MCP tool name: " + qualifiedName));
        }
        String serverName = qualifiedName.substring(0, separator);
        String toolName = qualifiedName.substring(separator + NAMESPACE_SEPARATOR.length());

        Connection connection = connections.get(serverName);
        if (connection == null || connection.state != McpServerState.CONNECTED) {
            return CompletableFuture.completedFuture(ToolOutput.failure(ToolFailureKind.TRANSPORT_FAILED,
                    "MCP server not connected: " + serverName));
        }

        McpClient client = connection.client;
        try {
            return client.callTool(toolName, arguments, context != null ? context.getCancellation() : null)
                    .handle((result, ex) -> {
                        if (ex == null) {
                            return client.getContentMapper().map(toolName, result);
                        }
                        return mapFailure(serverName, toolName, ex);
                    });
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(mapFailure(serverName, toolName, e));
        }
    }

    private ToolOutput mapFailure(String serverName, String toolName, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof CancellationException) {
            return ToolOutput.failure(ToolFailureKind.CANCELLED, "MCP tool call cancelled: " + toolName);
        }
        if (cause instanceof McpClient.McpException) {
            return ToolOutput.failure(ToolFailureKind.EXECUTION_FAILED, "MCP tool call failed: "
                    + cause.getMessage());
        }
        if (cause instanceof TimeoutException) {
            return ToolOutput.failure(ToolFailureKind.TRANSPORT_FAILED, "MCP tool call timed out: " + toolName);
        }
        log.warn("[McpManager] Transport failure calling '{}' on '{}': {}", toolName, serverName,
                cause.getMessage());
        return ToolOutput.failure(ToolFailureKind.TRANSPORT_FAILED, "MCP tool call failed: " + cause.getMessage());
    }

    @Override
    public McpServerState getState(String serverName) {
        Connection connection = connections.get(serverName);
        return connection != null ? connection.state : McpServerState.DISCONNECTED;
    }

    @Override
    public List<String> getConnectedServers() {
        return connections.entrySet().stream()
                .filter(entry -> entry.getValue().state == McpServerState.CONNECTED)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    private void handleExit(String serverName, Connection connection) {
        if (connections.remove(serverName, connection)) {
            connection.state = McpServerState.DISCONNECTED;
            List<String> removed = toolRegistry.unregisterOwner(McpToolAdapter.ownerOf(serverName));
            log.warn("[McpManager] Server '{}' exited, purged {} tools", serverName, removed.size());
        }
    }

    private Duration startupTimeout(McpServerConfig config) {
        int seconds = config.getStartupTimeoutSeconds() > 0
                ? config.getStartupTimeoutSeconds()
                : settings.getDefaultStartupTimeout();
        return Duration.ofSeconds(Math.max(1, seconds));
    }

    @PreDestroy
    public void shutdown() {
        log.info("[McpManager] Shutting down {} MCP clients", connections.size());
        for (String serverName : new ArrayList<>(connections.keySet())) {
            try {
                disconnect(serverName);
            } catch (RuntimeException e) {
                log.warn("[McpManager] Error closing '{}': {}", serverName, e.getMessage());
            }
        }
    }

    private static final class Connection {
        private final McpClient client;
        private volatile McpServerState state = McpServerState.CONNECTING;

        private Connection(McpClient client) {
            this.client = client;
        }
    }
}
