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

import me.golemcore.toolrunner.domain.model.CancellationSignal;
import me.golemcore.toolrunner.domain.model.McpServerConfig;
import me.golemcore.toolrunner.domain.model.ToolDefinition;
import me.golemcore.toolrunner.port.outbound.McpConnectionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-RPC 2.0 client for a single MCP (Model Context Protocol) server over
 * stdio.
 *
 * <p>
 * Communication is line-delimited JSON over the server's stdin/stdout. The
 * client:
 * <ul>
 * <li>Writes JSON-RPC requests to stdin
 * <li>Reads JSON-RPC responses from stdout (in a reader thread)
 * <li>Drains stderr to DEBUG log (in a separate thread)
 * <li>Matches responses to requests by JSON-RPC id
 * </ul>
 *
 * <p>
 * When stdout reaches end-of-stream while the client is still open, every
 * pending request fails and the exit listener is notified.
 *
 * <p>
 * MCP protocol version: 2024-11-05
 *
 * <p>
 * Not a Spring bean; created per server by {@link McpClientFactory}.
 */
public class McpClient implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(McpClient.class);
    private static final String JSONRPC_VERSION = "2.0";
    private static final String MCP_PROTOCOL_VERSION = "2024-11-05";
    private static final String CLIENT_NAME = "golemcore-toolrunner";
    private static final String CLIENT_VERSION = "0.1.0";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final String serverName;
    private final McpServerConfig config;
    private final ObjectMapper objectMapper;
    private final McpContentMapper contentMapper;
    private final Duration requestTimeout;

    private Process process;
    private InputStream stdout;
    private BufferedWriter writer;

    private final AtomicInteger nextId = new AtomicInteger(1);
    private final Map<Integer, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();
    private final AtomicBoolean exitReported = new AtomicBoolean(false);

    private volatile boolean running;
    private volatile Runnable exitListener = () -> {
    };

    public McpClient(McpServerConfig config, ObjectMapper objectMapper, Duration requestTimeout) {
        this.serverName = config.getName();
        this.config = config;
        this.objectMapper = objectMapper;
        this.contentMapper = new McpContentMapper(objectMapper);
        this.requestTimeout = requestTimeout;
    }

    /**
     * Client over already-open streams instead of a spawned process.
     */
    McpClient(String serverName, ObjectMapper objectMapper, Duration requestTimeout, InputStream stdout,
            OutputStream stdin) {
        this(McpServerConfig.builder().name(serverName).build(), objectMapper, requestTimeout);
        this.stdout = stdout;
        this.writer = new BufferedWriter(new OutputStreamWriter(stdin, StandardCharsets.UTF_8));
    }

    public void setExitListener(Runnable exitListener) {
        this.exitListener = exitListener != null ? exitListener : () -> {
        };
    }

    /**
     * Starts the server (unless streams were supplied) and performs the
     * {@code initialize} handshake.
     *
     * @throws McpConnectionException
     *             if the process cannot start or the handshake fails
     */
    public void connect(Duration startupTimeout) {
        if (stdout == null) {
            startProcess();
        }
        running = true;

        Thread readerThread = new Thread(this::readLoop, "mcp-reader-" + serverName);
        readerThread.setDaemon(true);
        readerThread.start();

        if (process != null) {
            Thread stderrThread = new Thread(this::stderrDrain, "mcp-stderr-" + serverName);
            stderrThread.setDaemon(true);
            stderrThread.start();
        }

        try {
            JsonNode initResult = sendRequest("initialize", Map.of(
                    "protocolVersion", MCP_PROTOCOL_VERSION,
                    "capabilities", Map.of(),
                    "clientInfo", Map.of(
                            "name", CLIENT_NAME,
                            "version", CLIENT_VERSION)))
                    .get(startupTimeout.toMillis(), TimeUnit.MILLISECONDS);

            log.info("[MCP:{}] Initialized: {}", serverName, initResult);
            sendNotification("notifications/initialized", Map.of());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new McpConnectionException(serverName, "Handshake interrupted", e);
        } catch (ExecutionException e) {
            close();
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[MCP:{}] Handshake failed: {}", serverName, cause.getMessage());
            throw new McpConnectionException(serverName, "Handshake failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            close();
            log.error("[MCP:{}] Handshake timed out after {}", serverName, startupTimeout);
            throw new McpConnectionException(serverName, "Handshake timed out after "
                    + startupTimeout.toSeconds() + "s", e);
        }
    }

    private void startProcess() {
        log.info("[MCP:{}] Starting server: {}", serverName, config.getCommand());
        if (config.getCommand() == null || config.getCommand().isBlank()) {
            throw new McpConnectionException(serverName, "No command configured for server: " + serverName);
        }

        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", config.getCommand());
        pb.redirectErrorStream(false);
        if (config.getEnv() != null) {
            pb.environment().putAll(config.getEnv());
        }

        try {
            process = pb.start();
        } catch (IOException e) {
            throw new McpConnectionException(serverName, "Failed to start server: " + e.getMessage(), e);
        }
        stdout = process.getInputStream();
        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
    }

    /**
     * Fetches the server's current tool list.
     */
    public CompletableFuture<List<ToolDefinition>> listTools() {
        return sendRequest("tools/list", Map.of()).thenApply(this::parseToolDefinitions);
    }

    /**
     * Calls a remote tool by its unqualified name. The returned future completes
     * with the raw {@code result} node, or exceptionally with an
     * {@link McpException}, an {@link IOException} for transport faults, or a
     * {@link CancellationException} when {@code cancellation} fires first.
     */
    public CompletableFuture<JsonNode> callTool(String name, Map<String, Object> arguments,
            CancellationSignal cancellation) {
        int id = nextId.getAndIncrement();
        CompletableFuture<JsonNode> future = sendRequest(id, "tools/call", Map.of(
                "name", name,
                "arguments", arguments != null ? arguments : Map.of()));
        if (cancellation != null) {
            CancellationSignal.Registration registration = cancellation.onCancel(() -> {
                if (future.isDone()) {
                    return;
                }
                sendNotification("notifications/cancelled", Map.of(
                        "requestId", id,
                        "reason", cancellation.getReason() != null ? cancellation.getReason() : "cancelled"));
                future.completeExceptionally(new CancellationException("MCP tool call cancelled: " + name));
            });
            future.whenComplete((result, ex) -> registration.close());
        }
        return future;
    }

    public McpContentMapper getContentMapper() {
        return contentMapper;
    }

    CompletableFuture<JsonNode> sendRequest(String method, Map<String, Object> params) {
        return sendRequest(nextId.getAndIncrement(), method, params);
    }

    private CompletableFuture<JsonNode> sendRequest(int id, String method, Map<String, Object> params) {
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        future.orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((result, ex) -> pendingRequests.remove(id));
        if (!running) {
            future.completeExceptionally(new IOException("MCP server '" + serverName + "' is not running"));
            return future;
        }
        pendingRequests.put(id, future);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.put("params", params);

        try {
            String json = objectMapper.writeValueAsString(request);
            log.debug("[MCP:{}] → {}", serverName, json);
            writeLine(json);
        } catch (IOException e) {
            pendingRequests.remove(id);
            future.completeExceptionally(e);
        }

        return future;
    }

    /**
     * Send a JSON-RPC notification (no id, no response expected).
     */
    void sendNotification(String method, Map<String, Object> params) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        if (params != null && !params.isEmpty()) {
            notification.put("params", params);
        }

        try {
            String json = objectMapper.writeValueAsString(notification);
            log.debug("[MCP:{}] → (notification) {}", serverName, json);
            writeLine(json);
        } catch (IOException e) {
            log.warn("[MCP:{}] Failed to send notification: {}", serverName, e.getMessage());
        }
    }

    private void writeLine(String json) throws IOException {
        synchronized (writer) {
            writer.write(json);
            writer.newLine();
            writer.flush();
        }
    }

    private void readLoop() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stdout, StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }
                log.debug("[MCP:{}] ← {}", serverName, line);
                handleMessage(line);
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[MCP:{}] Reader thread error: {}", serverName, e.getMessage());
            }
        } finally {
            failPending(new IOException("MCP server '" + serverName + "' closed the connection"));
            if (running) {
                running = false;
                reportExit();
            }
        }
    }

    private void handleMessage(String line) {
        JsonNode message;
        try {
            message = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.warn("[MCP:{}] Failed to parse response: {}", serverName, e.getMessage());
            return;
        }

        JsonNode idNode = message.get("id");
        if (idNode == null || !idNode.canConvertToInt() || message.has("method")) {
            String method = message.path("method").asText("unknown");
            log.debug("[MCP:{}] Server notification: {}", serverName, method);
            return;
        }

        int id = idNode.asInt();
        CompletableFuture<JsonNode> pending = pendingRequests.remove(id);
        if (pending == null) {
            log.debug("[MCP:{}] Received response for unknown or abandoned id: {}", serverName, id);
            return;
        }
        JsonNode error = message.get("error");
        if (error != null && !error.isNull()) {
            pending.completeExceptionally(new McpException(
                    error.path("code").asInt(-1),
                    error.path("message").asText("Unknown MCP error")));
        } else {
            pending.complete(message.get("result"));
        }
    }

    private void stderrDrain() {
        Process p = this.process;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                log.debug("[MCP:{}] stderr: {}", serverName, line);
            }
        } catch (IOException e) {
            if (running) {
                log.debug("[MCP:{}] Stderr drain ended: {}", serverName, e.getMessage());
            }
        }
    }

    private List<ToolDefinition> parseToolDefinitions(JsonNode result) {
        if (result == null) {
            return List.of();
        }

        JsonNode toolsNode = result.get("tools");
        if (toolsNode == null || !toolsNode.isArray()) {
            return List.of();
        }

        List<ToolDefinition> tools = new ArrayList<>();
        for (JsonNode toolNode : toolsNode) {
            String name = toolNode.path("name").asText(null);
            if (name == null || name.isBlank()) {
                continue;
            }
            String description = toolNode.path("description").asText("");

            Map<String, Object> inputSchema = Map.of("type", "object", "properties", Map.of());
            if (toolNode.has("inputSchema")) {
                try {
                    inputSchema = objectMapper.convertValue(toolNode.get("inputSchema"), MAP_TYPE_REF);
                } catch (IllegalArgumentException e) {
                    log.warn("[MCP:{}] Failed to parse inputSchema for tool '{}': {}", serverName, name,
                            e.getMessage());
                }
            }

            tools.add(ToolDefinition.builder()
                    .name(name)
                    .description(description)
                    .inputSchema(inputSchema)
                    .build());
        }
        return tools;
    }

    private void failPending(Exception error) {
        for (CompletableFuture<JsonNode> future : pendingRequests.values()) {
            future.completeExceptionally(error);
        }
        pendingRequests.clear();
    }

    private void reportExit() {
        if (exitReported.compareAndSet(false, true)) {
            log.warn("[MCP:{}] Server exited unexpectedly", serverName);
            try {
                exitListener.run();
            } catch (RuntimeException e) {
                log.warn("[MCP:{}] Exit listener failed: {}", serverName, e.getMessage(), e);
            }
        }
    }

    public boolean isRunning() {
        return running && (process == null || process.isAlive());
    }

    public String getServerName() {
        return serverName;
    }

    @Override
    public void close() {
        log.info("[MCP:{}] Closing client", serverName);
        running = false;
        exitReported.set(true);

        failPending(new IOException("MCP client closing"));

        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                log.debug("[MCP:{}] Error closing writer: {}", serverName, e.getMessage());
            }
        }
        if (process == null && stdout != null) {
            try {
                stdout.close();
            } catch (IOException e) {
                log.debug("[MCP:{}] Error closing reader: {}", serverName, e.getMessage());
            }
        }

        if (process != null && process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }

    /**
     * Exception for MCP JSON-RPC errors.
     */
    public static class McpException extends Exception {
        private static final long serialVersionUID = 1L;
        private final int code;

        public McpException(int code, String message) {
            super(message);
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }
}
