package me.golemcore.toolrunner.adapter.outbound.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * In-process MCP server speaking line-delimited JSON-RPC over piped streams.
 * Handlers return the {@code result} object, an {@link RpcError}, or null to
 * never answer.
 */
final class FakeMcpServer implements AutoCloseable {

    private static final int PIPE_SIZE = 1 << 16;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PipedOutputStream toClient = new PipedOutputStream();
    private final PipedInputStream clientStdout;
    private final PipedInputStream fromClient = new PipedInputStream(PIPE_SIZE);
    private final PipedOutputStream clientStdin;
    private final List<JsonNode> received = new CopyOnWriteArrayList<>();
    private final Map<String, Function<JsonNode, Object>> handlers = new ConcurrentHashMap<>();
    private volatile List<Map<String, Object>> tools = List.of();

    FakeMcpServer() throws IOException {
        this.clientStdout = new PipedInputStream(toClient, PIPE_SIZE);
        this.clientStdin = new PipedOutputStream(fromClient);
        handlers.put("initialize", params -> Map.of(
                "protocolVersion", "2024-11-05",
                "capabilities", Map.of("tools", Map.of()),
                "serverInfo", Map.of("name", "fake", "version", "1.0.0")));
        handlers.put("tools/list", params -> Map.of("tools", tools));
        handlers.put("tools/call", params -> Map.of("content", List.of(Map.of(
                "type", "text",
                "text", "called " + params.path("name").asText()))));
        Thread thread = new Thread(this::serve, "fake-mcp-server");
        thread.setDaemon(true);
        thread.start();
    }

    McpClient newClient(String serverName, Duration requestTimeout) {
        return new McpClient(serverName, objectMapper, requestTimeout, clientStdout, clientStdin);
    }

    void setTools(String... names) {
        List<Map<String, Object>> definitions = new CopyOnWriteArrayList<>();
        for (String name : names) {
            definitions.add(Map.of(
                    "name", name,
                    "description", "Remote " + name,
                    "inputSchema", Map.of("type", "object", "properties", Map.of())));
        }
        this.tools = definitions;
    }

    void on(String method, Function<JsonNode, Object> handler) {
        handlers.put(method, handler);
    }

    List<JsonNode> received() {
        return received;
    }

    List<String> receivedMethods() {
        return received.stream().map(message -> message.path("method").asText()).toList();
    }

    JsonNode awaitMessage(String method, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            for (JsonNode message : received) {
                if (method.equals(message.path("method").asText())) {
                    return message;
                }
            }
            Thread.sleep(10);
        }
        throw new AssertionError("No '" + method + "' message received, got " + receivedMethods());
    }

    void send(Object message) throws IOException {
        synchronized (toClient) {
            toClient.write((objectMapper.writeValueAsString(message) + "\n").getBytes(StandardCharsets.UTF_8));
            toClient.flush();
        }
    }

    /**
     * Simulates the server process exiting: the client sees end-of-stream.
     */
    @Override
    public void close() throws IOException {
        toClient.close();
    }

    private void serve() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(fromClient, StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                handle(objectMapper.readTree(line));
                line = reader.readLine();
            }
        } catch (IOException e) {
            // pipe closed by either side; the server just stops
        }
    }

    private void handle(JsonNode message) throws IOException {
        received.add(message);
        if (!message.has("id")) {
            return;
        }
        String method = message.path("method").asText();
        Function<JsonNode, Object> handler = handlers.get(method);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", "2.0");
        response.put("id", message.get("id").asInt());
        if (handler == null) {
            response.put("error", Map.of("code", -32601, "message", "Method not found: " + method));
            send(response);
            return;
        }
        Object result = handler.apply(message.path("params"));
        if (result == null) {
            return;
        }
        if (result instanceof RpcError error) {
            response.put("error", Map.of("code", error.code(), "message", error.message()));
        } else {
            response.put("result", result);
        }
        send(response);
    }

    record RpcError(int code, String message) {
    }
}
