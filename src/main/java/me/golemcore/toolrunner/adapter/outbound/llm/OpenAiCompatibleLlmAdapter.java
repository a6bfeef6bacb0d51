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

package me.golemcore.toolrunner.adapter.outbound.llm;

import me.golemcore.toolrunner.domain.model.LlmChunk;
import me.golemcore.toolrunner.domain.model.LlmRequest;
import me.golemcore.toolrunner.domain.model.LlmResponse;
import me.golemcore.toolrunner.domain.model.LlmUsage;
import me.golemcore.toolrunner.domain.model.Message;
import me.golemcore.toolrunner.infrastructure.config.ToolRunnerProperties;
import me.golemcore.toolrunner.port.outbound.LlmPort;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter for OpenAI-compatible chat-completions APIs over OkHttp.
 *
 * <p>
 * Works with any server exposing {@code POST /chat/completions} and
 * {@code GET /models} (OpenAI, vLLM, Ollama, LM Studio, DeepSeek, proxies).
 * Streaming uses server-sent events: each {@code data:} line is one JSON chunk,
 * {@code data: [DONE]} ends the stream. Usage is requested through
 * {@code stream_options.include_usage} and reported when the server sends it.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code toolrunner.llm.api-url} - Base URL of the API, e.g.
 * {@code https://api.openai.com/v1}
 * <li>{@code toolrunner.llm.api-key} - Bearer token (optional for local
 * servers)
 * <li>{@code toolrunner.llm.model} - Default model
 * </ul>
 */
@Slf4j
public class OpenAiCompatibleLlmAdapter implements LlmPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String SSE_DATA_PREFIX = "data:";
    private static final String SSE_DONE = "[DONE]";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ToolRunnerProperties.LlmProperties settings;
    private final String baseUrl;

    public OpenAiCompatibleLlmAdapter(OkHttpClient httpClient, ObjectMapper objectMapper,
            ToolRunnerProperties.LlmProperties settings) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.baseUrl = stripTrailingSlash(settings.getApiUrl());
    }

    @Override
    public String getProviderId() {
        return settings.getProviderId();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            Request httpRequest = buildHttpRequest(request, false);
            try (Response response = httpClient.newCall(httpRequest).execute()) {
                String body = readBody(response);
                if (!response.isSuccessful()) {
                    throw new IOException("HTTP " + response.code() + ": " + abbreviate(body));
                }
                return convertResponse(objectMapper.readTree(body));
            } catch (IOException e) {
                log.error("[LLM] Chat request failed: {}", e.getMessage());
                throw new UncheckedIOException("LLM chat failed: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return Flux.<LlmChunk>create(sink -> {
            Call call = httpClient.newCall(buildHttpRequest(request, true));
            sink.onDispose(call::cancel);
            try (Response response = call.execute()) {
                if (!response.isSuccessful()) {
                    sink.error(new IOException("HTTP " + response.code() + ": " + abbreviate(readBody(response))));
                    return;
                }
                ResponseBody body = response.body();
                if (body == null) {
                    sink.error(new IOException("Empty response body"));
                    return;
                }
                BufferedSource source = body.source();
                String line;
                while (!sink.isCancelled() && (line = source.readUtf8Line()) != null) {
                    String data = sseData(line);
                    if (data == null) {
                        continue;
                    }
                    if (SSE_DONE.equals(data)) {
                        break;
                    }
                    LlmChunk chunk = parseChunk(data);
                    if (chunk != null) {
                        sink.next(chunk);
                    }
                }
                sink.complete();
            } catch (IOException e) {
                if (!sink.isCancelled()) {
                    log.warn("[LLM] Stream failed: {}", e.getMessage());
                    sink.error(e);
                }
            } catch (RuntimeException e) {
                sink.error(e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public List<String> getSupportedModels() {
        Request httpRequest = authorized(new Request.Builder().url(baseUrl + "/models").get()).build();
        try (Response response = httpClient.newCall(httpRequest).execute()) {
            String body = readBody(response);
            if (!response.isSuccessful()) {
                log.warn("[LLM] Listing models failed: HTTP {}", response.code());
                return Collections.emptyList();
            }
            List<String> models = new ArrayList<>();
            for (JsonNode model : objectMapper.readTree(body).path("data")) {
                String id = model.path("id").asText(null);
                if (id != null) {
                    models.add(id);
                }
            }
            return models;
        } catch (IOException e) {
            log.warn("[LLM] Listing models failed: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    @Override
    public String getCurrentModel() {
        return settings.getModel();
    }

    /**
     * Health check: the endpoint answers the model listing with at least one
     * model.
     */
    @Override
    public boolean isAvailable() {
        return !getSupportedModels().isEmpty();
    }

    /**
     * Extracts the payload of an SSE {@code data:} line; other lines (comments,
     * {@code event:}, blank separators) yield {@code null}.
     */
    static String sseData(String line) {
        if (line == null || !line.startsWith(SSE_DATA_PREFIX)) {
            return null;
        }
        String data = line.substring(SSE_DATA_PREFIX.length()).trim();
        return data.isEmpty() ? null : data;
    }

    LlmChunk parseChunk(String data) throws IOException {
        JsonNode node;
        try {
            node = objectMapper.readTree(data);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Skipping unparseable stream chunk: {}", e.getOriginalMessage());
            return null;
        }
        JsonNode error = node.get("error");
        if (error != null && !error.isNull()) {
            throw new IOException("Provider error: " + error.path("message").asText(error.toString()));
        }

        LlmChunk.LlmChunkBuilder builder = LlmChunk.builder();
        boolean hasData = false;

        JsonNode choice = node.path("choices").path(0);
        JsonNode delta = choice.path("delta");
        String content = textOrNull(delta.get("content"));
        if (content != null) {
            builder.text(content);
            hasData = true;
        }
        String reasoning = textOrNull(delta.has("reasoning_content") ? delta.get("reasoning_content")
                : delta.get("reasoning"));
        if (reasoning != null) {
            builder.reasoning(reasoning);
            hasData = true;
        }
        JsonNode toolCalls = delta.get("tool_calls");
        if (toolCalls != null && toolCalls.isArray() && !toolCalls.isEmpty()) {
            List<LlmChunk.ToolCallDelta> deltas = new ArrayList<>();
            for (int i = 0; i < toolCalls.size(); i++) {
                JsonNode toolCall = toolCalls.get(i);
                JsonNode function = toolCall.path("function");
                deltas.add(LlmChunk.ToolCallDelta.builder()
                        .index(toolCall.path("index").asInt(i))
                        .id(textOrNull(toolCall.get("id")))
                        .name(textOrNull(function.get("name")))
                        .argumentsFragment(textOrNull(function.get("arguments")))
                        .build());
            }
            builder.toolCallDeltas(deltas);
            hasData = true;
        }
        String finishReason = textOrNull(choice.get("finish_reason"));
        if (finishReason != null) {
            builder.finishReason(finishReason);
            hasData = true;
        }
        LlmUsage usage = parseUsage(node.get("usage"));
        if (usage != null) {
            builder.usage(usage);
            hasData = true;
        }
        return hasData ? builder.build() : null;
    }

    private LlmResponse convertResponse(JsonNode body) {
        JsonNode choice = body.path("choices").path(0);
        if (choice.isMissingNode()) {
            return LlmResponse.builder()
                    .content("")
                    .finishReason("error")
                    .build();
        }
        JsonNode message = choice.path("message");

        List<Message.ToolCall> toolCalls = null;
        JsonNode toolCallsNode = message.get("tool_calls");
        if (toolCallsNode != null && toolCallsNode.isArray() && !toolCallsNode.isEmpty()) {
            toolCalls = new ArrayList<>();
            for (JsonNode toolCall : toolCallsNode) {
                toolCalls.add(Message.ToolCall.builder()
                        .id(textOrNull(toolCall.get("id")))
                        .name(toolCall.path("function").path("name").asText())
                        .arguments(parseJsonArgs(toolCall.path("function").path("arguments").asText(null)))
                        .build());
            }
        }

        return LlmResponse.builder()
                .content(textOrNull(message.get("content")))
                .reasoning(textOrNull(message.get("reasoning_content")))
                .toolCalls(toolCalls)
                .usage(parseUsage(body.get("usage")))
                .model(textOrNull(body.get("model")))
                .finishReason(textOrNull(choice.get("finish_reason")))
                .build();
    }

    private LlmUsage parseUsage(JsonNode usage) {
        if (usage == null || usage.isNull() || !usage.isObject()) {
            return null;
        }
        int input = usage.path("prompt_tokens").asInt(0);
        int output = usage.path("completion_tokens").asInt(0);
        int total = usage.has("total_tokens") ? usage.path("total_tokens").asInt(0) : input + output;
        return LlmUsage.builder()
                .inputTokens(input)
                .outputTokens(output)
                .totalTokens(total)
                .build();
    }

    private Request buildHttpRequest(LlmRequest request, boolean stream) {
        ChatCompletionRequest apiRequest = buildRequest(request, stream);
        String json;
        try {
            json = objectMapper.writeValueAsString(apiRequest);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize chat request: " + e.getOriginalMessage(), e);
        }
        log.debug("[LLM] POST {}/chat/completions (stream: {}, messages: {}, tools: {})", baseUrl, stream,
                apiRequest.getMessages().size(), apiRequest.getTools() != null ? apiRequest.getTools().size() : 0);
        Request.Builder builder = new Request.Builder()
                .url(baseUrl + "/chat/completions")
                .post(RequestBody.create(json, JSON));
        if (stream) {
            builder.header("Accept", "text/event-stream");
        }
        return authorized(builder).build();
    }

    private Request.Builder authorized(Request.Builder builder) {
        String apiKey = settings.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder;
    }

    ChatCompletionRequest buildRequest(LlmRequest request, boolean stream) {
        ChatCompletionRequest apiRequest = new ChatCompletionRequest();
        apiRequest.setModel(request.getModel() != null ? request.getModel() : settings.getModel());
        apiRequest.setTemperature(request.getTemperature() != null ? request.getTemperature()
                : settings.getTemperature());
        apiRequest.setMaxTokens(request.getMaxTokens() != null ? request.getMaxTokens() : settings.getMaxTokens());
        if (stream) {
            apiRequest.setStream(true);
            apiRequest.setStreamOptions(Map.of("include_usage", true));
        }

        List<ApiMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            ApiMessage sysMsg = new ApiMessage();
            sysMsg.setRole(Message.ROLE_SYSTEM);
            sysMsg.setContent(request.getSystemPrompt());
            messages.add(sysMsg);
        }

        for (Message msg : request.getMessages()) {
            ApiMessage apiMsg = new ApiMessage();
            apiMsg.setRole(msg.getRole());
            apiMsg.setContent(msg.getContent());

            if (msg.hasToolCalls()) {
                apiMsg.setToolCalls(msg.getToolCalls().stream()
                        .map(tc -> {
                            ApiToolCall atc = new ApiToolCall();
                            atc.setId(tc.getId());
                            atc.setType("function");
                            ApiFunction func = new ApiFunction();
                            func.setName(tc.getName());
                            func.setArguments(convertArgsToJson(tc.getArguments()));
                            atc.setFunction(func);
                            return atc;
                        })
                        .toList());
            }
            if (msg.getToolCallId() != null) {
                apiMsg.setToolCallId(msg.getToolCallId());
            }
            messages.add(apiMsg);
        }
        apiRequest.setMessages(messages);

        if (request.hasTools()) {
            apiRequest.setTools(request.getTools().stream()
                    .map(tool -> {
                        ApiTool apiTool = new ApiTool();
                        apiTool.setType("function");
                        ApiToolFunction func = new ApiToolFunction();
                        func.setName(tool.getName());
                        func.setDescription(tool.getDescription());
                        func.setParameters(tool.getInputSchema());
                        apiTool.setFunction(func);
                        return apiTool;
                    })
                    .toList());
        }
        return apiRequest;
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getOriginalMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to parse tool arguments: {}", e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }

    private static String readBody(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.string() : "";
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static String abbreviate(String text) {
        return text.length() > 500 ? text.substring(0, 500) + "..." : text;
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatCompletionRequest {
        private String model;
        private List<ApiMessage> messages;
        private List<ApiTool> tools;
        private Double temperature;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
        private Boolean stream;
        @JsonProperty("stream_options")
        private Map<String, Object> streamOptions;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ApiMessage {
        private String role;
        private String content;
        @JsonProperty("tool_calls")
        private List<ApiToolCall> toolCalls;
        @JsonProperty("tool_call_id")
        private String toolCallId;
    }

    @Data
    public static class ApiTool {
        private String type;
        private ApiToolFunction function;
    }

    @Data
    public static class ApiToolFunction {
        private String name;
        private String description;
        private Map<String, Object> parameters;
    }

    @Data
    public static class ApiToolCall {
        private String id;
        private String type;
        private ApiFunction function;
    }

    @Data
    public static class ApiFunction {
        private String name;
        private String arguments;
    }
}
