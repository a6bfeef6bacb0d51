package me.golemcore.toolrunner.adapter.outbound.llm;

import me.golemcore.toolrunner.domain.model.LlmChunk;
import me.golemcore.toolrunner.domain.model.LlmRequest;
import me.golemcore.toolrunner.domain.model.LlmResponse;
import me.golemcore.toolrunner.domain.model.Message;
import me.golemcore.toolrunner.domain.model.ToolDefinition;
import me.golemcore.toolrunner.infrastructure.config.ToolRunnerProperties;
import me.golemcore.toolrunner.testsupport.http.OkHttpMockEngine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenAiCompatibleLlmAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OkHttpMockEngine engine;
    private OpenAiCompatibleLlmAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        ToolRunnerProperties.LlmProperties settings = new ToolRunnerProperties.LlmProperties();
        settings.setApiUrl("http://llm.test/v1/");
        settings.setApiKey("sk-test");
        settings.setModel("gpt-4o-mini");
        adapter = new OpenAiCompatibleLlmAdapter(client, objectMapper, settings);
    }

    private static LlmRequest request() {
        return LlmRequest.builder()
                .systemPrompt("You are helpful")
                .messages(List.of(Message.user("List /tmp")))
                .tools(List.of(ToolDefinition.builder()
                        .name("list_files")
                        .description("List files")
                        .inputSchema(Map.of("type", "object", "properties", Map.of(
                                "path", Map.of("type", "string"))))
                        .build()))
                .stream(true)
                .build();
    }

    @Test
    void shouldStreamTextToolCallsAndUsage() {
        engine.enqueueEventStream("""
                : keep-alive

                data: {"choices":[{"index":0,"delta":{"role":"assistant","content":"Let me check"}}]}

                data: {"choices":[{"index":0,"delta":{"tool_calls":[{"index":0,"id":"call_1","type":"function","function":{"name":"list_files","arguments":""}}]}}]}

                data: {"choices":[{"index":0,"delta":{"tool_calls":[{"index":0,"function":{"arguments":"{\\"path\\":\\"/tmp\\"}"}}]}}]}

                data: {"choices":[{"index":0,"delta":{},"finish_reason":"tool_calls"}]}

                data: {"choices":[],"usage":{"prompt_tokens":20,"completion_tokens":7,"total_tokens":27}}

                data: [DONE]

                """);

        StepVerifier.create(adapter.chatStream(request()))
                .assertNext(chunk -> assertEquals("Let me check", chunk.getText()))
                .assertNext(chunk -> {
                    LlmChunk.ToolCallDelta delta = chunk.getToolCallDeltas().get(0);
                    assertEquals("call_1", delta.getId());
                    assertEquals("list_files", delta.getName());
                })
                .assertNext(chunk -> assertEquals("{\"path\":\"/tmp\"}",
                        chunk.getToolCallDeltas().get(0).getArgumentsFragment()))
                .assertNext(chunk -> assertEquals("tool_calls", chunk.getFinishReason()))
                .assertNext(chunk -> assertEquals(27, chunk.getUsage().getTotalTokens()))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldSendStreamingRequest() throws Exception {
        engine.enqueueEventStream("data: [DONE]\n\n");

        StepVerifier.create(adapter.chatStream(request())).expectComplete().verify(Duration.ofSeconds(5));

        OkHttpMockEngine.CapturedRequest captured = engine.takeRequest();
        assertEquals("POST", captured.method());
        assertEquals("/v1/chat/completions", captured.target());
        assertEquals("Bearer sk-test", captured.headers().get("Authorization"));
        JsonNode body = objectMapper.readTree(captured.body());
        assertEquals("gpt-4o-mini", body.path("model").asText());
        assertTrue(body.path("stream").asBoolean());
        assertTrue(body.path("stream_options").path("include_usage").asBoolean());
        assertEquals("system", body.path("messages").get(0).path("role").asText());
        assertEquals("List /tmp", body.path("messages").get(1).path("content").asText());
        assertEquals("list_files", body.path("tools").get(0).path("function").path("name").asText());
        assertFalse(body.has("temperature"));
    }

    @Test
    void shouldSerializeToolCallHistory() throws Exception {
        LlmRequest request = LlmRequest.builder()
                .messages(List.of(
                        Message.builder().role(Message.ROLE_ASSISTANT).toolCalls(List.of(Message.ToolCall.builder()
                                .id("call_1").name("list_files").arguments(Map.of("path", "/tmp")).build()))
                                .build(),
                        Message.builder().role(Message.ROLE_TOOL).toolCallId("call_1").toolName("list_files")
                                .content("a.txt").build()))
                .build();

        JsonNode body = objectMapper.valueToTree(adapter.buildRequest(request, true));

        JsonNode assistant = body.path("messages").get(0);
        assertEquals("call_1", assistant.path("tool_calls").get(0).path("id").asText());
        assertEquals("{\"path\":\"/tmp\"}", assistant.path("tool_calls").get(0).path("function").path("arguments")
                .asText());
        assertEquals("call_1", body.path("messages").get(1).path("tool_call_id").asText());
        assertFalse(body.has("tools"));
    }

    @Test
    void shouldSurfaceHttpErrorAsStreamError() {
        engine.enqueueJson(500, "{\"error\":{\"message\":\"overloaded\"}}");

        StepVerifier.create(adapter.chatStream(request()))
                .expectErrorSatisfies(error -> {
                    assertTrue(error instanceof IOException);
                    assertTrue(error.getMessage().startsWith("HTTP 500"));
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldSurfaceProviderErrorChunk() {
        engine.enqueueEventStream("""
                data: {"choices":[{"index":0,"delta":{"content":"Hi"}}]}

                data: {"error":{"message":"context length exceeded"}}

                """);

        StepVerifier.create(adapter.chatStream(request()))
                .assertNext(chunk -> assertEquals("Hi", chunk.getText()))
                .expectErrorMatches(error -> error.getMessage().contains("context length exceeded"))
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldSurfaceTransportFailure() {
        engine.enqueueFailure(new IOException("connection refused"));

        StepVerifier.create(adapter.chatStream(request()))
                .expectErrorMessage("connection refused")
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldParseReasoningDeltas() throws Exception {
        LlmChunk deepseek = adapter.parseChunk(
                "{\"choices\":[{\"delta\":{\"reasoning_content\":\"thinking...\"}}]}");
        LlmChunk generic = adapter.parseChunk("{\"choices\":[{\"delta\":{\"reasoning\":\"hmm\"}}]}");

        assertEquals("thinking...", deepseek.getReasoning());
        assertEquals("hmm", generic.getReasoning());
        assertNull(adapter.parseChunk("{\"choices\":[{\"delta\":{\"role\":\"assistant\"}}]}"));
        assertNull(adapter.parseChunk("not json"));
    }

    @Test
    void shouldExtractSseData() {
        assertEquals("{\"a\":1}", OpenAiCompatibleLlmAdapter.sseData("data: {\"a\":1}"));
        assertEquals("[DONE]", OpenAiCompatibleLlmAdapter.sseData("data:[DONE]"));
        assertNull(OpenAiCompatibleLlmAdapter.sseData(": comment"));
        assertNull(OpenAiCompatibleLlmAdapter.sseData("event: message"));
        assertNull(OpenAiCompatibleLlmAdapter.sseData(""));
    }

    @Test
    void shouldCompleteNonStreamingChat() throws Exception {
        engine.enqueueJson(200, """
                {"model":"gpt-4o-mini","choices":[{"index":0,"finish_reason":"tool_calls","message":{
                  "role":"assistant","content":null,
                  "tool_calls":[{"id":"call_9","type":"function",
                    "function":{"name":"read_file","arguments":"{\\"path\\":\\"a.txt\\"}"}}]}}],
                 "usage":{"prompt_tokens":5,"completion_tokens":2}}
                """);

        LlmResponse response = adapter.chat(request()).get(5, TimeUnit.SECONDS);

        assertEquals("tool_calls", response.getFinishReason());
        assertEquals("call_9", response.getToolCalls().get(0).getId());
        assertEquals(Map.of("path", "a.txt"), response.getToolCalls().get(0).getArguments());
        assertEquals(7, response.getUsage().getTotalTokens());
        JsonNode body = objectMapper.readTree(engine.takeRequest().body());
        assertFalse(body.has("stream"));
    }

    @Test
    void shouldListModels() {
        engine.enqueueJson(200, "{\"data\":[{\"id\":\"gpt-4o\"},{\"id\":\"gpt-4o-mini\"}]}");

        assertEquals(List.of("gpt-4o", "gpt-4o-mini"), adapter.getSupportedModels());
        assertEquals("/v1/models", engine.takeRequest().target());
    }

    @Test
    void shouldReportUnavailableWhenModelListingFails() {
        engine.enqueueJson(401, "{\"error\":\"unauthorized\"}");

        assertFalse(adapter.isAvailable());
    }
}
