package me.golemcore.toolrunner.infrastructure.config;

import me.golemcore.toolrunner.adapter.outbound.llm.NoOpLlmAdapter;
import me.golemcore.toolrunner.adapter.outbound.llm.OpenAiCompatibleLlmAdapter;
import me.golemcore.toolrunner.domain.loop.AgentLoop;
import me.golemcore.toolrunner.domain.service.ToolRegistry;
import me.golemcore.toolrunner.port.outbound.LlmPort;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.Mockito.mock;

class AutoConfigurationTest {

    private ToolRunnerProperties properties;
    private AutoConfiguration configuration;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        properties = new ToolRunnerProperties();
        configuration = new AutoConfiguration(properties, mock(ObjectProvider.class));
    }

    @Test
    void shouldUseNoOpProviderWithoutApiUrl() {
        LlmPort port = configuration.llmPort(new OkHttpClient(), AutoConfiguration.objectMapper());

        assertInstanceOf(NoOpLlmAdapter.class, port);
    }

    @Test
    void shouldUseOpenAiCompatibleProviderWithApiUrl() {
        properties.getLlm().setApiUrl("http://localhost:11434/v1");
        properties.getLlm().setProviderId("ollama");
        properties.getLlm().setModel("qwen2.5-coder");

        LlmPort port = configuration.llmPort(new OkHttpClient(), AutoConfiguration.objectMapper());

        assertInstanceOf(OpenAiCompatibleLlmAdapter.class, port);
        assertEquals("ollama", port.getProviderId());
        assertEquals("qwen2.5-coder", port.getCurrentModel());
    }

    @Test
    void shouldBuildAgentLoopFromProperties() {
        properties.getAgent().setMaxIterations(3);
        ObjectMapper mapper = AutoConfiguration.objectMapper();
        ToolRegistry registry = new ToolRegistry(List.of(), properties);

        try (AgentLoop loop = configuration.agentLoop(new NoOpLlmAdapter(), registry, mapper, Clock.systemUTC())) {
            assertNotNull(loop);
        }
    }

    @Test
    void shouldConfigureLenientObjectMapper() {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        assertFalse(mapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    @Test
    void shouldLogStartupWithoutBuildInfo() {
        assertDoesNotThrow(() -> configuration.init());
    }
}
