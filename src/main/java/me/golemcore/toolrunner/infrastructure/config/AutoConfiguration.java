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

package me.golemcore.toolrunner.infrastructure.config;

import me.golemcore.toolrunner.adapter.outbound.llm.NoOpLlmAdapter;
import me.golemcore.toolrunner.adapter.outbound.llm.OpenAiCompatibleLlmAdapter;
import me.golemcore.toolrunner.domain.loop.AgentLoop;
import me.golemcore.toolrunner.domain.loop.AgentLoopConfig;
import me.golemcore.toolrunner.domain.service.ToolRegistry;
import me.golemcore.toolrunner.port.outbound.LlmPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;

/**
 * Spring configuration that wires the model provider and the agent loop.
 *
 * <p>
 * The provider is chosen from {@code toolrunner.llm.api-url}: a blank URL
 * selects {@link NoOpLlmAdapter}, anything else an
 * {@link OpenAiCompatibleLlmAdapter} sharing the application's OkHttp client.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final ToolRunnerProperties properties;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public LlmPort llmPort(OkHttpClient okHttpClient, ObjectMapper objectMapper) {
        ToolRunnerProperties.LlmProperties llm = properties.getLlm();
        if (llm.getApiUrl() == null || llm.getApiUrl().isBlank()) {
            log.warn("[LLM] No api-url configured, using no-op provider");
            return new NoOpLlmAdapter();
        }
        return new OpenAiCompatibleLlmAdapter(okHttpClient, objectMapper, llm);
    }

    @Bean(destroyMethod = "close")
    public AgentLoop agentLoop(LlmPort llmPort, ToolRegistry toolRegistry, ObjectMapper objectMapper,
            Clock clock) {
        return new AgentLoop(llmPort, toolRegistry, objectMapper, AgentLoopConfig.from(properties), clock);
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Tool Runner v{} starting...", version);
        log.info("LLM Provider: {}", properties.getLlm().getProviderId());
        log.info("Model: {}", properties.getLlm().getModel());
        log.info("Workspace: {}", properties.getTools().getWorkspace());
        log.info("MCP: {} ({} configured servers)",
                properties.getMcp().isEnabled() ? "enabled" : "disabled",
                properties.getMcp().getServers().size());
    }
}
