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

import me.golemcore.toolrunner.infrastructure.config.ToolRunnerProperties;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable settings for {@link AgentLoop}. Per-run ceilings in an
 * {@link me.golemcore.toolrunner.domain.model.AgentRunRequest} override the
 * defaults held here.
 */
@Value
@Builder(toBuilder = true)
public class AgentLoopConfig {

    @Builder.Default
    int maxIterations = 10;

    @Builder.Default
    int maxToolCalls = 25;

    @Builder.Default
    int maxParallelTools = 4;

    @Builder.Default
    long cancelGraceMs = 5000;

    @Builder.Default
    int errorGuidanceThreshold = 2;

    String systemPrompt;
    String model;
    Double temperature;
    Integer maxTokens;

    public static AgentLoopConfig from(ToolRunnerProperties properties) {
        ToolRunnerProperties.AgentProperties agent = properties.getAgent();
        ToolRunnerProperties.LlmProperties llm = properties.getLlm();
        return AgentLoopConfig.builder()
                .maxIterations(agent.getMaxIterations())
                .maxToolCalls(agent.getMaxToolCalls())
                .maxParallelTools(agent.getMaxParallelTools())
                .cancelGraceMs(agent.getCancelGraceMs())
                .errorGuidanceThreshold(agent.getErrorGuidanceThreshold())
                .systemPrompt(agent.getSystemPrompt())
                .model(llm.getModel())
                .temperature(llm.getTemperature())
                .maxTokens(llm.getMaxTokens())
                .build();
    }
}
