package me.golemcore.toolrunner.infrastructure.config;

import me.golemcore.toolrunner.domain.loop.AgentLoopConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AgentLoopConfigFromPropertiesTest {

    @Test
    void shouldCopyAgentAndModelSettings() {
        ToolRunnerProperties properties = new ToolRunnerProperties();
        properties.getAgent().setMaxIterations(7);
        properties.getAgent().setMaxToolCalls(11);
        properties.getAgent().setMaxParallelTools(2);
        properties.getAgent().setCancelGraceMs(1500);
        properties.getAgent().setErrorGuidanceThreshold(3);
        properties.getLlm().setModel("deepseek-chat");
        properties.getLlm().setTemperature(0.2);

        AgentLoopConfig config = AgentLoopConfig.from(properties);

        assertEquals(7, config.getMaxIterations());
        assertEquals(11, config.getMaxToolCalls());
        assertEquals(2, config.getMaxParallelTools());
        assertEquals(1500, config.getCancelGraceMs());
        assertEquals(3, config.getErrorGuidanceThreshold());
        assertEquals("deepseek-chat", config.getModel());
        assertEquals(0.2, config.getTemperature());
        assertEquals(properties.getAgent().getSystemPrompt(), config.getSystemPrompt());
    }

    @Test
    void shouldDefaultToDocumentedCeilings() {
        AgentLoopConfig config = AgentLoopConfig.builder().build();

        assertEquals(10, config.getMaxIterations());
        assertEquals(25, config.getMaxToolCalls());
    }
}
