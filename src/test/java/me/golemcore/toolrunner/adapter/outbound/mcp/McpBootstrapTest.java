package me.golemcore.toolrunner.adapter.outbound.mcp;

import me.golemcore.toolrunner.domain.model.McpServerConfig;
import me.golemcore.toolrunner.infrastructure.config.ToolRunnerProperties;
import me.golemcore.toolrunner.port.outbound.McpConnectionException;
import me.golemcore.toolrunner.port.outbound.McpPort;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class McpBootstrapTest {

    @Test
    void shouldConnectAutoConnectServersAndSkipFailures() {
        McpPort mcpPort = mock(McpPort.class);
        ToolRunnerProperties properties = new ToolRunnerProperties();
        McpServerConfig broken = McpServerConfig.builder().name("broken").command("false").build();
        McpServerConfig github = McpServerConfig.builder().name("github").command("github-mcp").build();
        McpServerConfig manual = McpServerConfig.builder().name("manual").command("x").autoConnect(false).build();
        properties.getMcp().setServers(List.of(broken, github, manual));
        when(mcpPort.connect(broken)).thenThrow(new McpConnectionException("broken", "Handshake failed"));

        new McpBootstrap(mcpPort, properties).connectConfiguredServers();

        verify(mcpPort).connect(broken);
        verify(mcpPort).connect(github);
        verify(mcpPort, never()).connect(manual);
    }

    @Test
    void shouldDoNothingWhenDisabled() {
        McpPort mcpPort = mock(McpPort.class);
        ToolRunnerProperties properties = new ToolRunnerProperties();
        properties.getMcp().setEnabled(false);
        properties.getMcp().setServers(List.of(McpServerConfig.builder().name("github").command("x").build()));

        new McpBootstrap(mcpPort, properties).connectConfiguredServers();

        verify(mcpPort, never()).connect(any(McpServerConfig.class));
    }
}
