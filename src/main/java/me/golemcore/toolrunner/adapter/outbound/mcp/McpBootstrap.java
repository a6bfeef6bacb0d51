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
import me.golemcore.toolrunner.infrastructure.config.ToolRunnerProperties;
import me.golemcore.toolrunner.port.outbound.McpConnectionException;
import me.golemcore.toolrunner.port.outbound.McpPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Connects the configured servers marked {@code auto-connect} once the
 * application is ready. A server that fails to connect is logged and skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class McpBootstrap {

    private final McpPort mcpPort;
    private final ToolRunnerProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void connectConfiguredServers() {
        ToolRunnerProperties.McpProperties mcp = properties.getMcp();
        if (!mcp.isEnabled() || mcp.getServers() == null || mcp.getServers().isEmpty()) {
            return;
        }
        int connected = 0;
        for (McpServerConfig server : mcp.getServers()) {
            if (!server.isAutoConnect()) {
                log.debug("[McpManager] Skipping '{}' (auto-connect disabled)", server.getName());
                continue;
            }
            try {
                mcpPort.connect(server);
                connected++;
            } catch (McpConnectionException e) {
                log.error("[McpManager] Failed to connect '{}': {}", server.getName(), e.getMessage());
            }
        }
        log.info("[McpManager] Auto-connected {}/{} configured servers", connected, mcp.getServers().size());
    }
}
