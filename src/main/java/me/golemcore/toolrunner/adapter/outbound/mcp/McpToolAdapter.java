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

import me.golemcore.toolrunner.domain.component.ToolComponent;
import me.golemcore.toolrunner.domain.model.ToolContext;
import me.golemcore.toolrunner.domain.model.ToolDefinition;
import me.golemcore.toolrunner.domain.model.ToolOutput;
import me.golemcore.toolrunner.port.outbound.McpPort;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Wraps a single remote MCP tool as a {@link ToolComponent} under its qualified
 * name {@code <server>__<tool>}.
 *
 * <p>
 * Created dynamically by {@link McpClientManager} on every tool refresh; not a
 * Spring bean. Execution is delegated back to the manager so a call that loses
 * its connection fails as a value instead of touching a closed client.
 */
public class McpToolAdapter implements ToolComponent {

    private static final String OWNER_PREFIX = "mcp:";

    private final String serverName;
    private final ToolDefinition definition;
    private final McpPort mcpPort;

    public McpToolAdapter(String serverName, ToolDefinition remoteDefinition, McpPort mcpPort) {
        this.serverName = serverName;
        this.definition = remoteDefinition.toBuilder()
                .name(McpPort.qualify(serverName, remoteDefinition.getName()))
                .build();
        this.mcpPort = mcpPort;
    }

    static String ownerOf(String serverName) {
        return OWNER_PREFIX + serverName;
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> arguments, ToolContext context) {
        return mcpPort.executeTool(definition.getName(), arguments, context);
    }

    @Override
    public String getOwner() {
        return ownerOf(serverName);
    }

    public String getServerName() {
        return serverName;
    }
}
