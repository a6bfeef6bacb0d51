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

package me.golemcore.toolrunner.port.outbound;

import me.golemcore.toolrunner.domain.model.McpServerConfig;
import me.golemcore.toolrunner.domain.model.McpServerState;
import me.golemcore.toolrunner.domain.model.ToolContext;
import me.golemcore.toolrunner.domain.model.ToolOutput;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for managing MCP (Model Context Protocol) tool servers. Abstracts the
 * lifecycle of out-of-process servers from the domain layer and publishes
 * their tools into the tool registry as {@code <server>__<tool>}.
 */
public interface McpPort {

    /** Separator between server name and remote tool name. */
    String NAMESPACE_SEPARATOR = "__";

    /**
     * Start the server, perform the handshake, and register its tools.
     *
     * @return the qualified names of the registered tools
     * @throws McpConnectionException
     *             if the handshake does not complete
     */
    List<String> connect(McpServerConfig config);

    /**
     * Re-query the server's tool list and make the registry match it exactly.
     *
     * @return the qualified names registered after the refresh
     */
    List<String> refreshTools(String serverName);

    /**
     * Close the transport and remove every tool in the server's namespace.
     * Safe to call more than once.
     */
    void disconnect(String serverName);

    /**
     * Forward a call to the owning server. Never completes exceptionally.
     */
    CompletableFuture<ToolOutput> executeTool(String qualifiedName, Map<String, Object> arguments,
            ToolContext context);

    McpServerState getState(String serverName);

    List<String> getConnectedServers();

    static String qualify(String serverName, String toolName) {
        return serverName + NAMESPACE_SEPARATOR + toolName;
    }
}
