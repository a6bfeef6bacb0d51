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

package me.golemcore.toolrunner.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration for one external MCP (Model Context Protocol) tool server.
 * Specifies the unique server name (used as the tool namespace), the command
 * that starts the server, environment variables, and the handshake timeout.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class McpServerConfig {

    private String name;

    private String command;

    @Builder.Default
    private Map<String, String> env = new HashMap<>();

    /**
     * Handshake timeout; zero or negative means "use the configured default".
     */
    @Builder.Default
    private int startupTimeoutSeconds = 0;

    /**
     * Connect this server when the application starts.
     */
    @Builder.Default
    private boolean autoConnect = true;
}
