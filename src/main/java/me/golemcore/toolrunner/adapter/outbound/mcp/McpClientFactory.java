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
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Creates one {@link McpClient} per server configuration.
 */
@Component
public class McpClientFactory {

    private final ObjectMapper objectMapper;
    private final ToolRunnerProperties properties;

    public McpClientFactory(ObjectMapper objectMapper, ToolRunnerProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public McpClient create(McpServerConfig config) {
        Duration requestTimeout = Duration.ofSeconds(Math.max(1, properties.getMcp().getRequestTimeout()));
        return new McpClient(config, objectMapper, requestTimeout);
    }
}
