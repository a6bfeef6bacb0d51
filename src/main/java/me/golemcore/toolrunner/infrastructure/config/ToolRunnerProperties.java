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

import me.golemcore.toolrunner.domain.model.McpServerConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the tool runner.
 *
 * <p>
 * All configuration is organized under the {@code toolrunner.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - model provider endpoint</li>
 * <li>{@link AgentProperties} - agent loop ceilings and concurrency</li>
 * <li>{@link McpProperties} - external tool servers</li>
 * <li>{@link ToolsProperties} - built-in tools and result limits</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "toolrunner")
@Data
public class ToolRunnerProperties {

    private LlmProperties llm = new LlmProperties();
    private AgentProperties agent = new AgentProperties();
    private McpProperties mcp = new McpProperties();
    private ToolsProperties tools = new ToolsProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class LlmProperties {
        private String providerId = "openai";
        private String apiUrl = "";
        private String apiKey = "";
        private String model = "gpt-4o-mini";
        private Double temperature;
        private Integer maxTokens;
    }

    // ==================== AGENT LOOP ====================

    @Data
    public static class AgentProperties {
        /** Max completion rounds per run. */
        private int maxIterations = 10;

        /** Max tool calls executed across a whole run. */
        private int maxToolCalls = 25;

        /** Max tool calls of one round executing at the same time. */
        private int maxParallelTools = 4;

        /**
         * After cancellation, how long to wait for in-flight tool calls to report
         * their own result before a cancelled result is synthesized.
         */
        private long cancelGraceMs = 5000;

        /** Number of failed tool results in one round that triggers guidance. */
        private int errorGuidanceThreshold = 2;

        private String systemPrompt = """
                You are an AI coding assistant. You help developers by:
                - Reading, writing, and listing files
                - Running shell commands
                - Using tools exposed by connected tool servers

                Guidelines:
                - Be concise and direct
                - Use tools to gather information before making assumptions
                - After completing a task, summarize what was done in text
                - Do NOT keep calling tools after the task is complete""";
    }

    // ==================== MCP ====================

    @Data
    public static class McpProperties {
        private boolean enabled = true;

        /** Handshake timeout in seconds. */
        private int defaultStartupTimeout = 30;

        /** Per-request timeout in seconds. */
        private int requestTimeout = 60;

        private List<McpServerConfig> servers = new ArrayList<>();
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private String workspace = "${user.home}/.golemcore/toolrunner";

        /** Hard ceiling for a single tool execution, in seconds. */
        private int executionTimeout = 300;

        /** Tool output longer than this is truncated before it enters history. */
        private int maxToolResultChars = 50_000;

        private int maxFilesList = 200;

        private ShellToolProperties shell = new ShellToolProperties();

        private BackgroundProcessProperties background = new BackgroundProcessProperties();
    }

    @Data
    public static class ShellToolProperties {
        private boolean enabled = true;
        private int defaultTimeout = 30;
        private int maxTimeout = 300;
    }

    @Data
    public static class BackgroundProcessProperties {
        private boolean enabled = true;

        /** Lines kept per output stream of each background process. */
        private int maxOutputLines = 1000;

        /** Running background processes allowed per session. */
        private int maxProcessesPerSession = 10;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 120000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
