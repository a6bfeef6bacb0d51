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

package me.golemcore.toolrunner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the GolemCore tool runner.
 *
 * <p>
 * The tool runner drives a streaming model through repeated rounds of tool
 * calls until the model stops asking for tools, a ceiling is hit or the run is
 * cancelled.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Tool Registry</b> - built-in file and shell tools plus tools
 * published by MCP servers</li>
 * <li><b>MCP Bridge</b> - stdio JSON-RPC tool servers namespaced as
 * {@code <server>__<tool>}</li>
 * <li><b>Stream Normalizer</b> - text, reasoning and fragmented tool-call
 * deltas, including inline tool-call markers</li>
 * <li><b>Agent Loop</b> - bounded iterations, concurrent tool execution and
 * cooperative cancellation</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Domain Layer       → AgentLoop, StreamNormalizer, ToolRegistry
 * Ports              → LlmPort, McpPort
 * Adapters           → OpenAI-compatible LLM, MCP stdio clients, tools
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the {@code toolrunner.*}
 * prefix.
 */
@SpringBootApplication
public class ToolRunnerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolRunnerApplication.class, args);
    }

}
