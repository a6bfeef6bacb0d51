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

import me.golemcore.toolrunner.domain.model.ToolFailureKind;
import me.golemcore.toolrunner.domain.model.ToolOutput;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Flattens an MCP {@code tools/call} result into a single {@link ToolOutput}.
 *
 * <p>
 * Text blocks are joined with newlines. Image blocks become a
 * {@code [image: <mimeType>]} placeholder so binary payloads never reach the
 * conversation. Any other block is serialized as JSON.
 */
public class McpContentMapper {

    static final String NO_OUTPUT = "(no output)";

    private final ObjectMapper objectMapper;

    public McpContentMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ToolOutput map(String toolName, JsonNode result) {
        if (result == null || result.isNull()) {
            return ToolOutput.failure(ToolFailureKind.TRANSPORT_FAILED, "No result from MCP tool: " + toolName);
        }

        boolean isError = result.path("isError").asBoolean(false);

        StringBuilder output = new StringBuilder();
        JsonNode contentNode = result.get("content");
        if (contentNode != null && contentNode.isArray()) {
            for (JsonNode item : contentNode) {
                String rendered = renderBlock(item);
                if (rendered.isEmpty()) {
                    continue;
                }
                if (!output.isEmpty()) {
                    output.append("\n");
                }
                output.append(rendered);
            }
        }
        JsonNode structured = result.get("structuredContent");
        if (output.isEmpty() && structured != null && !structured.isNull()) {
            output.append(toJson(structured));
        }

        if (isError) {
            return ToolOutput.failure(ToolFailureKind.EXECUTION_FAILED,
                    output.isEmpty() ? "MCP tool error" : output.toString());
        }
        return ToolOutput.success(output.isEmpty() ? NO_OUTPUT : output.toString());
    }

    String renderBlock(JsonNode item) {
        String type = item.path("type").asText("text");
        return switch (type) {
        case "text" -> item.path("text").asText("");
        case "image" -> "[image: " + item.path("mimeType").asText("unknown") + "]";
        default -> toJson(item);
        };
    }

    private String toJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return node.toString();
        }
    }
}
