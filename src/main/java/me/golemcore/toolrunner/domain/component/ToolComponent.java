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

package me.golemcore.toolrunner.domain.component;

import me.golemcore.toolrunner.domain.model.ToolContext;
import me.golemcore.toolrunner.domain.model.ToolDefinition;
import me.golemcore.toolrunner.domain.model.ToolOutput;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A named, schema-described unit of executable work exposed to the model.
 *
 * <p>
 * Local tools and tools proxied from an external tool server implement the same
 * contract, so the registry dispatches both without branching on their origin.
 * Implementations should complete the returned future with a failed
 * {@link ToolOutput} rather than exceptionally; the registry converts stray
 * exceptions anyway.
 */
public interface ToolComponent extends Component {

    /** Owner id of tools implemented in-process. */
    String LOCAL_OWNER = "local";

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with the specified arguments.
     *
     * @param arguments
     *            the parsed call arguments
     * @param context
     *            per-invocation context (working directory, cancellation,
     *            progress, session)
     * @return a future containing the tool output
     */
    CompletableFuture<ToolOutput> execute(Map<String, Object> arguments, ToolContext context);

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }

    /**
     * Identifies the source that registered this tool. Registrations from the
     * same owner replace each other; a different owner claiming an existing name
     * is rejected by the registry.
     *
     * @return the owner id, {@link #LOCAL_OWNER} for in-process tools
     */
    default String getOwner() {
        return LOCAL_OWNER;
    }
}
