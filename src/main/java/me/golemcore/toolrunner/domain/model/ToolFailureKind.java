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

/**
 * Classifies why a {@link ToolOutput} is an error. Stored in the output
 * metadata under {@link ToolOutput#FAILURE_KIND}.
 */
public enum ToolFailureKind {

    /**
     * No tool with the requested name is registered.
     */
    NOT_FOUND,

    /**
     * The handler threw, timed out, or reported a failure (e.g. non-zero exit).
     */
    EXECUTION_FAILED,

    /**
     * The tool-server transport failed (server gone, malformed response).
     */
    TRANSPORT_FAILED,

    /**
     * The call arguments streamed by the model were not valid JSON.
     */
    MALFORMED_ARGUMENTS,

    /**
     * The call was cancelled before it produced a result.
     */
    CANCELLED,

    /**
     * The call was rejected because a run-level ceiling was reached.
     */
    LIMIT_EXCEEDED
}
