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
 * Kinds of normalized stream events.
 */
public enum StreamEventType {
    TEXT,
    THINKING,
    TOOL_START,
    TOOL_PROGRESS,
    TOOL_COMPLETE,
    TOOL_ERROR,
    USAGE,
    DONE,
    ERROR;

    /**
     * Checks if this event ends a stream.
     */
    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }

    /**
     * Checks if this event belongs to a tool call and therefore carries a
     * tool-call id.
     */
    public boolean isToolEvent() {
        return this == TOOL_START || this == TOOL_PROGRESS || this == TOOL_COMPLETE || this == TOOL_ERROR;
    }
}
