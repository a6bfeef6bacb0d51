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

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outcome of one agent run: final answer, full message history, tool-call
 * count and usage summed across rounds.
 */
@Data
@Builder
public class AgentRunResult {

    private AgentTerminalState terminalState;
    private String finalAnswer;
    private List<Message> messages;
    private int toolCallCount;
    private int iterations;
    private LlmUsage usage;
    private String error;
}
