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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Input of one agent run. Unset ceilings and prompts fall back to the loop
 * configuration.
 */
@Data
@Builder(toBuilder = true)
public class AgentRunRequest {

    private String prompt;

    @Builder.Default
    private List<Message> history = new ArrayList<>();

    private String systemPrompt;
    private String model;

    private Integer maxIterations;
    private Integer maxToolCalls;

    @Builder.Default
    private CancellationSignal cancellation = CancellationSignal.create();

    private Path workingDirectory;
    private String sessionId;
}
