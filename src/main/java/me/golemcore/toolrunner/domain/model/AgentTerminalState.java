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
 * How an agent run ended.
 */
public enum AgentTerminalState {

    /** The model answered without requesting tools. */
    DONE,

    /** A provider or stream fault aborted the run. */
    ERROR,

    /** The run's cancellation signal was raised. */
    CANCELLED,

    /** The iteration ceiling was hit while tool calls were still requested. */
    LIMIT_REACHED
}
