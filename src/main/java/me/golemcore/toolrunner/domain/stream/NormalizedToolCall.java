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

package me.golemcore.toolrunner.domain.stream;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * A tool call detected in one provider round, either from structured deltas or
 * from inline marker text. When {@link #getError()} is set the arguments could
 * not be parsed and the call must not be executed.
 */
@Data
@Builder
public class NormalizedToolCall {

    private String id;
    private String name;
    private Map<String, Object> arguments;
    private String rawArguments;
    private String error;

    public boolean isMalformed() {
        return error != null;
    }
}
