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
import lombok.Getter;

import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Per-invocation value passed to a tool: working directory, cancellation
 * signal, optional progress callback and the opaque session id. Supplied by
 * the caller of the registry, never owned by a tool.
 */
@Getter
@Builder(toBuilder = true)
public class ToolContext {

    private final Path workingDirectory;

    @Builder.Default
    private final CancellationSignal cancellation = CancellationSignal.create();

    private final Consumer<String> progressListener;

    private final String sessionId;

    /**
     * Reports incremental output to the caller, if anyone is listening.
     */
    public void reportProgress(String output) {
        if (progressListener != null && output != null) {
            progressListener.accept(output);
        }
    }

    public boolean isCancelled() {
        return cancellation != null && cancellation.isCancelled();
    }
}
