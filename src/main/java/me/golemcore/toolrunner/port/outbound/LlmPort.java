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

package me.golemcore.toolrunner.port.outbound;

import me.golemcore.toolrunner.domain.model.LlmChunk;
import me.golemcore.toolrunner.domain.model.LlmRequest;
import me.golemcore.toolrunner.domain.model.LlmResponse;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Model provider boundary. Any provider implementing this contract is usable
 * by the agent loop without changes; provider-specific wire quirks stay in
 * the adapter and the stream normalizer.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "openai", "ollama").
     */
    String getProviderId();

    /**
     * Executes a chat completion request and returns the full response.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Executes a streaming chat request, returning provider-native chunks.
     * Cancelling the subscription must abort the underlying transfer.
     */
    Flux<LlmChunk> chatStream(LlmRequest request);

    /**
     * Returns the list of model identifiers supported by this provider.
     */
    List<String> getSupportedModels();

    /**
     * Returns the current or default model identifier used by this provider.
     */
    String getCurrentModel();

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
