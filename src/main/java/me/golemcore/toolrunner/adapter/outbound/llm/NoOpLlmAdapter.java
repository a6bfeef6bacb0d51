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

package me.golemcore.toolrunner.adapter.outbound.llm;

import me.golemcore.toolrunner.domain.model.LlmChunk;
import me.golemcore.toolrunner.domain.model.LlmRequest;
import me.golemcore.toolrunner.domain.model.LlmResponse;
import me.golemcore.toolrunner.port.outbound.LlmPort;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * No-op LLM adapter used when no provider URL is configured.
 *
 * <p>
 * Always answers with a placeholder and never requests tools, so an agent run
 * against it ends after one round.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Slf4j
public class NoOpLlmAdapter implements LlmPort {

    static final String PLACEHOLDER = "[No LLM configured]";

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("[LLM] chat() called but no LLM is configured");
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content(PLACEHOLDER)
                .model("none")
                .finishReason("stop")
                .build());
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        log.warn("[LLM] chatStream() called but no LLM is configured");
        return Flux.just(LlmChunk.builder()
                .text(PLACEHOLDER)
                .finishReason("stop")
                .build());
    }

    @Override
    public List<String> getSupportedModels() {
        return Collections.emptyList();
    }

    @Override
    public String getCurrentModel() {
        return "none";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
