package me.golemcore.toolrunner.adapter.outbound.llm;

import me.golemcore.toolrunner.domain.model.LlmRequest;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class NoOpLlmAdapterTest {

    private final NoOpLlmAdapter adapter = new NoOpLlmAdapter();

    @Test
    void shouldAnswerWithPlaceholder() {
        assertEquals(NoOpLlmAdapter.PLACEHOLDER, adapter.chat(LlmRequest.builder().build()).join().getContent());
        assertFalse(adapter.isAvailable());
        assertEquals("none", adapter.getProviderId());
    }

    @Test
    void shouldStreamSingleStopChunk() {
        StepVerifier.create(adapter.chatStream(LlmRequest.builder().build()))
                .assertNext(chunk -> {
                    assertEquals(NoOpLlmAdapter.PLACEHOLDER, chunk.getText());
                    assertEquals("stop", chunk.getFinishReason());
                })
                .verifyComplete();
    }
}
