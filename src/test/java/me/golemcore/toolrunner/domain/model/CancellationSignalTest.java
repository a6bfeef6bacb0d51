package me.golemcore.toolrunner.domain.model;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CancellationSignalTest {

    @Test
    void shouldCancelOnlyOnce() {
        CancellationSignal signal = CancellationSignal.create();
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(calls::incrementAndGet);

        assertTrue(signal.cancel("user abort"));
        assertFalse(signal.cancel("again"));

        assertTrue(signal.isCancelled());
        assertEquals("user abort", signal.getReason());
        assertEquals(1, calls.get());
    }

    @Test
    void shouldRunListenerImmediatelyWhenAlreadyCancelled() {
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel(null);
        AtomicInteger calls = new AtomicInteger();

        signal.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
        assertEquals("cancelled", signal.getReason());
    }

    @Test
    void shouldNotRunListenerAfterRegistrationClosed() {
        CancellationSignal signal = CancellationSignal.create();
        AtomicInteger calls = new AtomicInteger();

        try (CancellationSignal.Registration ignored = signal.onCancel(calls::incrementAndGet)) {
            assertFalse(signal.isCancelled());
        }
        signal.cancel("late");

        assertEquals(0, calls.get());
    }

    @Test
    void shouldPropagateCancellationToChild() {
        CancellationSignal parent = CancellationSignal.create();
        CancellationSignal child = parent.child();

        parent.cancel("stop");

        assertTrue(child.isCancelled());
        assertEquals("stop", child.getReason());
    }

    @Test
    void shouldCancelChildWithoutAffectingParent() {
        CancellationSignal parent = CancellationSignal.create();
        CancellationSignal child = parent.child();

        child.cancel("local");

        assertTrue(child.isCancelled());
        assertFalse(parent.isCancelled());
    }

    @Test
    void shouldKeepRunningListenersWhenOneFails() {
        CancellationSignal signal = CancellationSignal.create();
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        signal.onCancel(calls::incrementAndGet);

        signal.cancel("x");

        assertEquals(1, calls.get());
    }
}
