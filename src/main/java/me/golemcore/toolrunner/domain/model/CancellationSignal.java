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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a run, its provider stream and
 * its in-flight tool calls.
 *
 * <p>
 * Listeners registered with {@link #onCancel(Runnable)} fire exactly once, on
 * the thread that calls {@link #cancel(String)}; a listener registered after
 * cancellation fires immediately. Child signals created with {@link #child()}
 * are cancelled together with their parent but can also be cancelled on their
 * own.
 */
public final class CancellationSignal {

    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile String reason;

    /**
     * Creates a signal that is never cancelled by anyone but its holder.
     */
    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    /**
     * Raises the signal. Subsequent calls are ignored.
     *
     * @return true if this call cancelled the signal
     */
    public boolean cancel(String cancelReason) {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        this.reason = cancelReason != null ? cancelReason : "cancelled";
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("[Cancel] Listener failed: {}", e.getMessage(), e);
            }
        }
        listeners.clear();
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getReason() {
        return reason;
    }

    /**
     * Registers a listener invoked when the signal is raised.
     *
     * @return a registration that removes the listener when closed
     */
    public Registration onCancel(Runnable listener) {
        Runnable once = runOnce(listener);
        if (isCancelled()) {
            once.run();
            return () -> {
            };
        }
        listeners.add(once);
        // cancel() may have raced with add()
        if (isCancelled()) {
            listeners.remove(once);
            once.run();
        }
        return () -> listeners.remove(once);
    }

    /**
     * Creates a signal that is cancelled whenever this one is.
     */
    public CancellationSignal child() {
        CancellationSignal child = new CancellationSignal();
        Registration registration = onCancel(() -> child.cancel(reason));
        child.onCancel(registration::close);
        return child;
    }

    private static Runnable runOnce(Runnable listener) {
        AtomicBoolean ran = new AtomicBoolean(false);
        return () -> {
            if (ran.compareAndSet(false, true)) {
                listener.run();
            }
        };
    }

    /**
     * Handle returned by {@link #onCancel(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
