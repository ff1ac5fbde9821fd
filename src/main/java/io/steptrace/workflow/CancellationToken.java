package io.steptrace.workflow;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal shared by a run, its executors and any nested runs they start.
 * The runner checks it at step boundaries and before each parallel branch; an executor that wants
 * to stop early calls {@link #throwIfCancelled()}.
 */
public final class CancellationToken {
    private final AtomicReference<String> reason = new AtomicReference<>();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * @return true when this call cancelled the token, false when it was already cancelled
     */
    public boolean cancel(String why) {
        String value = why == null || why.isBlank() ? "cancelled" : why;
        return reason.compareAndSet(null, value);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }

    public void throwIfCancelled() {
        String value = reason.get();
        if (value != null) {
            throw new CancellationException(value);
        }
    }
}
