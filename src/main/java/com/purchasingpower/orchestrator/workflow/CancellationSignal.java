package com.purchasingpower.orchestrator.workflow;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation passed into bus and validator entry points.
 *
 * <p>Cancellation is checked between steps, never in the middle of an agent call: a step that
 * has started runs to completion.
 */
public final class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal(null);

    private final Instant deadline;
    private final AtomicReference<String> reason = new AtomicReference<>();

    private CancellationSignal(Instant deadline) {
        this.deadline = deadline;
    }

    public static CancellationSignal none() {
        return NONE;
    }

    public static CancellationSignal create() {
        return new CancellationSignal(null);
    }

    public static CancellationSignal withDeadline(Instant deadline) {
        return new CancellationSignal(deadline);
    }

    /**
     * First reason wins. Has no effect on {@link #none()}.
     */
    public void cancel(String why) {
        if (this != NONE) {
            reason.compareAndSet(null, why != null ? why : "cancelled");
        }
    }

    public boolean isCancelled() {
        return reason.get() != null || isPastDeadline();
    }

    public boolean isPastDeadline() {
        return deadline != null && Instant.now().isAfter(deadline);
    }

    public String getReason() {
        String r = reason.get();
        if (r != null) {
            return r;
        }
        return isPastDeadline() ? "deadline " + deadline + " exceeded" : null;
    }
}
