package io.reactormesh.unit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Checked cancellation. The engine never stops a worker thread; it sets the reason
 * and runs registered callbacks, and unit code observes it at its next checkpoint.
 */
public final class CancellationToken {
    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile String reason;

    public boolean cancel(String why) {
        List<Runnable> toRun;
        synchronized (callbacks) {
            if (reason != null) {
                return false;
            }
            reason = why == null || why.isBlank() ? "cancelled" : why;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable callback : toRun) {
            runCallback(callback);
        }
        return true;
    }

    public boolean isCancelled() {
        return reason != null;
    }

    public String reason() {
        return reason;
    }

    /**
     * Runs {@code callback} on cancellation, or right away if already cancelled.
     */
    public void onCancel(Runnable callback) {
        synchronized (callbacks) {
            if (reason == null) {
                callbacks.add(callback);
                return;
            }
        }
        runCallback(callback);
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.warn("Cancellation callback failed", e);
        }
    }
}
