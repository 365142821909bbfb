package org.janelia.calibration;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for a run.
 * Workers check the flag before starting each group, groups already in progress finish normally.
 */
public class CancellationFlag {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
