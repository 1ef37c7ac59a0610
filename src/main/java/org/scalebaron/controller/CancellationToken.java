package org.scalebaron.controller;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag for a batch run. The batch checks it between samples and between
 * elements; a file being read or written when it is set is finished first.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
