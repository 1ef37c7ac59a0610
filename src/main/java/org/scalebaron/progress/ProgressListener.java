package org.scalebaron.progress;

/**
 * Receives batch progress updates.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (completed, total, message) -> { };

    /**
     * @param completed work units finished so far
     * @param total total work units in the run
     * @param message short human-readable status
     */
    void onProgress(int completed, int total, String message);
}
