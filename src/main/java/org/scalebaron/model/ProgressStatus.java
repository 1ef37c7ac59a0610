package org.scalebaron.model;

/**
 * Lifecycle of one (sample, element) pair as observed on disk.
 */
public enum ProgressStatus {
    /** Nothing has been produced yet, or the input matrix is absent/unreadable. */
    MISSING,
    /** Statistics/histogram artifact exists, the composite does not. */
    PARTIAL,
    /** The composite exists and is current with respect to its inputs. */
    COMPLETE;

    public boolean isComplete() {
        return this == COMPLETE;
    }
}
