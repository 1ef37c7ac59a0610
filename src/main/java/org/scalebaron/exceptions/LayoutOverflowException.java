package org.scalebaron.exceptions;

/**
 * Raised when a requested row count cannot be honoured for the number of samples being composited.
 */
public class LayoutOverflowException extends IllegalArgumentException {

    private final int requestedRows;
    private final int sampleCount;

    public LayoutOverflowException(int requestedRows, int sampleCount) {
        super(String.format("Cannot lay out %d sample(s) in %d row(s)", sampleCount, requestedRows));
        this.requestedRows = requestedRows;
        this.sampleCount = sampleCount;
    }

    public int getRequestedRows() {
        return requestedRows;
    }

    public int getSampleCount() {
        return sampleCount;
    }
}
