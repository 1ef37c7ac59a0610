package org.scalebaron.exceptions;

/**
 * Raised when a matrix contains no valid pixels once missing-value sentinels are removed,
 * or when an element has no processable samples left.
 */
public class EmptyDataException extends IllegalStateException {

    public EmptyDataException(String message) {
        super(message);
    }
}
