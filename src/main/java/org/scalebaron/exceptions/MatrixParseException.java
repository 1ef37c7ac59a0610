package org.scalebaron.exceptions;

import java.io.IOException;

/**
 * Exception thrown when an element matrix file cannot be turned into numbers.
 * This covers malformed or truncated spreadsheets as well as cloud-sync placeholder
 * files that exist on disk but have not been downloaded yet.
 *
 * @author Mike Nelson
 * @since 0.1
 */
public class MatrixParseException extends IOException {

    /**
     * Constructs a new matrix parse exception with the specified detail message.
     *
     * @param message the detail message
     */
    public MatrixParseException(String message) {
        super(message);
    }

    /**
     * Constructs a new matrix parse exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the underlying parser failure
     */
    public MatrixParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
