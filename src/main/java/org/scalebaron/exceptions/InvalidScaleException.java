package org.scalebaron.exceptions;

/**
 * Raised when a user-supplied scale maximum is zero, negative, NaN or infinite.
 */
public class InvalidScaleException extends IllegalArgumentException {

    private final double value;

    public InvalidScaleException(double value) {
        super("Scale value must be a finite number greater than zero, got: " + value);
        this.value = value;
    }

    public double getValue() {
        return value;
    }
}
