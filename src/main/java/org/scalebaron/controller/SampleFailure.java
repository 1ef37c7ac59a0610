package org.scalebaron.controller;

import org.scalebaron.model.ElementKey;

/**
 * One (sample, element) pair that could not be processed.
 *
 * @param errorType simple name of the exception, e.g. {@code MatrixParseException}
 */
public record SampleFailure(String sample, ElementKey element, String errorType, String reason) {

    public static SampleFailure of(String sample, ElementKey element, Exception e) {
        String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return new SampleFailure(sample, element, e.getClass().getSimpleName(), reason);
    }

    @Override
    public String toString() {
        return sample + " / " + element + ": " + reason + " (" + errorType + ")";
    }
}
