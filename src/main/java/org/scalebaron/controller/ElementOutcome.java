package org.scalebaron.controller;

import org.scalebaron.model.ElementKey;

import java.util.List;

/**
 * Result of processing one element.
 *
 * @param processedSamples samples whose statistics went into the composite
 * @param attemptedSamples number of samples the element was attempted for
 * @param failures per-sample failures; for {@link Status#FAILED} with no samples, the element-level reason
 * @param scaleValue the shared scale maximum, NaN if none was resolved
 */
public record ElementOutcome(ElementKey element, Status status, List<String> processedSamples,
                             int attemptedSamples, List<SampleFailure> failures, String reason,
                             double scaleValue) {

    public enum Status {
        SUCCEEDED,
        PARTIAL,
        FAILED,
        SKIPPED_COMPLETE,
        CANCELLED
    }

    public ElementOutcome {
        processedSamples = List.copyOf(processedSamples);
        failures = List.copyOf(failures);
    }

    public static ElementOutcome skipped(ElementKey element) {
        return new ElementOutcome(element, Status.SKIPPED_COMPLETE, List.of(), 0, List.of(),
                "already complete", Double.NaN);
    }

    public static ElementOutcome cancelled(ElementKey element, List<String> processed, int attempted,
                                           List<SampleFailure> failures) {
        return new ElementOutcome(element, Status.CANCELLED, processed, attempted, failures,
                "cancelled", Double.NaN);
    }

    public static ElementOutcome failed(ElementKey element, int attempted, List<SampleFailure> failures,
                                        String reason) {
        return new ElementOutcome(element, Status.FAILED, List.of(), attempted, failures, reason, Double.NaN);
    }

    @Override
    public String toString() {
        return switch (status) {
            case SUCCEEDED -> element + ": " + processedSamples.size() + " sample(s)";
            case PARTIAL -> element + ": " + processedSamples.size() + "/" + attemptedSamples
                    + " sample(s), failed: " + failures;
            case FAILED -> element + ": failed - " + reason;
            case SKIPPED_COMPLETE -> element + ": skipped (already complete)";
            case CANCELLED -> element + ": cancelled";
        };
    }
}
