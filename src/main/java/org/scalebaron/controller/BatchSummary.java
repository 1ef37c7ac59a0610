package org.scalebaron.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate result of {@link BatchController#processAllElements()}.
 */
public final class BatchSummary {
    private static final Logger logger = LoggerFactory.getLogger(BatchSummary.class);

    private final List<ElementOutcome> outcomes;
    private final boolean cancelled;
    private final Duration elapsed;

    public BatchSummary(List<ElementOutcome> outcomes, boolean cancelled, Duration elapsed) {
        this.outcomes = List.copyOf(outcomes);
        this.cancelled = cancelled;
        this.elapsed = elapsed;
    }

    public List<ElementOutcome> getOutcomes() {
        return outcomes;
    }

    public List<ElementOutcome> withStatus(ElementOutcome.Status status) {
        List<ElementOutcome> result = new ArrayList<>();
        for (ElementOutcome outcome : outcomes) {
            if (outcome.status() == status) {
                result.add(outcome);
            }
        }
        return result;
    }

    public int getSucceededCount() {
        return withStatus(ElementOutcome.Status.SUCCEEDED).size();
    }

    public int getPartialCount() {
        return withStatus(ElementOutcome.Status.PARTIAL).size();
    }

    public int getFailedCount() {
        return withStatus(ElementOutcome.Status.FAILED).size();
    }

    public int getSkippedCount() {
        return withStatus(ElementOutcome.Status.SKIPPED_COMPLETE).size();
    }

    /**
     * @return every sample failure across all elements, in processing order
     */
    public List<SampleFailure> getFailures() {
        List<SampleFailure> all = new ArrayList<>();
        outcomes.forEach(o -> all.addAll(o.failures()));
        return all;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public void log() {
        logger.info("Batch finished in {} s: {} succeeded, {} partial, {} failed, {} skipped{}",
                elapsed.toMillis() / 1000.0, getSucceededCount(), getPartialCount(), getFailedCount(),
                getSkippedCount(), cancelled ? " (cancelled)" : "");
        for (ElementOutcome outcome : outcomes) {
            switch (outcome.status()) {
                case FAILED -> logger.error("  {}", outcome);
                case PARTIAL -> logger.warn("  {}", outcome);
                default -> logger.info("  {}", outcome);
            }
        }
    }

    @Override
    public String toString() {
        return String.format("BatchSummary[succeeded=%d, partial=%d, failed=%d, skipped=%d, cancelled=%s]",
                getSucceededCount(), getPartialCount(), getFailedCount(), getSkippedCount(), cancelled);
    }
}
