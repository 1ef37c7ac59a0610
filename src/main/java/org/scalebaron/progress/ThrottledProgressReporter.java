package org.scalebaron.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * ThrottledProgressReporter
 *
 * <p>Rate-limits progress updates to a downstream {@link ProgressListener}. At most
 * {@code maxUpdatesPerSecond} updates pass through; the rest are dropped. The first update and the
 * final one ({@code completed >= total}) are always forwarded so a listener never ends on a stale
 * value.
 */
public class ThrottledProgressReporter implements ProgressListener {
    private static final Logger logger = LoggerFactory.getLogger(ThrottledProgressReporter.class);

    public static final int DEFAULT_MAX_UPDATES_PER_SECOND = 10;

    private final ProgressListener delegate;
    private final long minIntervalNanos;
    private final LongSupplier clock;

    private final AtomicLong lastForwarded = new AtomicLong(Long.MIN_VALUE);
    private final AtomicInteger dropped = new AtomicInteger();

    public ThrottledProgressReporter(ProgressListener delegate, int maxUpdatesPerSecond) {
        this(delegate, maxUpdatesPerSecond, System::nanoTime);
    }

    /**
     * @param clock nanosecond time source
     */
    public ThrottledProgressReporter(ProgressListener delegate, int maxUpdatesPerSecond, LongSupplier clock) {
        if (maxUpdatesPerSecond <= 0) {
            throw new IllegalArgumentException("maxUpdatesPerSecond must be positive: " + maxUpdatesPerSecond);
        }
        this.delegate = delegate == null ? ProgressListener.NONE : delegate;
        this.minIntervalNanos = 1_000_000_000L / maxUpdatesPerSecond;
        this.clock = clock;
    }

    @Override
    public void onProgress(int completed, int total, String message) {
        long now = clock.getAsLong();
        long last = lastForwarded.get();
        boolean finalUpdate = completed >= total;
        boolean first = last == Long.MIN_VALUE;
        if (!finalUpdate && !first && now - last < minIntervalNanos) {
            dropped.incrementAndGet();
            return;
        }
        lastForwarded.set(now);
        if (finalUpdate && dropped.get() > 0) {
            logger.debug("Progress reporter dropped {} update(s)", dropped.get());
        }
        delegate.onProgress(completed, total, message);
    }

    /**
     * @return number of updates that were not forwarded
     */
    public int getDroppedCount() {
        return dropped.get();
    }
}
