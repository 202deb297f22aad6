package com.bubblelevel.core.timing;

import java.util.Optional;

/**
 * Diagnostic-only bookkeeping of sensor delivery jitter for one channel.
 *
 * <p>Deltas are collected in a {@link TimingRing}; each time the ring fills,
 * {@link JitterStats} are computed over the full window and the ring restarts
 * seeded with its last delta. How stats are surfaced is the caller's concern.
 *
 * <p>Never throws from {@link #record(long)}, whatever the magnitude of the delta.
 */
public class TimingBookKeeper {

    public static final int DEFAULT_CAPACITY = 1000;

    private final TimingRing ring;

    public TimingBookKeeper() {
        this(DEFAULT_CAPACITY);
    }

    public TimingBookKeeper(int capacity) {
        this.ring = new TimingRing(capacity);
    }

    /**
     * Records the delay since the previous sample of the channel.
     *
     * @return stats for the window this delta completed, otherwise empty
     */
    public Optional<JitterStats> record(long deltaMillis) {
        ring.add(deltaMillis);
        if (!ring.isFull()) {
            return Optional.empty();
        }
        JitterStats stats = calculate(ring.snapshot());
        ring.restart();
        return Optional.of(stats);
    }

    /** Deltas held in the window currently being filled. */
    public int size() {
        return ring.size();
    }

    /**
     * Computes count, mean, population standard deviation and extremes of
     * {@code window}. An empty window yields all-zero stats.
     */
    public static JitterStats calculate(long[] window) {
        int n = window.length;
        if (n == 0) {
            return new JitterStats(0, 0.0, 0.0, 0L, 0L);
        }

        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        double sum = 0.0;
        for (long delta : window) {
            sum += delta;
            if (delta < min) min = delta;
            if (delta > max) max = delta;
        }
        double mean = sum / n;

        double squares = 0.0;
        for (long delta : window) {
            double d = delta - mean;
            squares += d * d;
        }
        return new JitterStats(n, mean, Math.sqrt(squares / n), min, max);
    }
}
