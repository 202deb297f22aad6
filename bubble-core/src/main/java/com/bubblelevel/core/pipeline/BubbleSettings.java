package com.bubblelevel.core.pipeline;

import com.bubblelevel.core.timing.TimingBookKeeper;

/**
 * Immutable configuration of one detector, fixed for the lifetime of every
 * pipeline built from it.
 *
 * @param sampleSize       coordinates averaged per decision; must be &gt;= 1
 * @param samplingPeriodUs sampling period requested from the sensor source, in µs
 * @param jitterWindow     inter-arrival deltas per jitter statistics window; must be &gt;= 2
 */
public record BubbleSettings(
    int sampleSize,
    int samplingPeriodUs,
    int jitterWindow
) {

    public static final int DEFAULT_SAMPLE_SIZE = 20;

    /** Platform "game" delay: 20 ms between samples. */
    public static final int DEFAULT_SAMPLING_PERIOD_US = 20_000;

    public BubbleSettings {
        if (sampleSize < 1) {
            throw new IllegalArgumentException("sampleSize must be >= 1 but was " + sampleSize);
        }
        if (samplingPeriodUs < 0) {
            throw new IllegalArgumentException("samplingPeriodUs must be >= 0 but was " + samplingPeriodUs);
        }
        if (jitterWindow < 2) {
            throw new IllegalArgumentException("jitterWindow must be >= 2 but was " + jitterWindow);
        }
    }

    public static BubbleSettings defaults() {
        return new BubbleSettings(DEFAULT_SAMPLE_SIZE, DEFAULT_SAMPLING_PERIOD_US,
                                  TimingBookKeeper.DEFAULT_CAPACITY);
    }

    public BubbleSettings withSampleSize(int sampleSize) {
        return new BubbleSettings(sampleSize, samplingPeriodUs, jitterWindow);
    }
}
