package com.bubblelevel.core.aggregation;

import com.bubblelevel.core.coordinates.Coordinates;
import com.bubblelevel.core.coordinates.CoordinatesCalculator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Batches per-sample coordinates of one channel into fixed-size windows so the
 * decision rate is decoupled from the raw sensor rate.
 *
 * <p>Exactly one averaged value is produced per {@code sampleSize} pushes. A
 * window that is still filling when the owning pipeline closes is dropped, never
 * flushed.
 *
 * <p>Not thread-safe: each instance belongs to a single channel and is only
 * touched from that channel's delivery thread.
 */
public class SampleAggregator {

    private final int sampleSize;
    private final CoordinatesCalculator calculator;
    private final List<Coordinates> window;

    public SampleAggregator(int sampleSize, CoordinatesCalculator calculator) {
        if (sampleSize < 1) {
            throw new IllegalArgumentException("sampleSize must be >= 1 but was " + sampleSize);
        }
        this.sampleSize = sampleSize;
        this.calculator = calculator;
        this.window     = new ArrayList<>(sampleSize);
    }

    /**
     * Appends to the current window.
     *
     * @return the window average when this push completed the window, otherwise empty
     */
    public Optional<Coordinates> push(Coordinates coordinates) {
        window.add(coordinates);
        if (window.size() < sampleSize) {
            return Optional.empty();
        }
        Coordinates average = calculator.calculateAverage(window);
        window.clear();
        return Optional.of(average);
    }

    /** Number of coordinates in the window currently being filled. */
    public int size() {
        return window.size();
    }
}
