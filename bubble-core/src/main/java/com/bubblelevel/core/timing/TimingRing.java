package com.bubblelevel.core.timing;

import java.util.Arrays;

/**
 * Fixed-capacity buffer of inter-arrival deltas.
 *
 * <p>Once {@link #isFull()}, the caller snapshots the window and calls
 * {@link #restart()}: the last delta of the finished window becomes the first
 * delta of the next one, so a new window never starts from an empty slot.
 */
public class TimingRing {

    private final long[] data;
    private int size;

    public TimingRing(int capacity) {
        if (capacity < 2) {
            throw new IllegalArgumentException("capacity must be >= 2 but was " + capacity);
        }
        this.data = new long[capacity];
    }

    /**
     * Appends a delta.
     *
     * @throws IllegalStateException if the ring is full and has not been restarted
     */
    public void add(long delta) {
        if (isFull()) {
            throw new IllegalStateException("TimingRing is full; restart() before adding");
        }
        data[size++] = delta;
    }

    public boolean isFull() {
        return size == data.length;
    }

    public int size() {
        return size;
    }

    /** Copy of the deltas currently held, oldest first. */
    public long[] snapshot() {
        return Arrays.copyOf(data, size);
    }

    /** Starts a new window seeded with the most recent delta. */
    public void restart() {
        if (size == 0) {
            return;
        }
        data[0] = data[size - 1];
        size = 1;
    }
}
