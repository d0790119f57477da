package com.cellsentinel.core.detection;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded trailing window of values with incrementally maintained mean and
 * sample standard deviation.
 *
 * <h3>Implementation</h3>
 * <p>
 * Welford's update is applied when a value enters the window. When the
 * oldest value is evicted the statistics are rebuilt from the buffered
 * values, so a long series never accumulates subtraction residue and a
 * window of equal values always reports a standard deviation of exactly 0.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * Not thread-safe. One instance serves one time-of-week partition for the
 * duration of a single classification pass.
 * </p>
 *
 * @since 1.0.0
 */
final class RollingWindow {

    private final int capacity;

    private final Deque<Double> values = new ArrayDeque<>();

    private double mean;

    /** Sum of squared differences from the current mean. */
    private double m2;

    /**
     * @param capacity maximum number of values kept
     * @throws IllegalArgumentException if {@code capacity} is &lt; 1
     */
    RollingWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Append a value, evicting the oldest one if the window is full.
     */
    void add(double value) {
        values.addLast(value);
        if (values.size() > capacity) {
            values.pollFirst();
            recompute();
            return;
        }
        accumulate(value, values.size());
    }

    int size() {
        return values.size();
    }

    double mean() {
        return values.isEmpty() ? 0.0 : mean;
    }

    /**
     * Sample (n − 1) standard deviation.
     *
     * @return the standard deviation, or {@code 0} with fewer than two values
     */
    double stddev() {
        int n = values.size();
        if (n < 2) {
            return 0.0;
        }
        return Math.sqrt(m2 / (n - 1));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void accumulate(double value, int n) {
        double delta = value - mean;
        mean += delta / n;
        m2 += delta * (value - mean);
        if (m2 < 0) {
            m2 = 0.0;
        }
    }

    private void recompute() {
        mean = 0.0;
        m2 = 0.0;
        int n = 0;
        for (double value : values) {
            accumulate(value, ++n);
        }
    }
}
