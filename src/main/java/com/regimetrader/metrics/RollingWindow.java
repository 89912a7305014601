package com.regimetrader.metrics;

import java.util.Arrays;

/**
 * Fixed-capacity ring buffer of doubles with running sum and sum of squares.
 *
 * <p>Mean and variance are O(1): the evicted value is subtracted from both sums before the
 * new value is added. Once per full lap the sums are recomputed from the buffer so eviction
 * round-off cannot accumulate over an unbounded stream.
 *
 * <p>Not thread-safe.
 */
public class RollingWindow {

    private final double[] values;
    private int head;
    private int size;
    private double sum;
    private double sumOfSquares;

    public RollingWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.values = new double[capacity];
    }

    /** Appends a value, evicting the oldest one when the window is full. */
    public void add(double value) {
        if (size == values.length) {
            double evicted = values[head];
            sum -= evicted;
            sumOfSquares -= evicted * evicted;
        } else {
            size++;
        }
        values[head] = value;
        head = (head + 1) % values.length;
        sum += value;
        sumOfSquares += value * value;

        if (head == 0 && size == values.length) {
            resync();
        }
    }

    public double mean() {
        return size == 0 ? 0.0 : sum / size;
    }

    /** Population variance E[X^2] - E[X]^2. May be slightly negative from round-off. */
    public double variance() {
        if (size == 0) {
            return 0.0;
        }
        double mean = sum / size;
        return sumOfSquares / size - mean * mean;
    }

    /**
     * Returns the value {@code offset} positions back from the newest entry
     * (0 = newest, size-1 = oldest).
     */
    public double fromNewest(int offset) {
        if (offset < 0 || offset >= size) {
            throw new IndexOutOfBoundsException("offset " + offset + " outside window of size " + size);
        }
        int index = Math.floorMod(head - 1 - offset, values.length);
        return values[index];
    }

    public double sum() {
        return sum;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return values.length;
    }

    public boolean isFull() {
        return size == values.length;
    }

    /** Window contents, oldest first. */
    public double[] toArray() {
        double[] copy = new double[size];
        for (int i = 0; i < size; i++) {
            copy[i] = fromNewest(size - 1 - i);
        }
        return copy;
    }

    public void clear() {
        Arrays.fill(values, 0.0);
        head = 0;
        size = 0;
        sum = 0.0;
        sumOfSquares = 0.0;
    }

    private void resync() {
        double freshSum = 0.0;
        double freshSquares = 0.0;
        for (double value : values) {
            freshSum += value;
            freshSquares += value * value;
        }
        sum = freshSum;
        sumOfSquares = freshSquares;
    }
}
