package com.sensor.anomaly.engine.isolationforest;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity ring of the most recent samples, the pool retraining draws from. Once full,
 * each add overwrites the oldest entry. Adds and snapshots are mutually exclusive, so a
 * snapshot is always a consistent point-in-time copy.
 */
public class SampleRingBuffer<T> {

    private final Object[] slots;
    private int head;   // next write position
    private int size;

    public SampleRingBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Ring buffer capacity must be positive: " + capacity);
        }
        this.slots = new Object[capacity];
    }

    public synchronized void add(T sample) {
        slots[head] = sample;
        head = (head + 1) % slots.length;
        if (size < slots.length) {
            size++;
        }
    }

    /** Oldest to newest. */
    @SuppressWarnings("unchecked")
    public synchronized List<T> snapshot() {
        List<T> copy = new ArrayList<>(size);
        int start = (head - size + slots.length) % slots.length;
        for (int i = 0; i < size; i++) {
            copy.add((T) slots[(start + i) % slots.length]);
        }
        return copy;
    }

    public synchronized int size() {
        return size;
    }

    public int capacity() {
        return slots.length;
    }
}
