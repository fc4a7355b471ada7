package io.judgebridge.session;

// Not thread-safe.
final class SampleWindow {
    private final double[] samples;
    private int next;
    private int size;

    SampleWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.samples = new double[capacity];
    }

    void add(double value) {
        samples[next] = value;
        next = (next + 1) % samples.length;
        if (size < samples.length) {
            size++;
        }
    }

    int size() {
        return size;
    }

    int capacity() {
        return samples.length;
    }

    Double mean() {
        if (size == 0) {
            return null;
        }
        double sum = 0.0;
        for (int i = 0; i < size; i++) {
            sum += samples[i];
        }
        return sum / size;
    }
}
