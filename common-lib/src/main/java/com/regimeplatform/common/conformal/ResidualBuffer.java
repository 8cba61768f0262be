package com.regimeplatform.common.conformal;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Bounded, time-ordered ring of absolute residuals with exponential-decay weights.
 *
 * <p>The newest residual has weight 1, the one before {@code decay}, then {@code decay^2}, and so
 * on; with {@code decay = 1} every retained residual counts equally. Once {@code capacity} is
 * reached the oldest residual is overwritten.
 */
public final class ResidualBuffer {

    private final double[] values;
    private final double decay;
    private int head;
    private int size;

    public ResidualBuffer(int capacity, double decay) {
        this.values = new double[capacity];
        this.decay = decay;
    }

    public void add(double residual) {
        values[head] = residual;
        head = (head + 1) % values.length;
        if (size < values.length) size++;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Weighted empirical quantile: the smallest residual whose cumulative weight (ascending by
     * value) reaches {@code q} of the total weight. Returns 0 on an empty buffer.
     */
    public double quantile(double q) {
        if (size == 0) return 0.0;
        double level = Math.max(0.0, Math.min(1.0, q));

        double[][] pairs = new double[size][2];
        double total = 0.0;
        double w = 1.0;
        for (int ago = 0; ago < size; ago++) {
            pairs[ago][0] = values[Math.floorMod(head - 1 - ago, values.length)];
            pairs[ago][1] = w;
            total += w;
            w *= decay;
        }
        Arrays.sort(pairs, (a, b) -> Double.compare(a[0], b[0]));

        double cutoff = level * total;
        double acc = 0.0;
        for (double[] p : pairs) {
            acc += p[1];
            if (acc >= cutoff) return p[0];
        }
        return pairs[pairs.length - 1][0];
    }

    /** Oldest first. */
    public List<Double> toList() {
        List<Double> out = new ArrayList<>(size);
        for (int i = size - 1; i >= 0; i--) {
            out.add(values[Math.floorMod(head - 1 - i, values.length)]);
        }
        return out;
    }

    public void clear() {
        head = 0;
        size = 0;
    }
}
