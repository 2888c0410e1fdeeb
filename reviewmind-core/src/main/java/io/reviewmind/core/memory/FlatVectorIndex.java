package io.reviewmind.core.memory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Exact nearest-neighbour index over a contiguous float buffer. Every query scans all
 * vectors; neighbours with equal distance keep insertion order.
 */
public final class FlatVectorIndex {
    private static final int INITIAL_CAPACITY = 64;

    private final int dimension;
    private float[] data;
    private int size;

    public FlatVectorIndex(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        this.dimension = dimension;
        this.data = new float[INITIAL_CAPACITY * dimension];
    }

    public int dimension() {
        return dimension;
    }

    public int size() {
        return size;
    }

    public void add(float[] vector) {
        requireDimension(vector);
        int required = (size + 1) * dimension;
        if (required > data.length) {
            data = Arrays.copyOf(data, Math.max(required, data.length * 2));
        }
        System.arraycopy(vector, 0, data, size * dimension, dimension);
        size++;
    }

    public float[] vector(int position) {
        if (position < 0 || position >= size) {
            throw new IndexOutOfBoundsException("position " + position + " outside [0, " + size + ")");
        }
        int offset = position * dimension;
        return Arrays.copyOfRange(data, offset, offset + dimension);
    }

    public List<Neighbor> nearest(float[] query, int k) {
        requireDimension(query);
        if (k <= 0 || size == 0) {
            return List.of();
        }
        List<Neighbor> all = new ArrayList<>(size);
        for (int position = 0; position < size; position++) {
            all.add(new Neighbor(position, squaredDistance(query, position)));
        }
        all.sort(Comparator.comparingDouble(Neighbor::distance).thenComparingInt(Neighbor::position));
        return List.copyOf(all.subList(0, Math.min(k, all.size())));
    }

    private double squaredDistance(float[] query, int position) {
        int offset = position * dimension;
        double sum = 0.0;
        for (int i = 0; i < dimension; i++) {
            double diff = (double) query[i] - data[offset + i];
            sum += diff * diff;
        }
        return sum;
    }

    private void requireDimension(float[] vector) {
        if (vector == null) {
            throw new IllegalArgumentException("vector must not be null");
        }
        if (vector.length != dimension) {
            throw new DimensionMismatchException(dimension, vector.length);
        }
    }

    public record Neighbor(int position, double distance) {
    }
}
