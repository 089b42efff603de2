package com.example.signalrag.domain.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Unit-length dense embedding. Use {@link #normalized(float[])} to build one from raw model output.
 */
public record DenseVector(float[] values) {

    public DenseVector {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("dense vector must not be empty");
        }
        values = values.clone();
    }

    /**
     * L2-normalizes the raw vector so cosine similarity equals the dot product.
     *
     * @throws IllegalArgumentException if the vector is empty, has zero norm or non-finite components
     */
    public static DenseVector normalized(float[] raw) {
        if (raw == null || raw.length == 0) {
            throw new IllegalArgumentException("dense vector must not be empty");
        }
        double sum = 0.0;
        for (float v : raw) {
            sum += (double) v * v;
        }
        double norm = Math.sqrt(sum);
        if (norm == 0.0 || Double.isNaN(norm) || Double.isInfinite(norm)) {
            throw new IllegalArgumentException("dense vector has no usable norm: " + norm);
        }
        float[] out = new float[raw.length];
        for (int i = 0; i < raw.length; i++) {
            out[i] = (float) (raw[i] / norm);
        }
        return new DenseVector(out);
    }

    public int dimensions() {
        return values.length;
    }

    public double l2Norm() {
        double sum = 0.0;
        for (float v : values) {
            sum += (double) v * v;
        }
        return Math.sqrt(sum);
    }

    public double dot(DenseVector other) {
        if (other.values.length != values.length) {
            throw new IllegalArgumentException("dimension mismatch: " + values.length + " vs " + other.values.length);
        }
        double dot = 0.0;
        for (int i = 0; i < values.length; i++) {
            dot += (double) values[i] * other.values[i];
        }
        return dot;
    }

    /**
     * Boxed copy, the shape the Elasticsearch client expects for {@code dense_vector} fields.
     */
    public List<Float> toList() {
        List<Float> out = new ArrayList<>(values.length);
        for (float v : values) {
            out.add(v);
        }
        return out;
    }

    @Override
    public float[] values() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DenseVector other && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "DenseVector[dims=" + values.length + "]";
    }
}
