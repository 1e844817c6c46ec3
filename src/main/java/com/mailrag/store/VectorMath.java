package com.mailrag.store;

import java.util.Comparator;
import java.util.List;

public final class VectorMath {
    private VectorMath() {
    }

    public static float squaredL2(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException("Vector", a.length, b.length);
        }
        float sum = 0f;
        for (int i = 0; i < a.length; i++) {
            float diff = a[i] - b[i];
            sum += diff * diff;
        }
        return sum;
    }

    public static void normalize(float[] vector) {
        float norm = 0f;
        for (float value : vector) {
            norm += value * value;
        }
        norm = (float) Math.sqrt(norm);
        if (norm <= 0f) {
            return;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
    }

    public static boolean isFinite(float[] vector) {
        for (float value : vector) {
            if (!Float.isFinite(value)) {
                return false;
            }
        }
        return true;
    }

    public static <T> List<Scored<T>> nearest(List<Scored<T>> candidates, int topK) {
        return candidates.stream()
                .sorted(Comparator.comparingDouble((Scored<T> scored) -> scored.distance())
                        .thenComparingLong(Scored::order))
                .limit(Math.max(0, topK))
                .toList();
    }

    public record Scored<T>(T item, float distance, long order) {
    }
}
