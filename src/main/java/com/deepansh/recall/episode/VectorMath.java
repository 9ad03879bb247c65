package com.deepansh.recall.episode;

import java.util.List;

/**
 * Cosine helpers shared by the episodic stores.
 */
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine distance, 1 - cosine similarity. Mismatched dimensions and zero
     * vectors are treated as maximally unrelated (distance 1) so they can never
     * sneak under a relevance threshold.
     */
    public static double cosineDistance(float[] a, List<Double> b) {
        if (b == null || a.length != b.size()) return 1.0;
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            double bi = b.get(i);
            dot   += a[i] * bi;
            normA += a[i] * a[i];
            normB += bi * bi;
        }
        if (normA == 0 || normB == 0) return 1.0;
        return 1.0 - dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    public static List<Double> toDoubleList(float[] arr) {
        Double[] result = new Double[arr.length];
        for (int i = 0; i < arr.length; i++) result[i] = (double) arr[i];
        return List.of(result);
    }
}
