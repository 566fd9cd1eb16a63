package com.sandwich.orchestrator.selection;

/**
 * Vector helpers for embedding comparison.
 */
public final class Vectors {

    private Vectors() {}

    /**
     * Cosine similarity of {@code a} and {@code b}; 0.0 when either has zero norm.
     * Extra components of the longer vector are ignored.
     */
    public static double cosineSimilarity(double[] a, double[] b) {
        int n = Math.min(a.length, b.length);
        double dot = 0.0;
        for (int i = 0; i < n; i++) {
            dot += a[i] * b[i];
        }
        double normA = norm(a);
        double normB = norm(b);
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (normA * normB);
    }

    static double norm(double[] v) {
        double sum = 0.0;
        for (double x : v) {
            sum += x * x;
        }
        return Math.sqrt(sum);
    }

    static double clamp01(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
