package ch.so.arp.explorer.search;

import java.util.OptionalDouble;

/**
 * Vector helpers used by the ranking.
 */
final class Vectors {

    private Vectors() {
    }

    /**
     * Scale the vector to unit length.
     *
     * @return the normalized copy, or {@code null} for a zero-norm vector
     */
    static double[] normalize(float[] vector) {
        double norm = 0.0d;
        for (float value : vector) {
            norm += (double) value * value;
        }
        norm = Math.sqrt(norm);
        if (norm == 0.0d || Double.isNaN(norm) || Double.isInfinite(norm)) {
            return null;
        }
        double[] normalized = new double[vector.length];
        for (int i = 0; i < vector.length; i++) {
            normalized[i] = vector[i] / norm;
        }
        return normalized;
    }

    /**
     * Cosine similarity of a unit query vector and a raw candidate vector,
     * clamped to {@code [-1, 1]}. Empty when the candidate has a zero norm or
     * a different dimension.
     */
    static OptionalDouble cosineSimilarity(double[] unitQuery, float[] candidate) {
        if (candidate.length != unitQuery.length) {
            return OptionalDouble.empty();
        }
        double[] unitCandidate = normalize(candidate);
        if (unitCandidate == null) {
            return OptionalDouble.empty();
        }
        double dot = 0.0d;
        for (int i = 0; i < unitQuery.length; i++) {
            dot += unitQuery[i] * unitCandidate[i];
        }
        return OptionalDouble.of(Math.max(-1.0d, Math.min(1.0d, dot)));
    }
}
