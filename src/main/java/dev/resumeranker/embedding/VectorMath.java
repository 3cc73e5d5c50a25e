package dev.resumeranker.embedding;

/**
 * Vector helpers for embedding comparison.
 */
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity in [-1,1]; 0 when either vector has no magnitude.
     *
     * @throws IllegalArgumentException when dimensions differ
     */
    public static double cosine(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Dimension mismatch: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double cos = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(-1.0, Math.min(1.0, cos));
    }

    /**
     * Scale a vector to unit length in place. Zero vectors are left untouched.
     */
    public static double[] normalizeL2(double[] vector) {
        double sum = 0.0;
        for (double v : vector) {
            sum += v * v;
        }
        if (sum == 0.0) {
            return vector;
        }
        double norm = Math.sqrt(sum);
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
        return vector;
    }
}
