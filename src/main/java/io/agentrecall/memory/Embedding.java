package io.agentrecall.memory;

import java.util.Arrays;

/**
 * An immutable embedding vector.
 *
 * <p>A zero-length vector is a valid value here; it is simply not comparable with anything.
 * "Not computed yet" is expressed by an empty {@code Optional<Embedding>} on the record instead.</p>
 *
 * @param vector the components, copied on construction
 */
public record Embedding(float[] vector) {

    public Embedding {
        vector = vector == null ? new float[0] : vector.clone();
    }

    public static Embedding of(float... values) {
        return new Embedding(values);
    }

    @Override
    public float[] vector() {
        return vector.clone();
    }

    public int dimensions() {
        return vector.length;
    }

    /**
     * Returns true if a cosine similarity between the two vectors is meaningful:
     * same non-zero dimension and a finite, non-zero norm on both sides.
     */
    public boolean isComparableTo(Embedding other) {
        return other != null
                && vector.length == other.vector.length
                && isUsable()
                && other.isUsable();
    }

    /**
     * Returns true for a non-empty vector with a finite, non-zero norm.
     */
    public boolean isUsable() {
        return vector.length > 0 && hasUsableNorm();
    }

    /**
     * Cosine similarity in [-1, 1].
     *
     * @throws IllegalArgumentException if the vectors differ in length
     */
    public double cosineSimilarity(Embedding other) {
        if (vector.length != other.vector.length) {
            throw new IllegalArgumentException(
                    "Vectors must have same length: %d != %d".formatted(vector.length, other.vector.length));
        }

        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < vector.length; i++) {
            dot += (double) vector[i] * other.vector[i];
            normA += (double) vector[i] * vector[i];
            normB += (double) other.vector[i] * other.vector[i];
        }

        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private boolean hasUsableNorm() {
        double norm = 0;
        for (float v : vector) {
            norm += (double) v * v;
        }
        return norm > 0 && Double.isFinite(norm);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Embedding other && Arrays.equals(vector, other.vector);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(vector);
    }

    @Override
    public String toString() {
        return "Embedding[dimensions=" + vector.length + "]";
    }
}
