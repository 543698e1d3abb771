package dev.freelancematch.feature;

import java.util.Arrays;

/**
 * Immutable sparse vector over the skill vocabulary.
 * Indices are strictly ascending; weights are aligned with them.
 */
public final class SkillVector {

    private static final SkillVector EMPTY = new SkillVector(new int[0], new double[0]);

    private final int[] indices;
    private final double[] weights;

    private SkillVector(int[] indices, double[] weights) {
        this.indices = indices;
        this.weights = weights;
    }

    public static SkillVector empty() {
        return EMPTY;
    }

    /**
     * Build a vector from parallel arrays. Indices must be strictly ascending.
     */
    public static SkillVector of(int[] indices, double[] weights) {
        if (indices.length != weights.length) {
            throw new IllegalArgumentException("indices and weights differ in length");
        }
        for (int i = 1; i < indices.length; i++) {
            if (indices[i] <= indices[i - 1]) {
                throw new IllegalArgumentException("indices must be strictly ascending");
            }
        }
        return new SkillVector(indices.clone(), weights.clone());
    }

    public int size() {
        return indices.length;
    }

    public boolean isEmpty() {
        return indices.length == 0;
    }

    double weightAt(int index) {
        int pos = Arrays.binarySearch(indices, index);
        return pos >= 0 ? weights[pos] : 0.0;
    }

    public double norm() {
        double sum = 0.0;
        for (double w : weights) {
            sum += w * w;
        }
        return Math.sqrt(sum);
    }

    public double dot(SkillVector other) {
        double sum = 0.0;
        int i = 0;
        int j = 0;
        while (i < indices.length && j < other.indices.length) {
            if (indices[i] == other.indices[j]) {
                sum += weights[i] * other.weights[j];
                i++;
                j++;
            } else if (indices[i] < other.indices[j]) {
                i++;
            } else {
                j++;
            }
        }
        return sum;
    }

    /**
     * Cosine similarity; 0 when either vector has zero magnitude.
     */
    public double cosine(SkillVector other) {
        double normA = norm();
        double normB = other.norm();
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot(other) / (normA * normB);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SkillVector that)) {
            return false;
        }
        return Arrays.equals(indices, that.indices) && Arrays.equals(weights, that.weights);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(indices) + Arrays.hashCode(weights);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SkillVector{");
        for (int i = 0; i < indices.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(indices[i]).append('=').append(weights[i]);
        }
        return sb.append('}').toString();
    }
}
