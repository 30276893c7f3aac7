package org.ephemeral.hnsw.utils;

import org.ephemeral.hnsw.index.DimensionMismatchException;

/**
 * Utility class providing the scalar vector operations used by the index.
 *
 * <p>All arithmetic is accumulated in {@code double} so that the cosine of a vector with itself
 * stays within 1e-6 of 1.0 even for a few hundred dimensions.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * float[] vector1 = {1.0f, 0.0f};
 * float[] vector2 = {0.0f, 1.0f};
 *
 * double distance = VectorUtils.cosineDistance(vector1, vector2);   // 1.0
 * double dotProduct = VectorUtils.innerProduct(vector1, vector2);   // 0.0
 * }</pre>
 *
 * @version 1.0
 * @since 1.0
 */
public final class VectorUtils {

    private VectorUtils() {
    }

    /**
     * Computes the inner product (dot product) of two float arrays.
     *
     * <p>The inner product is calculated as the sum of element-wise products:
     * result = Σ(a[i] * b[i])
     *
     * @param a the first vector
     * @param b the second vector
     * @return the inner product of the two vectors
     * @throws DimensionMismatchException if arrays have different lengths
     */
    public static double innerProduct(float[] a, float[] b) {
        checkSameLength(a, b);
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    /**
     * Computes the L2 norm (magnitude) of a vector.
     *
     * @param a the vector
     * @return sqrt(Σ a[i]²)
     */
    public static double norm(float[] a) {
        double sum = 0;
        for (float value : a) {
            sum += (double) value * value;
        }
        return Math.sqrt(sum);
    }

    /**
     * Computes the cosine distance {@code 1 - cos(a, b)} between two vectors.
     *
     * <p>If either vector has zero magnitude the distance is {@code 1.0}, so the function is
     * defined for every pair of equal-length inputs.
     *
     * @param a the first vector
     * @param b the second vector
     * @return cosine distance in the range [0, 2]
     * @throws DimensionMismatchException if arrays have different lengths
     */
    public static double cosineDistance(float[] a, float[] b) {
        checkSameLength(a, b);
        return cosineDistance(innerProduct(a, b), norm(a), norm(b));
    }

    /**
     * Cosine distance from precomputed parts. A zero norm on either side yields {@code 1.0}.
     */
    public static double cosineDistance(double dot, double normA, double normB) {
        if (normA == 0 || normB == 0) {
            return 1.0;
        }
        return 1.0 - dot / (normA * normB);
    }

    private static void checkSameLength(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }
    }
}
