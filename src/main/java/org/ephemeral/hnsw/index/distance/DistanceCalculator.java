package org.ephemeral.hnsw.index.distance;

/**
 * Calculates distances from a fixed reference vector to other vectors.
 *
 * <p>Searches compare one query against many stored vectors, so implementations keep whatever
 * they can precompute about the reference (for cosine distance, its norm) and are reused across
 * queries through {@link #update(float[])}.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * DistanceCalculator calc = new CosineDistanceCalculator(referenceVector);
 *
 * double dist1 = calc.calculate(vector1);
 * double dist2 = calc.calculate(vector2);
 *
 * // Reuse calculator with different reference vector
 * calc.update(newReferenceVector);
 * double dist3 = calc.calculate(vector3);
 * }</pre>
 *
 * <p><b>Thread Safety:</b> implementations are NOT thread-safe, {@link #update(float[])} modifies state.
 *
 * @version 1.0
 * @see CosineDistanceCalculator
 * @since 1.0
 */
public interface DistanceCalculator {

    /**
     * Calculates the distance between the reference vector and {@code vector}.
     *
     * @param vector the vector to compare against
     * @return distance, smaller is closer
     * @throws org.ephemeral.hnsw.index.DimensionMismatchException if the lengths differ
     */
    double calculate(float[] vector);

    /**
     * Replaces the reference vector. The array is referenced, not copied, and must not be
     * modified while the calculator is in use.
     *
     * @param referenceVector the new reference vector
     */
    void update(float[] referenceVector);
}
