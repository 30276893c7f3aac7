package org.ephemeral.hnsw.index.distance;

import org.ephemeral.hnsw.index.DimensionMismatchException;
import org.ephemeral.hnsw.utils.VectorUtils;

/**
 * Cosine distance ({@code 1 - cos}) from a reference vector, caching the reference norm.
 *
 * <p>When either side has zero magnitude the distance is {@code 1.0} instead of a division by zero.
 *
 * <p><b>Thread Safety:</b> This class is NOT thread-safe. The update() method modifies
 * the internal state. Use separate instances per thread or external synchronization.
 */
public class CosineDistanceCalculator implements DistanceCalculator {

    private float[] referenceVector;

    private double referenceNorm;

    public CosineDistanceCalculator() {
        this(new float[0]);
    }

    public CosineDistanceCalculator(float[] referenceVector) {
        update(referenceVector);
    }

    @Override
    public double calculate(float[] vector) {
        if (vector.length != referenceVector.length) {
            throw new DimensionMismatchException(referenceVector.length, vector.length);
        }
        double dot = 0;
        double norm = 0;
        for (int i = 0; i < vector.length; i++) {
            dot += (double) referenceVector[i] * vector[i];
            norm += (double) vector[i] * vector[i];
        }
        return VectorUtils.cosineDistance(dot, referenceNorm, Math.sqrt(norm));
    }

    @Override
    public void update(float[] referenceVector) {
        this.referenceVector = referenceVector;
        this.referenceNorm = VectorUtils.norm(referenceVector);
    }
}
