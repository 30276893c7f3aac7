package org.ephemeral.hnsw.index.storage;

import lombok.Getter;
import org.ephemeral.hnsw.index.DimensionMismatchException;

/**
 * Abstract base class for slot-addressed vector storage.
 *
 * <p>Vectors are addressed by the arena slot of the node that owns them. Every stored vector has
 * exactly {@link #getDimensions()} components; the length check lives here so implementations only
 * deal with placement.
 *
 * @version 1.0
 * @since 1.0
 * @see OnHeapVectorStorage
 */
public abstract class VectorStorage {

    /** Number of dimensions in each vector */
    @Getter
    protected final int dimensions;

    protected VectorStorage(int dimensions) {
        if (dimensions < 1) {
            throw new IllegalArgumentException("Dimensions must be >= 1 : " + dimensions);
        }
        this.dimensions = dimensions;
    }

    /**
     * Stores a copy of {@code vector} at {@code slot}, replacing whatever the slot held.
     *
     * @throws DimensionMismatchException if the vector length differs from {@link #getDimensions()}
     */
    public void putVector(int slot, float[] vector) {
        checkSlot(slot);
        if (vector.length != dimensions) {
            throw new DimensionMismatchException(dimensions, vector.length);
        }
        putVectorImpl(slot, vector);
    }

    /**
     * Returns the vector at {@code slot}. The array is owned by the storage and must not be modified.
     *
     * @return the stored vector, or null if the slot is empty
     */
    public float[] getVector(int slot) {
        checkSlot(slot);
        return getVectorImpl(slot);
    }

    /**
     * Releases the vector held at {@code slot}, if any.
     */
    public void removeVector(int slot) {
        checkSlot(slot);
        removeVectorImpl(slot);
    }

    /**
     * Drops every stored vector.
     */
    public abstract void clear();

    protected abstract void putVectorImpl(int slot, float[] vector);

    protected abstract float[] getVectorImpl(int slot);

    protected abstract void removeVectorImpl(int slot);

    protected void checkSlot(int slot) {
        if (slot < 0) {
            throw new IndexOutOfBoundsException("Vector slot out of bounds: " + slot);
        }
    }
}
