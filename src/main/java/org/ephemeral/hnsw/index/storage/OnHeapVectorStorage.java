package org.ephemeral.hnsw.index.storage;

import java.util.Arrays;

/**
 * On-heap storage implementation for vector data, one float array per slot.
 *
 * <p>Slots are dense arena positions, so a growable array of references gives O(1) lookup without
 * boxing. The backing array doubles when a slot beyond its capacity is written.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * OnHeapVectorStorage storage = new OnHeapVectorStorage(128, 1024);
 *
 * storage.putVector(0, new float[128]);
 * float[] stored = storage.getVector(0);
 * }</pre>
 *
 * @version 1.0
 * @since 1.0
 * @see VectorStorage
 */
public class OnHeapVectorStorage extends VectorStorage {

    private float[][] vectorsBySlot;

    /**
     * @param dimensions      the number of dimensions in each vector (must be > 0)
     * @param initialCapacity the expected number of vectors, used for the initial array size
     */
    public OnHeapVectorStorage(int dimensions, int initialCapacity) {
        super(dimensions);
        vectorsBySlot = new float[Math.max(initialCapacity, 1)][];
    }

    /**
     * Creates a copy of the input vector so later changes by the caller do not leak into the graph.
     */
    @Override
    protected void putVectorImpl(int slot, float[] vector) {
        if (slot >= vectorsBySlot.length) {
            vectorsBySlot = Arrays.copyOf(vectorsBySlot, Math.max(slot + 1, vectorsBySlot.length * 2));
        }
        float[] stored = vectorsBySlot[slot];
        if (stored == null) {
            vectorsBySlot[slot] = vector.clone();
        } else {
            // same dimension, reuse the buffer
            System.arraycopy(vector, 0, stored, 0, vector.length);
        }
    }

    @Override
    protected float[] getVectorImpl(int slot) {
        return slot < vectorsBySlot.length ? vectorsBySlot[slot] : null;
    }

    @Override
    protected void removeVectorImpl(int slot) {
        if (slot < vectorsBySlot.length) {
            vectorsBySlot[slot] = null;
        }
    }

    @Override
    public void clear() {
        Arrays.fill(vectorsBySlot, null);
    }
}
