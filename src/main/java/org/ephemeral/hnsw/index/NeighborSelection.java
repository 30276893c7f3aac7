package org.ephemeral.hnsw.index;

/**
 * Strategy used by {@link NeighborSelector} to choose at most M neighbors out of a candidate set.
 *
 * @see NeighborSelector
 */
public enum NeighborSelection {

    /** Keep the M candidates nearest to the base vector. */
    CLOSEST,

    /** Keep a candidate only if it is closer to the base vector than to every neighbor already kept,
     * then back-fill with the discarded candidates until M are kept. */
    DIVERSE
}
