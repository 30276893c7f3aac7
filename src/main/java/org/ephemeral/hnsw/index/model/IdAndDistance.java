package org.ephemeral.hnsw.index.model;

import java.util.Comparator;

/**
 * Record representing an arena slot and its distance from a query point.
 * Used internally for efficient priority queue operations during search.
 *
 * @param slot     the arena slot of the node
 * @param distance the cosine distance from the query
 */
public record IdAndDistance(int slot, double distance) {

    /** Ascending by distance, ties broken by slot so orderings are stable across runs. */
    public static final Comparator<IdAndDistance> NEAREST_FIRST =
            Comparator.comparingDouble(IdAndDistance::distance).thenComparingInt(IdAndDistance::slot);

    public static final Comparator<IdAndDistance> FARTHEST_FIRST = NEAREST_FIRST.reversed();
}
