package org.ephemeral.hnsw.index.model;

/**
 * A single hit returned by {@link org.ephemeral.hnsw.index.HNSWIndex#search(float[], int, double)}.
 *
 * @param id         caller supplied key of the matched vector
 * @param distance   cosine distance to the query
 * @param similarity {@code 1 - distance}
 */
public record SearchMatch(String id, double distance, double similarity) {

    public static SearchMatch of(String id, double distance) {
        return new SearchMatch(id, distance, 1.0 - distance);
    }
}
