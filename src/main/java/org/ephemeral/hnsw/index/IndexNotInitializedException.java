package org.ephemeral.hnsw.index;

/**
 * Thrown when {@code add}, {@code remove}, {@code search} or a lookup is called on an
 * {@link HNSWIndex} before {@link HNSWIndex#init(int)}.
 */
public class IndexNotInitializedException extends IllegalStateException {

    public IndexNotInitializedException(String operation) {
        super("HNSW index is not initialized, call init(dimension) before " + operation);
    }
}
