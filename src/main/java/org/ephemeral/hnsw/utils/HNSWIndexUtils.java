package org.ephemeral.hnsw.utils;

import org.ephemeral.hnsw.index.NeighborSelection;

import java.util.Locale;

/**
 * Utility class for HNSW index configuration defaults.
 *
 * <p>Provides centralized access to the JVM system properties that seed the defaults of
 * {@link org.ephemeral.hnsw.index.HNSWIndexConfig}. Values set explicitly on the config builder always win.
 *
 * <h3>Available Configurations:</h3>
 * <ul>
 *   <li>{@code hnsw.m} - maximum neighbors per node per layer (default 16)</li>
 *   <li>{@code hnsw.ef.construction} - candidate width while inserting (default 200)</li>
 *   <li>{@code hnsw.ef.search} - candidate width on layer 0 while querying (default 50)</li>
 *   <li>{@code hnsw.neighbor.selection} - {@code CLOSEST} or {@code DIVERSE} (default CLOSEST)</li>
 * </ul>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * // Set via JVM argument
 * java -Dhnsw.neighbor.selection=DIVERSE -Dhnsw.ef.search=100 MyApp
 * }</pre>
 *
 * @version 1.0
 * @since 1.0
 */
public final class HNSWIndexUtils {

    public static final String M_KEY = "hnsw.m";
    public static final String EF_CONSTRUCTION_KEY = "hnsw.ef.construction";
    public static final String EF_SEARCH_KEY = "hnsw.ef.search";
    public static final String NEIGHBOR_SELECTION_KEY = "hnsw.neighbor.selection";

    private static final int DEFAULT_M = 16;
    private static final int DEFAULT_EF_CONSTRUCTION = 200;
    private static final int DEFAULT_EF_SEARCH = 50;
    private static final String DEFAULT_NEIGHBOR_SELECTION = "CLOSEST";

    private HNSWIndexUtils() {
    }

    public static int defaultM() {
        return readInt(M_KEY, DEFAULT_M);
    }

    public static int defaultEfConstruction() {
        return readInt(EF_CONSTRUCTION_KEY, DEFAULT_EF_CONSTRUCTION);
    }

    public static int defaultEfSearch() {
        return readInt(EF_SEARCH_KEY, DEFAULT_EF_SEARCH);
    }

    /**
     * Determines which neighbor selection strategy new indexes use.
     *
     * <p><b>CLOSEST:</b> keeps the M nearest candidates. Cheap and the default.
     * <p><b>DIVERSE:</b> the HNSW paper heuristic, a candidate is kept only if it is closer to the base
     * node than to every neighbor already kept. Spreads edges across clusters on skewed data.
     *
     * @return the configured strategy
     * @throws IllegalArgumentException if the property holds an unknown value
     */
    public static NeighborSelection defaultNeighborSelection() {
        String value = System.getProperty(NEIGHBOR_SELECTION_KEY, DEFAULT_NEIGHBOR_SELECTION);
        return NeighborSelection.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    private static int readInt(String key, int defaultValue) {
        String value = System.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("System property " + key + " must be an integer : " + value, e);
        }
    }
}
