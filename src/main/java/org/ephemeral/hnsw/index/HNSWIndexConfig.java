package org.ephemeral.hnsw.index;

import lombok.Builder;
import lombok.Value;
import org.ephemeral.hnsw.utils.HNSWIndexUtils;

/**
 * Tuning parameters of an {@link HNSWIndex}.
 *
 * <p>Defaults come from {@link HNSWIndexUtils}, which honours JVM system properties; anything set on
 * the builder overrides them.
 *
 * <pre>{@code
 * HNSWIndexConfig config = HNSWIndexConfig.builder()
 *         .m(16)
 *         .efConstruction(200)
 *         .efSearch(64)
 *         .seed(42L)
 *         .build();
 * }</pre>
 */
@Value
@Builder(toBuilder = true)
public class HNSWIndexConfig {

    public static final int DEFAULT_MAX_LEVEL = 16;

    /** Maximum number of connections per node per layer (M parameter from paper) */
    @Builder.Default
    int m = HNSWIndexUtils.defaultM();

    /** Search width during construction (efConstruction parameter) */
    @Builder.Default
    int efConstruction = HNSWIndexUtils.defaultEfConstruction();

    /** Lower bound of the layer 0 search width at query time, the effective width is max(k, efSearch) */
    @Builder.Default
    int efSearch = HNSWIndexUtils.defaultEfSearch();

    /**
     * mL in the paper's convention: P(level >= l) = exp(-l / mL), so a larger value yields taller graphs.
     * When null 1/ln(m) is used, which promotes a node to each next layer with probability 1/m.
     */
    Double levelMultiplier;

    /** Highest level a node can be assigned */
    @Builder.Default
    int maxLevel = DEFAULT_MAX_LEVEL;

    @Builder.Default
    NeighborSelection neighborSelection = HNSWIndexUtils.defaultNeighborSelection();

    /** Seed of the level generator, when null levels are not reproducible */
    Long seed;

    public static HNSWIndexConfig defaults() {
        return builder().build();
    }

    public double getEffectiveLevelMultiplier() {
        return levelMultiplier != null ? levelMultiplier : 1.0 / Math.log(m);
    }

    /**
     * @throws IllegalArgumentException if any parameter is out of range
     */
    public HNSWIndexConfig validate() {
        if (m < 2) {
            throw new IllegalArgumentException("m must be >= 2 : " + m);
        }
        if (efConstruction < 1) {
            throw new IllegalArgumentException("efConstruction must be >= 1 : " + efConstruction);
        }
        if (efSearch < 1) {
            throw new IllegalArgumentException("efSearch must be >= 1 : " + efSearch);
        }
        if (levelMultiplier != null && !(levelMultiplier > 0)) {
            throw new IllegalArgumentException("levelMultiplier must be > 0 : " + levelMultiplier);
        }
        if (maxLevel < 0) {
            throw new IllegalArgumentException("maxLevel must be >= 0 : " + maxLevel);
        }
        if (neighborSelection == null) {
            throw new IllegalArgumentException("neighborSelection must not be null");
        }
        return this;
    }
}
