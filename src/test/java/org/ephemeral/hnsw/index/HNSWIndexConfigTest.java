package org.ephemeral.hnsw.index;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HNSWIndexConfigTest {

    @Test
    void testDefaults() {
        HNSWIndexConfig config = HNSWIndexConfig.defaults();

        assertEquals(16, config.getM());
        assertEquals(200, config.getEfConstruction());
        assertEquals(50, config.getEfSearch());
        assertEquals(16, config.getMaxLevel());
        assertEquals(NeighborSelection.CLOSEST, config.getNeighborSelection());
        assertNull(config.getSeed());
        assertEquals(1.0 / Math.log(16), config.getEffectiveLevelMultiplier(), 1e-12);
    }

    @Test
    void testExplicitLevelMultiplierWins() {
        HNSWIndexConfig config = HNSWIndexConfig.builder().m(8).levelMultiplier(0.25).build();

        assertEquals(0.25, config.getEffectiveLevelMultiplier(), 1e-12);
        assertEquals(1.0 / Math.log(8), config.toBuilder().levelMultiplier(null).build()
                .getEffectiveLevelMultiplier(), 1e-12);
    }

    @Test
    void testValidateRejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> HNSWIndexConfig.builder().m(1).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> HNSWIndexConfig.builder().efConstruction(0).build().validate());
        assertThrows(IllegalArgumentException.class, () -> HNSWIndexConfig.builder().efSearch(0).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> HNSWIndexConfig.builder().levelMultiplier(-1.0).build().validate());
        assertThrows(IllegalArgumentException.class, () -> HNSWIndexConfig.builder().maxLevel(-1).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> HNSWIndexConfig.builder().neighborSelection(null).build().validate());
    }

    @Test
    void testIndexRejectsInvalidConfig() {
        HNSWIndexConfig invalid = HNSWIndexConfig.builder().m(0).build();

        assertThrows(IllegalArgumentException.class, () -> new HNSWIndex(invalid));
    }
}
