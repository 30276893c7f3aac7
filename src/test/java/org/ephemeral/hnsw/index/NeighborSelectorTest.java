package org.ephemeral.hnsw.index;

import org.ephemeral.hnsw.index.model.IdAndDistance;
import org.ephemeral.hnsw.index.model.IntegerList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.ephemeral.hnsw.index.LayerSearcherTest.unit;
import static org.junit.jupiter.api.Assertions.*;

class NeighborSelectorTest {

    private GraphState graph;

    private IntegerList candidates;

    /**
     * Base direction is 0 degrees. Candidates at 10 and 12 degrees form a tight pair, the one at -60
     * degrees sits on the other side of the base, the one at 100 degrees is far away.
     */
    @BeforeEach
    void setUp() {
        graph = new GraphState(2, 4);
        candidates = new IntegerList();
        candidates.add(graph.allocate("far", 0, unit(100)).getSlot());
        candidates.add(graph.allocate("twelve", 0, unit(12)).getSlot());
        candidates.add(graph.allocate("minusSixty", 0, unit(-60)).getSlot());
        candidates.add(graph.allocate("ten", 0, unit(10)).getSlot());
    }

    @Test
    void testClosestKeepsNearestInOrder() {
        NeighborSelector selector = new NeighborSelector(graph, NeighborSelection.CLOSEST);

        IntegerList selected = selector.select(unit(0), candidates, 2);

        assertArrayEquals(new int[]{slot("ten"), slot("twelve")}, selected.toArray());
    }

    @Test
    void testClosestWithFewerCandidatesThanLimit() {
        NeighborSelector selector = new NeighborSelector(graph, NeighborSelection.CLOSEST);

        IntegerList selected = selector.select(unit(0), candidates, 10);

        assertArrayEquals(new int[]{slot("ten"), slot("twelve"), slot("minusSixty"), slot("far")},
                selected.toArray());
    }

    @Test
    void testDiverseSkipsCandidateCoveredBySelectedNeighbor() {
        NeighborSelector selector = new NeighborSelector(graph, NeighborSelection.DIVERSE);

        IntegerList selected = selector.select(unit(0), candidates, 2);

        assertArrayEquals(new int[]{slot("ten"), slot("minusSixty")}, selected.toArray());
    }

    @Test
    void testDiverseBackFillsWithDiscarded() {
        NeighborSelector selector = new NeighborSelector(graph, NeighborSelection.DIVERSE);

        IntegerList selected = selector.select(unit(0), candidates, 3);

        assertEquals(3, selected.size());
        assertTrue(selected.contains(slot("ten")));
        assertTrue(selected.contains(slot("minusSixty")));
        assertTrue(selected.contains(slot("twelve")));
    }

    @Test
    void testSelectScoredIsDeterministicOnTies() {
        NeighborSelector selector = new NeighborSelector(graph, NeighborSelection.CLOSEST);
        IdAndDistance[] scored = {
                new IdAndDistance(3, 0.5),
                new IdAndDistance(1, 0.5),
                new IdAndDistance(2, 0.1),
        };

        IntegerList selected = selector.selectScored(scored, 2);

        assertArrayEquals(new int[]{2, 1}, selected.toArray());
        // input left untouched
        assertEquals(3, scored[0].slot());
    }

    private int slot(String id) {
        return graph.slotOf(id);
    }
}
