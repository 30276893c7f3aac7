package org.ephemeral.hnsw.index;

import org.ephemeral.hnsw.index.distance.CosineDistanceCalculator;
import org.ephemeral.hnsw.index.distance.DistanceCalculator;
import org.ephemeral.hnsw.index.model.IdAndDistance;
import org.ephemeral.hnsw.index.model.IntegerList;

import java.util.Arrays;

/**
 * Picks the bounded-degree neighbor set of a node out of a candidate set.
 *
 * <p>Two strategies are supported, see {@link NeighborSelection}:
 * <ul>
 *   <li><b>CLOSEST:</b> candidates ranked by distance to the base vector, truncated to M.</li>
 *   <li><b>DIVERSE:</b> the HNSW paper heuristic. A candidate is rejected when it is closer to an
 *       already selected neighbor than to the base vector; rejected candidates back-fill the result
 *       if fewer than M were accepted.</li>
 * </ul>
 *
 * <p>Candidates are ranked with {@link IdAndDistance#NEAREST_FIRST}, ties fall back to the slot
 * number, so the selected membership only depends on the inputs.
 *
 * <p><b>Example</b> (M = 2, CLOSEST):
 * <pre>
 * candidates: [A 0.10, B 0.30, C 0.05]
 * selected:   [C, A]
 * </pre>
 */
class NeighborSelector {

    private final GraphState graph;

    private final NeighborSelection strategy;

    private final DistanceCalculator baseCalculator = new CosineDistanceCalculator();

    private final DistanceCalculator candidateCalculator = new CosineDistanceCalculator();

    NeighborSelector(GraphState graph, NeighborSelection strategy) {
        this.graph = graph;
        this.strategy = strategy;
    }

    /**
     * Ranks candidate slots by their distance to {@code baseVector} and selects at most
     * {@code maxNeighbors} of them. Used when pruning an overfull adjacency list.
     *
     * @param baseVector     vector of the node that owns the neighbor list
     * @param candidateSlots current neighbors of the node
     * @param maxNeighbors   maximum number of neighbors to keep
     * @return selected slots, closest first
     */
    IntegerList select(float[] baseVector, IntegerList candidateSlots, int maxNeighbors) {
        baseCalculator.update(baseVector);
        IdAndDistance[] scored = new IdAndDistance[candidateSlots.size()];
        for (int i = 0; i < candidateSlots.size(); i++) {
            int slot = candidateSlots.get(i);
            scored[i] = new IdAndDistance(slot, baseCalculator.calculate(graph.vector(slot)));
        }
        return selectScored(scored, maxNeighbors);
    }

    /**
     * Selects at most {@code maxNeighbors} from candidates whose distance to the base vector is already
     * known, for example the output of a {@link LayerSearcher} run.
     *
     * @param candidates   scored candidates in any order, the array is not modified
     * @param maxNeighbors maximum number of neighbors to keep
     * @return selected slots, closest first for CLOSEST and in acceptance order for DIVERSE
     */
    IntegerList selectScored(IdAndDistance[] candidates, int maxNeighbors) {
        IdAndDistance[] ranked = candidates.clone();
        Arrays.sort(ranked, IdAndDistance.NEAREST_FIRST);
        return switch (strategy) {
            case CLOSEST -> selectClosest(ranked, maxNeighbors);
            case DIVERSE -> selectNeighborsHeuristic(ranked, maxNeighbors);
        };
    }

    private IntegerList selectClosest(IdAndDistance[] ranked, int maxNeighbors) {
        int size = Math.min(ranked.length, maxNeighbors);
        IntegerList selected = new IntegerList(maxNeighbors + 1);
        for (int i = 0; i < size; i++) {
            selected.add(ranked[i].slot());
        }
        return selected;
    }

    private IntegerList selectNeighborsHeuristic(IdAndDistance[] ranked, int maxNeighbors) {
        final IntegerList finalSelected = new IntegerList(maxNeighbors + 1);
        final IntegerList discardedList = new IntegerList();
        int counter = 0;
        while (counter < ranked.length && finalSelected.size() < maxNeighbors) {
            final IdAndDistance candidate = ranked[counter];
            counter++;
            boolean isDiverse = true;
            candidateCalculator.update(graph.vector(candidate.slot()));
            for (int i = 0; i < finalSelected.size(); i++) {
                // closer to a kept neighbor than to the base node means the kept neighbor already covers it
                if (candidateCalculator.calculate(graph.vector(finalSelected.get(i))) < candidate.distance()) {
                    isDiverse = false;
                    break;
                }
            }
            if (isDiverse) {
                finalSelected.add(candidate.slot());
            } else {
                discardedList.add(candidate.slot());
            }
        }

        counter = 0;
        while (finalSelected.size() < maxNeighbors && counter < discardedList.size()) {
            finalSelected.add(discardedList.get(counter));
            counter++;
        }
        return finalSelected;
    }
}
