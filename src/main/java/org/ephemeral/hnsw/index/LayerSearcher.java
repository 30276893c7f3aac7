package org.ephemeral.hnsw.index;

import org.ephemeral.hnsw.index.distance.DistanceCalculator;
import org.ephemeral.hnsw.index.model.IdAndDistance;
import org.ephemeral.hnsw.index.model.IntegerList;

import java.util.BitSet;
import java.util.PriorityQueue;

/**
 * Greedy best-first traversal of a single layer of the graph.
 *
 * <p>Implements Algorithm 2 from the HNSW paper (SEARCH-LAYER) with two priority queues:
 * <ul>
 *   <li>Candidates queue: nodes to expand (min-heap by distance)</li>
 *   <li>Result queue: best nodes found (max-heap by distance, bounded to ef)</li>
 * </ul>
 *
 * <p>The queues and the visited set are allocated per call and the graph is only read, so searches may
 * run concurrently as long as no insert or removal runs at the same time.
 */
class LayerSearcher {

    private final GraphState graph;

    LayerSearcher(GraphState graph) {
        this.graph = graph;
    }

    /**
     * Collects up to {@code ef} nodes reachable from {@code entry} on {@code layer}.
     *
     * <p>The search stops once the closest unexpanded candidate is farther than the worst kept result
     * while the result set already holds {@code ef} entries. A neighbor is admitted when the result set
     * has room or when it beats the current worst result, which is then evicted.
     *
     * @param calculator distance calculator whose reference is the query
     * @param entry      slot of the node to start from, must exist at {@code layer}
     * @param ef         the maximum number of results to keep
     * @param layer      the layer number to search in
     * @return nodes sorted by distance, closest first, never empty
     */
    IdAndDistance[] search(DistanceCalculator calculator, int entry, int ef, int layer) {
        final PriorityQueue<IdAndDistance> candidatesQueue = new PriorityQueue<>(IdAndDistance.NEAREST_FIRST);
        final PriorityQueue<IdAndDistance> resultQueue = new PriorityQueue<>(IdAndDistance.FARTHEST_FIRST);
        final BitSet visited = new BitSet(graph.slotCapacity());

        final IdAndDistance start = new IdAndDistance(entry, calculator.calculate(graph.vector(entry)));
        candidatesQueue.add(start);
        resultQueue.add(start);
        visited.set(entry);

        while (!candidatesQueue.isEmpty()) {
            IdAndDistance candidate = candidatesQueue.poll();
            IdAndDistance farthestElementInResult = resultQueue.element();
            if (candidate.distance() > farthestElementInResult.distance() && resultQueue.size() >= ef) {
                // nothing left can improve the result set
                break;
            }

            final IntegerList neighborsList = graph.node(candidate.slot()).getNeighbors(layer);
            int neighborId;
            for (int i = 0; i < neighborsList.size(); i++) {
                neighborId = neighborsList.get(i);
                if (visited.get(neighborId)) {
                    continue;
                }
                visited.set(neighborId);
                final IdAndDistance neighbor =
                        new IdAndDistance(neighborId, calculator.calculate(graph.vector(neighborId)));

                farthestElementInResult = resultQueue.element();
                if (resultQueue.size() < ef || neighbor.distance() < farthestElementInResult.distance()) {
                    candidatesQueue.add(neighbor);
                    resultQueue.add(neighbor);
                    if (resultQueue.size() > ef) {
                        resultQueue.poll();
                    }
                }
            }
        }

        // drain the max-heap from the back so the closest result ends up first
        IdAndDistance[] resultArray = new IdAndDistance[resultQueue.size()];
        int i = resultQueue.size() - 1;
        while (!resultQueue.isEmpty()) {
            resultArray[i] = resultQueue.poll();
            i--;
        }
        return resultArray;
    }

    /**
     * Width-1 greedy step used to descend through the upper layers.
     *
     * @return slot of the closest node found on {@code layer}
     */
    int searchClosest(DistanceCalculator calculator, int entry, int layer) {
        return search(calculator, entry, 1, layer)[0].slot();
    }
}
