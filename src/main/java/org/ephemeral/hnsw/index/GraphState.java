package org.ephemeral.hnsw.index;

import org.ephemeral.hnsw.index.model.HNSWNode;
import org.ephemeral.hnsw.index.model.IntegerList;
import org.ephemeral.hnsw.index.storage.OnHeapVectorStorage;
import org.ephemeral.hnsw.index.storage.VectorStorage;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Owns the nodes, their vectors, the entry point and the current maximum level of an HNSW graph.
 *
 * <p>Nodes sit in a dense arena indexed by slot. Removing a node tombstones its slot (sets it to
 * null) and pushes it on a free list that later allocations pop from, so slots stay compact under
 * churn. Adjacency lists reference slots only; the id to slot map is the sole way back from a
 * caller key.
 *
 * <p>Invariants maintained across every public method:
 * <ul>
 *   <li>{@code entryPoint} is the slot of a live node, or -1 when the graph is empty</li>
 *   <li>{@code maxLevel} is the level of the entry point node, or 0 when the graph is empty</li>
 *   <li>every stored vector has {@code dimension} components</li>
 * </ul>
 *
 * <p>Not thread-safe.
 */
class GraphState {

    private static final int INITIAL_CAPACITY = 16;

    private final int dimension;

    private final int maxNeighbors;

    private final VectorStorage vectorStorage;

    private final Map<String, Integer> slotById;

    private final IntegerList freeSlots;

    private HNSWNode[] nodesBySlot;

    /** Next never-used slot, slots below it are either live or on the free list */
    private int nextSlot;

    private int entryPoint = -1;

    private int maxLevel;

    GraphState(int dimension, int maxNeighbors) {
        this.dimension = dimension;
        this.maxNeighbors = maxNeighbors;
        this.vectorStorage = new OnHeapVectorStorage(dimension, INITIAL_CAPACITY);
        this.slotById = new HashMap<>();
        this.freeSlots = new IntegerList();
        this.nodesBySlot = new HNSWNode[INITIAL_CAPACITY];
    }

    int getDimension() {
        return dimension;
    }

    int size() {
        return slotById.size();
    }

    boolean isEmpty() {
        return slotById.isEmpty();
    }

    int getEntryPoint() {
        return entryPoint;
    }

    int getMaxLevel() {
        return maxLevel;
    }

    /**
     * Upper bound (exclusive) of slots that may hold a node. Useful for sizing visited sets.
     */
    int slotCapacity() {
        return nextSlot;
    }

    int freeSlotCount() {
        return freeSlots.size();
    }

    /**
     * @return the slot of the node with the given id, or -1 if absent
     */
    int slotOf(String id) {
        Integer slot = slotById.get(id);
        return slot == null ? -1 : slot;
    }

    boolean isLive(int slot) {
        return slot >= 0 && slot < nextSlot && nodesBySlot[slot] != null;
    }

    HNSWNode node(int slot) {
        HNSWNode node = slot < nextSlot ? nodesBySlot[slot] : null;
        if (node == null) {
            throw new IllegalStateException("No live node at slot " + slot);
        }
        return node;
    }

    float[] vector(int slot) {
        return vectorStorage.getVector(slot);
    }

    /**
     * Places a new node in the arena. The node has no edges and does not change the entry point.
     */
    HNSWNode allocate(String id, int level, float[] vector) {
        if (vector.length != dimension) {
            throw new DimensionMismatchException(dimension, vector.length);
        }
        int slot = freeSlots.isEmpty() ? nextSlot++ : freeSlots.removeLast();
        if (slot >= nodesBySlot.length) {
            nodesBySlot = Arrays.copyOf(nodesBySlot, nodesBySlot.length * 2);
        }
        HNSWNode node = new HNSWNode(id, slot, level, maxNeighbors);
        vectorStorage.putVector(slot, vector);
        nodesBySlot[slot] = node;
        slotById.put(id, slot);
        return node;
    }

    void replaceVector(int slot, float[] vector) {
        vectorStorage.putVector(slot, vector);
    }

    /**
     * Tombstones the slot. The caller is responsible for stripping edges that point at it first.
     */
    HNSWNode release(int slot) {
        HNSWNode node = node(slot);
        nodesBySlot[slot] = null;
        vectorStorage.removeVector(slot);
        slotById.remove(node.getId());
        freeSlots.add(slot);
        return node;
    }

    /**
     * Drops every node and vector and returns to the empty state. The dimension is kept.
     */
    void clear() {
        vectorStorage.clear();
        slotById.clear();
        freeSlots.clear();
        Arrays.fill(nodesBySlot, 0, nextSlot, null);
        nextSlot = 0;
        setEntryPoint(-1, 0);
    }

    void setEntryPoint(int slot, int level) {
        this.entryPoint = slot;
        this.maxLevel = level;
    }

    /**
     * Picks the live node with the highest level as the entry point (lowest slot wins a tie),
     * or resets to the empty state when no node is left.
     *
     * @return the new entry point slot, or -1
     */
    int electEntryPoint() {
        int best = -1;
        int bestLevel = -1;
        for (int slot = 0; slot < nextSlot; slot++) {
            HNSWNode node = nodesBySlot[slot];
            if (node != null && node.getLevel() > bestLevel) {
                best = slot;
                bestLevel = node.getLevel();
            }
        }
        setEntryPoint(best, Math.max(bestLevel, 0));
        return best;
    }

    /**
     * @return count of live nodes per layer, index i is layer i
     */
    int[] nodesPerLevel() {
        int[] counts = new int[maxLevel + 1];
        for (int slot = 0; slot < nextSlot; slot++) {
            HNSWNode node = nodesBySlot[slot];
            if (node != null) {
                for (int l = 0; l <= node.getLevel() && l < counts.length; l++) {
                    counts[l]++;
                }
            }
        }
        return counts;
    }

    double averageDegree(int layer) {
        long edges = 0;
        int nodes = 0;
        for (int slot = 0; slot < nextSlot; slot++) {
            HNSWNode node = nodesBySlot[slot];
            if (node != null && node.hasLayer(layer)) {
                edges += node.getNeighbors(layer).size();
                nodes++;
            }
        }
        return nodes == 0 ? 0 : (double) edges / nodes;
    }
}
