package org.ephemeral.hnsw.index.model;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * Represents a node in the HNSW (Hierarchical Navigable Small World) graph structure.
 *
 * <p>Each node exists at multiple layers of the graph hierarchy, from layer 0 (base layer)
 * up to its assigned level. The node maintains separate neighbor lists for each layer it
 * participates in, enabling the hierarchical search algorithm.
 *
 * <p>Nodes live in a dense arena and are addressed by their {@code slot}. Neighbor lists hold
 * slots, never references to other nodes, so the graph has no cyclic ownership. The caller-facing
 * {@code id} is only used to map back to the caller's key.
 *
 * @version 1.0
 * @since 1.0
 */
@Getter
public class HNSWNode {
    /** Caller supplied key of this node */
    private final String id;

    /** Position of this node in the arena */
    private final int slot;

    /** Highest level this node exists in (0-based indexing) */
    private final int level;

    /** Layer number to list of neighbor slots for that layer */
    @Getter(AccessLevel.NONE)
    private final IntegerList[] neighborsByLayer;

    /**
     * Constructs a new HNSW node with the specified id, slot and level.
     *
     * <p>Initializes empty neighbor lists for all layers from 0 to the specified level.
     *
     * @param id           caller supplied key
     * @param slot         arena position
     * @param level        highest level this node will exist in (must be >= 0)
     * @param maxNeighbors expected degree, used to size the neighbor lists
     */
    public HNSWNode(String id, int slot, int level, int maxNeighbors) {
        if (level < 0) {
            throw new IllegalArgumentException("Node level must be >= 0 : " + level);
        }
        this.id = id;
        this.slot = slot;
        this.level = level;
        this.neighborsByLayer = new IntegerList[level + 1];
        // one extra so the overflow entry added before pruning does not force a grow
        for (int l = 0; l <= level; l++) {
            neighborsByLayer[l] = new IntegerList(maxNeighbors + 1);
        }
    }

    /**
     * Returns the list of neighbor slots for the specified layer.
     *
     * <p>The returned list is the live adjacency list, mutations are visible to the node.
     *
     * @param layer the layer number to get neighbors for
     * @return list of neighbor slots for the specified layer, never null
     * @throws IllegalArgumentException if the node does not exist at the layer
     */
    public IntegerList getNeighbors(int layer) {
        layerBoundsCheck(layer);
        return neighborsByLayer[layer];
    }

    /**
     * Adds a neighbor connection to this node at the specified layer.
     *
     * <p>This method only adds the connection in one direction (from this node
     * to the neighbor). For bidirectional connections, the neighbor node must
     * also add this node as its neighbor. Self-loops and duplicates are ignored.
     *
     * @param layer    the layer number to add the connection at
     * @param neighbor the slot of the neighbor node to connect to
     * @return true if the edge was new
     */
    public boolean addNeighbor(int layer, int neighbor) {
        layerBoundsCheck(layer);
        if (neighbor == slot) {
            return false;
        }
        return neighborsByLayer[layer].addIfAbsent(neighbor);
    }

    /**
     * Removes the one-directional edge to {@code neighbor} at the layer, if present.
     */
    public boolean removeNeighbor(int layer, int neighbor) {
        layerBoundsCheck(layer);
        return neighborsByLayer[layer].removeValue(neighbor);
    }

    public void updateNeighborhood(int layer, final IntegerList neighborhood) {
        layerBoundsCheck(layer);
        neighborsByLayer[layer] = neighborhood;
    }

    public boolean hasLayer(int layer) {
        return layer >= 0 && layer <= level;
    }

    private void layerBoundsCheck(int layer) {
        if (!hasLayer(layer)) {
            throw new IllegalArgumentException("Invalid layer number : " + layer + " Max value : " + level);
        }
    }

    @Override
    public String toString() {
        return "HNSWNode{id=" + id + ", slot=" + slot + ", level=" + level + "}";
    }
}
