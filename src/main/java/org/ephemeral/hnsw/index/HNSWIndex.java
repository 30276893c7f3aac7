package org.ephemeral.hnsw.index;

import org.ephemeral.hnsw.index.distance.CosineDistanceCalculator;
import org.ephemeral.hnsw.index.distance.DistanceCalculator;
import org.ephemeral.hnsw.index.model.HNSWNode;
import org.ephemeral.hnsw.index.model.HNSWStats;
import org.ephemeral.hnsw.index.model.IdAndDistance;
import org.ephemeral.hnsw.index.model.IntegerList;
import org.ephemeral.hnsw.index.model.SearchMatch;
import org.ephemeral.hnsw.utils.HNSWLevelGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * In-process, ephemeral implementation of the Hierarchical Navigable Small World (HNSW) algorithm
 * for approximate nearest neighbor search over cosine distance.
 *
 * <p>This implementation is based on the paper "Efficient and robust approximate nearest
 * neighbor search using Hierarchical Navigable Small World graphs" by Malkov and Yashunin
 * (arXiv:1603.09320). The algorithm creates a multi-layer graph structure where higher
 * layers contain fewer nodes, enabling efficient logarithmic search complexity.
 *
 * <p>Key features:
 * <ul>
 *   <li>Vectors keyed by caller supplied string ids, with in-place vector replacement on re-add</li>
 *   <li>Multi-layer graph with probabilistic level assignment</li>
 *   <li>Greedy search on upper layers, beam search on layer 0</li>
 *   <li>Degree bounded to M on every layer, overfull neighbors are pruned on insert</li>
 *   <li>Removal strips the node from every adjacency list and re-elects the entry point</li>
 * </ul>
 *
 * <h3>Lifecycle:</h3>
 * <pre>
 * UNINITIALIZED --init(dimension)--> EMPTY --add--> POPULATED --remove all / clear--> EMPTY
 * </pre>
 * {@code add}, {@code remove} and {@code search} fail with {@link IndexNotInitializedException} before
 * {@link #init(int)}. Vectors of the wrong length fail with {@link DimensionMismatchException} before
 * anything is modified.
 *
 * <h3>Limitations:</h3>
 * <ul>
 *   <li>Re-adding an existing id only overwrites its vector. Its level and edges are kept, so after a
 *       large change its neighborhood no longer reflects the new position. Remove then add to
 *       rebuild it.</li>
 *   <li>Removal adds no compensating edges, heavy deletion can leave parts of the graph unreachable.</li>
 * </ul>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * HNSWIndex index = new HNSWIndex();
 * index.init(3);
 *
 * index.add("a", new float[]{1.0f, 2.0f, 3.0f});
 * index.add("b", new float[]{4.0f, 5.0f, 6.0f});
 *
 * List<SearchMatch> results = index.search(new float[]{1.1f, 2.1f, 3.1f}, 5);
 * }</pre>
 *
 * <p><b>Thread Safety:</b> not synchronized. {@code search}, {@code contains}, {@code getVector} and
 * {@code size} only read the graph and may run concurrently with each other, for example under the read
 * side of a {@link java.util.concurrent.locks.ReadWriteLock}. {@code add}, {@code remove}, {@code clear}
 * and {@code init} need exclusive access.
 *
 * @version 1.0
 * @see <a href="https://arxiv.org/abs/1603.09320">HNSW Paper</a>
 * @since 1.0
 */
public class HNSWIndex {

    private static final Logger log = LoggerFactory.getLogger(HNSWIndex.class);

    public static final double DEFAULT_THRESHOLD = 0.5;

    private final HNSWIndexConfig config;

    /**
     * Maximum number of connections per node per layer (M parameter from paper)
     */
    private final int M;

    /**
     * Random level assignment
     */
    private final HNSWLevelGenerator levelGenerator;

    /**
     * Calculator for the vector being inserted, reused across inserts
     */
    private final DistanceCalculator insertCalculator = new CosineDistanceCalculator();

    /**
     * Null until {@link #init(int)}
     */
    private GraphState graph;

    private LayerSearcher layerSearcher;

    private NeighborSelector neighborSelector;

    /**
     * Constructs a new HNSW index with default parameters, see {@link HNSWIndexConfig#defaults()}.
     */
    public HNSWIndex() {
        this(HNSWIndexConfig.defaults());
    }

    public HNSWIndex(HNSWIndexConfig config) {
        this.config = Objects.requireNonNull(config, "config").validate();
        this.M = config.getM();
        Random random = config.getSeed() != null ? new Random(config.getSeed()) : new Random();
        this.levelGenerator = new HNSWLevelGenerator(config.getEffectiveLevelMultiplier(), config.getMaxLevel(),
                random);
    }

    /**
     * Sets the vector dimension and makes the index usable.
     *
     * <p>Calling it again with the same dimension keeps the data. A different dimension drops every
     * node, since stored vectors can no longer be compared with new ones.
     *
     * @param dimension number of components of every vector, must be >= 1
     * @throws IllegalArgumentException if dimension < 1
     */
    public void init(int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("Dimension must be >= 1 : " + dimension);
        }
        if (graph != null && graph.getDimension() == dimension) {
            return;
        }
        if (graph != null) {
            log.debug("Re-initializing HNSW index from dimension {} to {}, dropping {} nodes",
                    graph.getDimension(), dimension, graph.size());
        } else {
            log.debug("Initializing HNSW index with dimension {}, M={}, efConstruction={}, efSearch={}",
                    dimension, M, config.getEfConstruction(), config.getEfSearch());
        }
        resetGraph(dimension);
    }

    public boolean isInitialized() {
        return graph != null;
    }

    /**
     * @return the configured dimension, or 0 before {@link #init(int)}
     */
    public int getDimension() {
        return graph == null ? 0 : graph.getDimension();
    }

    /**
     * Adds a vector under {@code id}, or replaces the vector of an existing id in place.
     *
     * <p>For a new id this implements Algorithm 1 from the HNSW paper:
     * <ol>
     *   <li>Assigns a random level to the new node</li>
     *   <li>If the graph is empty, the node becomes the entry point</li>
     *   <li>Descends greedily (ef = 1) from the entry point down to the level above the node's level</li>
     *   <li>On every layer the node lives on, collects efConstruction candidates, links to the selected
     *       neighbors in both directions and prunes any neighbor that went above M</li>
     *   <li>Promotes the node to entry point if its level is above the current maximum</li>
     * </ol>
     *
     * @param id     caller key, must not be null
     * @param vector the vector data (copied)
     * @throws DimensionMismatchException   if the vector length differs from the dimension
     * @throws IndexNotInitializedException before {@link #init(int)}
     */
    public void add(String id, float[] vector) {
        checkInitialized("add");
        Objects.requireNonNull(id, "id");
        checkDimension(vector);

        int existing = graph.slotOf(id);
        if (existing >= 0) {
            graph.replaceVector(existing, vector);
            return;
        }

        int level = levelGenerator.getRandomLevel();
        final HNSWNode newNode = graph.allocate(id, level, vector);
        final float[] stored = graph.vector(newNode.getSlot());
        log.trace("Adding node {} at slot {} with level {}", id, newNode.getSlot(), level);

        int entryPoint = graph.getEntryPoint();
        if (entryPoint == -1) {
            graph.setEntryPoint(newNode.getSlot(), level);
            return;
        }

        int maxLevel = graph.getMaxLevel();
        insertCalculator.update(stored);
        int current = entryPoint;

        // Traverse from top layer to newNode's level
        for (int l = maxLevel; l > level; l--) {
            current = layerSearcher.searchClosest(insertCalculator, current, l);
        }

        for (int l = Math.min(level, maxLevel); l >= 0; l--) {
            final IdAndDistance[] candidates =
                    layerSearcher.search(insertCalculator, current, config.getEfConstruction(), l);
            final IntegerList selected = neighborSelector.selectScored(candidates, M);
            for (int i = 0; i < selected.size(); i++) {
                int neighbor = selected.get(i);
                newNode.addNeighbor(l, neighbor);
                HNSWNode neighborNode = graph.node(neighbor);
                neighborNode.addNeighbor(l, newNode.getSlot());
                if (neighborNode.getNeighbors(l).size() > M) {
                    shrinkNeighbors(neighborNode, l);
                }
            }
            // closest candidate seeds the next layer down
            current = candidates[0].slot();
        }

        if (level > maxLevel) {
            graph.setEntryPoint(newNode.getSlot(), level);
            log.debug("Node {} promoted to entry point, max level {} -> {}", id, maxLevel, level);
        }
    }

    /**
     * Removes the node with {@code id}. No-op if absent.
     *
     * <p>The node is stripped from the adjacency list of each of its neighbors on every layer it lived
     * on. No replacement edges are created. If it was the entry point, the remaining node with the
     * highest level takes over.
     *
     * @throws IndexNotInitializedException before {@link #init(int)}
     */
    public void remove(String id) {
        checkInitialized("remove");
        if (id == null) {
            return;
        }
        int slot = graph.slotOf(id);
        if (slot < 0) {
            return;
        }
        HNSWNode node = graph.node(slot);
        for (int l = 0; l <= node.getLevel(); l++) {
            IntegerList neighbors = node.getNeighbors(l);
            for (int i = 0; i < neighbors.size(); i++) {
                graph.node(neighbors.get(i)).removeNeighbor(l, slot);
            }
        }
        graph.release(slot);

        if (graph.getEntryPoint() == slot) {
            int elected = graph.electEntryPoint();
            if (elected == -1) {
                log.debug("Removed last node {}, index is empty", id);
            } else {
                log.debug("Entry point {} removed, promoted {} at level {}", id, graph.node(elected).getId(),
                        graph.getMaxLevel());
            }
        }
    }

    /**
     * Searches with the default threshold of {@value #DEFAULT_THRESHOLD}.
     *
     * @see #search(float[], int, double, int)
     */
    public List<SearchMatch> search(float[] query, int k) {
        return search(query, k, DEFAULT_THRESHOLD);
    }

    /**
     * Searches with the configured efSearch.
     *
     * @see #search(float[], int, double, int)
     */
    public List<SearchMatch> search(float[] query, int k, double threshold) {
        return search(query, k, threshold, config.getEfSearch());
    }

    /**
     * Searches for the k nearest neighbors of a query vector.
     *
     * <ol>
     *   <li>Starts from the entry point at the highest layer</li>
     *   <li>Performs greedy search through upper layers (ef=1)</li>
     *   <li>Conducts beam search on layer 0 with width max(k, efSearch)</li>
     *   <li>Keeps matches whose similarity is at least {@code threshold}, at most k of them</li>
     * </ol>
     *
     * @param query     the query vector
     * @param k         maximum number of matches, must be >= 1
     * @param threshold minimum similarity ({@code 1 - distance}) of a match
     * @param efSearch  layer 0 search width, raised to k when smaller
     * @return matches ordered by descending similarity, empty if the index is empty
     * @throws DimensionMismatchException   if the query length differs from the dimension
     * @throws IndexNotInitializedException before {@link #init(int)}
     * @throws IllegalArgumentException     if k < 1 or efSearch < 1
     */
    public List<SearchMatch> search(float[] query, int k, double threshold, int efSearch) {
        checkInitialized("search");
        checkDimension(query);
        if (k < 1) {
            throw new IllegalArgumentException("k must be >= 1 : " + k);
        }
        if (efSearch < 1) {
            throw new IllegalArgumentException("efSearch must be >= 1 : " + efSearch);
        }
        if (graph.isEmpty()) {
            return Collections.emptyList();
        }

        final DistanceCalculator queryCalculator = new CosineDistanceCalculator(query);
        int current = graph.getEntryPoint();
        // Search all the top layers to find the entry point for the bottom layer.
        for (int l = graph.getMaxLevel(); l >= 1; l--) {
            current = layerSearcher.searchClosest(queryCalculator, current, l);
        }
        final IdAndDistance[] results = layerSearcher.search(queryCalculator, current, Math.max(k, efSearch), 0);

        List<SearchMatch> matches = new ArrayList<>(Math.min(k, results.length));
        for (IdAndDistance result : results) {
            if (matches.size() == k) {
                break;
            }
            SearchMatch match = SearchMatch.of(graph.node(result.slot()).getId(), result.distance());
            if (match.similarity() >= threshold) {
                matches.add(match);
            }
        }
        return matches;
    }

    /**
     * Drops every node and returns to the EMPTY state. The dimension is kept. No-op before init.
     */
    public void clear() {
        if (graph == null) {
            return;
        }
        int dropped = graph.size();
        graph.clear();
        log.debug("Cleared HNSW index, dropped {} nodes", dropped);
    }

    /**
     * @return number of live nodes, 0 before {@link #init(int)}
     */
    public int size() {
        return graph == null ? 0 : graph.size();
    }

    /**
     * @throws IndexNotInitializedException before {@link #init(int)}
     */
    public boolean contains(String id) {
        checkInitialized("contains");
        return id != null && graph.slotOf(id) >= 0;
    }

    /**
     * @return a copy of the stored vector, or null if the id is absent
     * @throws IndexNotInitializedException before {@link #init(int)}
     */
    public float[] getVector(String id) {
        checkInitialized("getVector");
        int slot = id == null ? -1 : graph.slotOf(id);
        return slot < 0 ? null : graph.vector(slot).clone();
    }

    public HNSWStats getHNSWIndexStats() {
        HNSWStats.HNSWStatsBuilder builder = HNSWStats.builder()
                .M(M)
                .efConstruction(config.getEfConstruction())
                .efSearch(config.getEfSearch())
                .neighborSelection(config.getNeighborSelection());
        if (graph == null) {
            return builder.nodesPerLevel(List.of()).build();
        }
        int entryPoint = graph.getEntryPoint();
        return builder
                .dimensions(graph.getDimension())
                .totalNumberOfNodes(graph.size())
                .maxLevel(graph.getMaxLevel())
                .entryPoint(entryPoint == -1 ? null : graph.node(entryPoint).getId())
                .nodesPerLevel(graph.isEmpty() ? List.of()
                        : IntStream.of(graph.nodesPerLevel()).boxed().collect(Collectors.toList()))
                .averageBaseLayerDegree(graph.averageDegree(0))
                .freeSlots(graph.freeSlotCount())
                .build();
    }

    /**
     * Exposes the graph to tests in this package.
     */
    GraphState graph() {
        return graph;
    }

    private void resetGraph(int dimension) {
        graph = new GraphState(dimension, M);
        layerSearcher = new LayerSearcher(graph);
        neighborSelector = new NeighborSelector(graph, config.getNeighborSelection());
    }

    /**
     * Prunes an adjacency list that went above M back to M entries. Every dropped neighbor also loses
     * its edge back, so edges stay symmetric once the insert completes.
     */
    private void shrinkNeighbors(HNSWNode node, int layer) {
        IntegerList current = node.getNeighbors(layer);
        IntegerList kept = neighborSelector.select(graph.vector(node.getSlot()), current, M);
        for (int i = 0; i < current.size(); i++) {
            int neighbor = current.get(i);
            if (!kept.contains(neighbor)) {
                graph.node(neighbor).removeNeighbor(layer, node.getSlot());
            }
        }
        node.updateNeighborhood(layer, kept);
    }

    private void checkInitialized(String operation) {
        if (graph == null) {
            throw new IndexNotInitializedException(operation);
        }
    }

    private void checkDimension(float[] vector) {
        Objects.requireNonNull(vector, "vector");
        if (vector.length != graph.getDimension()) {
            throw new DimensionMismatchException(graph.getDimension(), vector.length);
        }
    }
}
