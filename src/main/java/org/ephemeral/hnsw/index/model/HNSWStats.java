package org.ephemeral.hnsw.index.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import org.ephemeral.hnsw.index.NeighborSelection;

import java.util.List;

@Value
@Builder
@ToString
public class HNSWStats {
    int M;
    int efConstruction;
    int efSearch;
    NeighborSelection neighborSelection;
    int dimensions;
    int totalNumberOfNodes;
    int maxLevel;
    String entryPoint;
    /** index i holds the number of live nodes present on layer i */
    List<Integer> nodesPerLevel;
    double averageBaseLayerDegree;
    int freeSlots;
}
