package org.ephemeral.hnsw.index;

import org.ephemeral.hnsw.index.model.SearchMatch;
import org.ephemeral.hnsw.utils.VectorUtils;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HNSWIndexRecallTest {

    private static final Logger log = LoggerFactory.getLogger(HNSWIndexRecallTest.class);

    private static final int NUM_VECTORS = 1000;
    private static final int DIMENSIONS = 128;
    private static final int NUM_QUERIES = 100;

    @Test
    void testRecallAtOneAgainstBruteForce() {
        float[][] vectors = generateVectors(NUM_VECTORS, DIMENSIONS, 42);
        float[][] queries = generateVectors(NUM_QUERIES, DIMENSIONS, 123);
        HNSWIndex index = buildIndex(vectors, NeighborSelection.CLOSEST);

        float recall = recallAtK(index, vectors, queries, 1);

        log.info("Recall@1 over {} queries with CLOSEST selection: {}", NUM_QUERIES, recall);
        assertTrue(recall >= 0.9f, "Recall should be >= 0.9, got: " + recall);
    }

    @Test
    void testRecallAtTenWithDiverseSelection() {
        float[][] vectors = generateVectors(NUM_VECTORS, DIMENSIONS, 7);
        float[][] queries = generateVectors(NUM_QUERIES, DIMENSIONS, 8);
        HNSWIndex index = buildIndex(vectors, NeighborSelection.DIVERSE);

        float recall = recallAtK(index, vectors, queries, 10);

        log.info("Recall@10 over {} queries with DIVERSE selection: {}", NUM_QUERIES, recall);
        assertTrue(recall >= 0.75f, "Recall should be >= 0.75, got: " + recall);
    }

    @Test
    void testRecallSurvivesRemovals() {
        float[][] vectors = generateVectors(NUM_VECTORS, DIMENSIONS, 99);
        float[][] queries = generateVectors(NUM_QUERIES, DIMENSIONS, 100);
        HNSWIndex index = buildIndex(vectors, NeighborSelection.CLOSEST);

        // drop every tenth vector, ground truth is computed over the survivors
        float[][] survivors = new float[NUM_VECTORS][];
        for (int i = 0; i < NUM_VECTORS; i++) {
            if (i % 10 == 0) {
                index.remove(String.valueOf(i));
            } else {
                survivors[i] = vectors[i];
            }
        }
        assertEquals(900, index.size());

        float recall = recallAtK(index, survivors, queries, 1);

        log.info("Recall@1 after removals: {}", recall);
        assertTrue(recall >= 0.8f, "Recall should be >= 0.8, got: " + recall);
    }

    private static HNSWIndex buildIndex(float[][] vectors, NeighborSelection selection) {
        HNSWIndex index = new HNSWIndex(HNSWIndexConfig.builder()
                .seed(1234L)
                .neighborSelection(selection)
                .build());
        index.init(DIMENSIONS);
        for (int i = 0; i < vectors.length; i++) {
            index.add(String.valueOf(i), vectors[i]);
        }
        assertEquals(vectors.length, index.size());
        return index;
    }

    /**
     * Fraction of the exact top-k (by cosine distance, skipping null rows) that the index returns.
     */
    private static float recallAtK(HNSWIndex index, float[][] vectors, float[][] queries, int k) {
        int found = 0;
        for (float[] query : queries) {
            Set<String> truth = bruteForce(vectors, query, k);
            // similarities of random gaussian vectors hover around 0, so no threshold
            List<SearchMatch> results = index.search(query, k, -1.0);
            for (SearchMatch match : results) {
                if (truth.contains(match.id())) {
                    found++;
                }
            }
        }
        return (float) found / (queries.length * k);
    }

    private static Set<String> bruteForce(float[][] vectors, float[] query, int k) {
        int[] best = new int[k];
        double[] bestDistance = new double[k];
        Arrays.fill(best, -1);
        Arrays.fill(bestDistance, Double.MAX_VALUE);
        for (int i = 0; i < vectors.length; i++) {
            if (vectors[i] == null) {
                continue;
            }
            double distance = VectorUtils.cosineDistance(vectors[i], query);
            // insertion into the sorted top-k
            int position = k;
            while (position > 0 && distance < bestDistance[position - 1]) {
                position--;
            }
            if (position < k) {
                System.arraycopy(best, position, best, position + 1, k - position - 1);
                System.arraycopy(bestDistance, position, bestDistance, position + 1, k - position - 1);
                best[position] = i;
                bestDistance[position] = distance;
            }
        }
        Set<String> ids = new HashSet<>();
        for (int id : best) {
            ids.add(String.valueOf(id));
        }
        return ids;
    }

    private static float[][] generateVectors(int numVectors, int dimensions, int seed) {
        float[][] vectors = new float[numVectors][dimensions];
        Random random = new Random(seed);
        for (int i = 0; i < numVectors; i++) {
            for (int j = 0; j < dimensions; j++) {
                vectors[i][j] = (float) random.nextGaussian();
            }
        }
        return vectors;
    }
}
