package org.ephemeral.hnsw.utils;


import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates random layer levels for HNSW graph nodes using exponential decay probability distribution.
 * <p>
 * The level assignment follows the HNSW algorithm where nodes are assigned to layers with exponentially
 * decreasing probability, ensuring a hierarchical structure with fewer nodes at higher layers. Levels are
 * capped at {@code maxLevel} so that the worst-case fan-out of a single insert does not depend on the
 * number of vectors.
 */
public class HNSWLevelGenerator {
    /** Random number generator for level assignment */
    private final Random random;

    /** Precomputed probability distribution for each layer level, at most maxLevel + 1 entries */
    private final List<Double> assignProbas;

    /**
     * Creates a level generator.
     *
     * @param levelMultiplier the mL constant of the HNSW paper, P(level >= l) = e^(-l/mL), typically
     *                        1/ln(M). Smaller values = steeper decay
     * @param maxLevel        highest level that can be returned
     * @param random          source of randomness, seed it for reproducible graphs
     */
    public HNSWLevelGenerator(double levelMultiplier, int maxLevel, Random random) {
        if (levelMultiplier <= 0) {
            throw new IllegalArgumentException("Level multiplier must be positive : " + levelMultiplier);
        }
        if (maxLevel < 0) {
            throw new IllegalArgumentException("Max level must be >= 0 : " + maxLevel);
        }
        this.random = random;
        this.assignProbas = new ArrayList<>();
        setDefaultProbas(levelMultiplier, maxLevel);
    }

    /**
     * Initializes the probability distribution for layer assignment using exponential decay.
     * <p>
     * The formula used is: P(level) = e^(-level/levelMult) * (1 - e^(-1/levelMult))
     * <p>
     * Probabilities below 1e-9 are considered negligible and computation stops, as does reaching
     * {@code maxLevel}.
     */
    private void setDefaultProbas(double levelMult, int maxLevel) {
        for (int level = 0; level <= maxLevel; level++) {
            double proba = Math.exp(-level / levelMult) * (1 - Math.exp(-1 / levelMult));
            if (proba < 1e-9 && level > 0) {
                break;
            }
            assignProbas.add(proba);
        }
    }

    /**
     * Generates a random layer level based on the exponential probability distribution.
     * <p>
     * Works like a weighted lottery using the subtraction method: draw a number in [0, 1), walk the
     * per-level probabilities from level 0 upwards subtracting each one, and return the first level
     * whose probability exceeds what is left.
     * <p>
     * Example: If probabilities are [0.7, 0.2, 0.08, 0.02]:
     * <ul>
     *   <li>Random 0.5 → 0.5 < 0.7 → Layer 0</li>
     *   <li>Random 0.8 → 0.8 >= 0.7, subtract: 0.8-0.7=0.1 → 0.1 < 0.2 → Layer 1</li>
     * </ul>
     *
     * @return layer level (0 for base layer, higher values for upper layers)
     */
    public int getRandomLevel() {
        double f = random.nextDouble();

        for (int level = 0; level < assignProbas.size(); level++) {
            if (f < assignProbas.get(level)) {
                return level;
            }
            f -= assignProbas.get(level);
        }

        // tail mass beyond the cap collapses onto the top level
        return assignProbas.size() - 1;
    }

    /**
     * @return the highest level this generator can produce
     */
    public int getLevelCap() {
        return assignProbas.size() - 1;
    }
}
