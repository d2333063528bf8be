package com.neuroscape.config;

import com.neuroscape.navigation.EdgeCostModel;
import lombok.Builder;
import lombok.Value;

/**
 * Tuning knobs for level generation, traversal cost and connectivity repair.
 *
 * <p>Configures:
 * <ul>
 *   <li>Spawn spacing and the placement retry budget</li>
 *   <li>Obstacle mix and health</li>
 *   <li>Edge cost of destructible cells</li>
 *   <li>Corridor carving during connectivity repair</li>
 * </ul>
 *
 * <p>Per-level quantities (grid size, counts, main block health) are not here; they come
 * with each generation request.
 */
@Value
@Builder(toBuilder = true)
public class GeneratorConfig {

    /**
     * Default configuration.
     */
    public static final GeneratorConfig DEFAULT = GeneratorConfig.builder().build();

    // ========================================================================
    // Placement
    // ========================================================================

    /**
     * Minimum Manhattan distance between the player spawn and every enemy spawn.
     */
    @Builder.Default
    int minSpawnDistance = 5;

    /**
     * Spawn sampling attempts before generation gives up.
     */
    @Builder.Default
    int maxPlacementAttempts = 1000;

    // ========================================================================
    // Obstacles
    // ========================================================================

    /**
     * Share of the ordinary obstacles that are destructible (0.0-1.0), rounded down.
     */
    @Builder.Default
    double destructibleRatio = 0.3;

    /**
     * Health of every ordinary destructible obstacle.
     */
    @Builder.Default
    int standardObstacleHealth = 20;

    // ========================================================================
    // Traversal cost
    // ========================================================================

    /**
     * Damage an attacking agent deals per hit.
     */
    @Builder.Default
    int breakUnit = 10;

    /**
     * Extra edge cost per hit needed to break a destructible cell. Must be positive.
     */
    @Builder.Default
    double breakFactor = 0.1;

    // ========================================================================
    // Connectivity repair
    // ========================================================================

    /**
     * Whether generated levels go through connectivity repair at all.
     */
    @Builder.Default
    boolean repairEnabled = true;

    /**
     * Carve the player spawn's full row and column before probing.
     */
    @Builder.Default
    boolean carveCross = true;

    /**
     * Number of random corridors carved in addition to the cross.
     */
    @Builder.Default
    int extraCorridors = 2;

    /**
     * Corridors are widened by this many cells on each side. 0 carves a single-cell line.
     */
    @Builder.Default
    int corridorHalfWidth = 1;

    /**
     * Upper bound on reachability sweeps after the targeted carving step.
     */
    @Builder.Default
    int maxRepairPasses = 4;

    /**
     * Build the edge cost model described by {@link #breakUnit} and {@link #breakFactor}.
     */
    public EdgeCostModel edgeCostModel() {
        return new EdgeCostModel(breakUnit, breakFactor);
    }

    /**
     * Check that all values are usable.
     *
     * @throws IllegalArgumentException naming the first offending value
     */
    public void validate() {
        if (minSpawnDistance < 0) {
            throw new IllegalArgumentException("minSpawnDistance must not be negative, got " + minSpawnDistance);
        }
        if (maxPlacementAttempts <= 0) {
            throw new IllegalArgumentException("maxPlacementAttempts must be positive, got " + maxPlacementAttempts);
        }
        if (destructibleRatio < 0 || destructibleRatio > 1) {
            throw new IllegalArgumentException("destructibleRatio must be within [0, 1], got " + destructibleRatio);
        }
        if (standardObstacleHealth <= 0) {
            throw new IllegalArgumentException("standardObstacleHealth must be positive, got " + standardObstacleHealth);
        }
        if (extraCorridors < 0 || corridorHalfWidth < 0 || maxRepairPasses < 0) {
            throw new IllegalArgumentException("Corridor settings must not be negative: extraCorridors="
                    + extraCorridors + ", corridorHalfWidth=" + corridorHalfWidth
                    + ", maxRepairPasses=" + maxRepairPasses);
        }
        // Throws for a non-positive break unit or factor
        edgeCostModel();
    }
}
