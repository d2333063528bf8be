package com.neuroscape.generation;

import lombok.Builder;
import lombok.Value;

/**
 * Per-level generation request.
 *
 * <p>Counts are requests, not guarantees: the generator clamps them to the cells that are
 * actually available. The main block and the main item are always placed and are part of
 * {@link #obstacleCount} and {@link #itemCount} respectively.
 */
@Value
public class LevelParameters {

    /** Side length N of the square grid. */
    int gridSize;

    /** Obstacles including the main block. */
    int obstacleCount;

    /** Items including the main item. */
    int itemCount;

    /** Enemy spawn points. */
    int enemyCount;

    /** Starting health of the main block guarding the goal. */
    int baseObstacleHealth;

    /**
     * @throws IllegalArgumentException if the grid is smaller than 3x3, a count is negative
     *                                  or the base health is not positive
     */
    @Builder
    public LevelParameters(int gridSize, int obstacleCount, int itemCount, int enemyCount, int baseObstacleHealth) {
        if (gridSize < 3) {
            throw new IllegalArgumentException("Grid size must be at least 3, got " + gridSize);
        }
        if (obstacleCount < 0 || itemCount < 0 || enemyCount < 0) {
            throw new IllegalArgumentException("Counts must not be negative: obstacles=" + obstacleCount
                    + ", items=" + itemCount + ", enemies=" + enemyCount);
        }
        if (baseObstacleHealth <= 0) {
            throw new IllegalArgumentException("Base obstacle health must be positive, got " + baseObstacleHealth);
        }
        this.gridSize = gridSize;
        this.obstacleCount = obstacleCount;
        this.itemCount = itemCount;
        this.enemyCount = enemyCount;
        this.baseObstacleHealth = baseObstacleHealth;
    }

    public static LevelParameters of(int gridSize, int obstacleCount, int itemCount,
                                     int enemyCount, int baseObstacleHealth) {
        return new LevelParameters(gridSize, obstacleCount, itemCount, enemyCount, baseObstacleHealth);
    }
}
