package com.neuroscape.grid;

/**
 * Receives notifications whenever the contents of an {@link ObstacleGrid} change.
 */
public interface ObstacleChangeListener {

    default void onObstaclePlaced(Obstacle obstacle) {
    }

    /**
     * Called after non-lethal damage; the obstacle is still on the grid.
     */
    default void onObstacleDamaged(Obstacle obstacle) {
    }

    /**
     * Called after the obstacle has left the grid, either destroyed or carved away.
     */
    default void onObstacleRemoved(Obstacle obstacle) {
    }
}
