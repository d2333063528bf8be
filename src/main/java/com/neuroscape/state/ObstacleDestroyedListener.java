package com.neuroscape.state;

import com.neuroscape.grid.Obstacle;

/**
 * Notified once for every obstacle destroyed by damage during a level session.
 */
@FunctionalInterface
public interface ObstacleDestroyedListener {

    /**
     * @param obstacle the obstacle, already removed from the grid with health 0
     */
    void onObstacleDestroyed(Obstacle obstacle);
}
