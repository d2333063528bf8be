package com.neuroscape.navigation;

import com.neuroscape.grid.GridPoint;
import com.neuroscape.grid.Obstacle;
import com.neuroscape.grid.ObstacleGrid;

import javax.inject.Singleton;
import java.util.List;
import java.util.Optional;

/**
 * Centralized occupancy checks used by placement and agent logic.
 *
 * <p>This class handles:
 * <ul>
 *   <li>Single-cell blocking ({@link #isBlocked})</li>
 *   <li>Clearance around a cell ({@link #isClearWithRadius}) over a Manhattan radius</li>
 *   <li>Line of sight between cells ({@link #firstObstacleOnLine})</li>
 * </ul>
 *
 * <p>Any obstacle blocks occupancy here, destructible or not. Traversal cost is a separate
 * concern handled by {@link EdgeCostModel}.
 */
@Singleton
public class CollisionChecker {

    /**
     * Check if a cell cannot hold a new entity.
     *
     * @param grid the obstacle state
     * @param cell the cell to test
     * @return true if the cell is out of bounds or holds any obstacle
     */
    public boolean isBlocked(ObstacleGrid grid, GridPoint cell) {
        return !grid.inBounds(cell) || grid.isOccupied(cell);
    }

    /**
     * Check that a cell and every in-bounds cell within a Manhattan radius are obstacle free.
     *
     * <p>Cells beyond the grid edge do not count as obstacles; only the centre must be in bounds.
     *
     * @param grid   the obstacle state
     * @param cell   centre cell
     * @param radius Manhattan radius in cells; 0 checks the centre only
     * @return true if the neighbourhood is clear
     */
    public boolean isClearWithRadius(ObstacleGrid grid, GridPoint cell, int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("Radius must not be negative, got " + radius);
        }
        if (isBlocked(grid, cell)) {
            return false;
        }
        // No two cells of the grid are further apart than this
        int reach = Math.min(radius, 2 * (grid.getSize() - 1));
        int minY = Math.max(0, cell.getY() - reach);
        int maxY = Math.min(grid.getSize() - 1, cell.getY() + reach);
        for (int ny = minY; ny <= maxY; ny++) {
            int span = reach - Math.abs(ny - cell.getY());
            int minX = Math.max(0, cell.getX() - span);
            int maxX = Math.min(grid.getSize() - 1, cell.getX() + span);
            for (int nx = minX; nx <= maxX; nx++) {
                if (grid.getByIndex(grid.indexOf(nx, ny)) != null) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Find the first obstacle along the Bresenham line between two cells.
     *
     * <p>Agents use this to spot a destructible block standing between them and their
     * target and attack it instead of walking around.
     *
     * @param grid the obstacle state
     * @param from the observer's cell (checked too)
     * @param to   the target cell
     * @return the nearest obstacle on the line, if any
     */
    public Optional<Obstacle> firstObstacleOnLine(ObstacleGrid grid, GridPoint from, GridPoint to) {
        List<GridPoint> line = LineRasterizer.bresenham(from, to);
        for (GridPoint cell : line) {
            Obstacle obstacle = grid.get(cell);
            if (obstacle != null) {
                return Optional.of(obstacle);
            }
        }
        return Optional.empty();
    }

    /**
     * Check for a clear line of sight between two cells.
     */
    public boolean hasLineOfSight(ObstacleGrid grid, GridPoint from, GridPoint to) {
        return firstObstacleOnLine(grid, from, to).isEmpty();
    }
}
