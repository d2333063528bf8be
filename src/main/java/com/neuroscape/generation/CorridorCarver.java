package com.neuroscape.generation;

import com.neuroscape.grid.GridPoint;
import com.neuroscape.grid.Obstacle;
import com.neuroscape.grid.ObstacleGrid;
import com.neuroscape.navigation.LineRasterizer;

import java.util.List;

/**
 * Clears corridors through an obstacle grid.
 *
 * <p>A corridor follows a 4-connected line between two cells, so a walker restricted to
 * orthogonal steps can use it, and is widened by {@code halfWidth} cells in both axes.
 * Every obstacle in the corridor is removed except the main block, which stays to keep
 * the goal gated (it is traversable anyway).
 */
public class CorridorCarver {

    private final int halfWidth;

    public CorridorCarver(int halfWidth) {
        if (halfWidth < 0) {
            throw new IllegalArgumentException("Corridor half width must not be negative, got " + halfWidth);
        }
        this.halfWidth = halfWidth;
    }

    /**
     * Carve a corridor between two cells. Endpoints may lie outside the grid; only
     * in-bounds cells are touched.
     *
     * @param grid the grid to carve
     * @param from first endpoint
     * @param to   second endpoint
     * @return number of obstacles removed
     */
    public int carve(ObstacleGrid grid, GridPoint from, GridPoint to) {
        List<GridPoint> line = LineRasterizer.fourConnected(from, to);
        int cleared = 0;
        for (GridPoint cell : line) {
            cleared += carveCell(grid, cell);
        }
        return cleared;
    }

    /**
     * Clear the square of side {@code 2 * halfWidth + 1} centred on a cell.
     *
     * @return number of obstacles removed
     */
    public int carveCell(ObstacleGrid grid, GridPoint center) {
        int cleared = 0;
        for (int dy = -halfWidth; dy <= halfWidth; dy++) {
            for (int dx = -halfWidth; dx <= halfWidth; dx++) {
                GridPoint cell = center.translate(dx, dy);
                Obstacle obstacle = grid.get(cell);
                if (obstacle != null && !obstacle.isMainBlock()) {
                    grid.remove(cell);
                    cleared++;
                }
            }
        }
        return cleared;
    }
}
