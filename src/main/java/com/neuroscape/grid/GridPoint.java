package com.neuroscape.grid;

import lombok.Value;

/**
 * Immutable integer coordinate of a single cell on the level grid.
 *
 * <p>Bounds are not checked here; a point is only meaningful relative to an
 * {@link ObstacleGrid} of a given side length.
 */
@Value
public class GridPoint {

    int x;
    int y;

    public static GridPoint of(int x, int y) {
        return new GridPoint(x, y);
    }

    /**
     * Manhattan (4-directional step) distance to another cell.
     *
     * @param other the other cell
     * @return |dx| + |dy|
     */
    public int manhattanDistance(GridPoint other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }

    public GridPoint translate(int dx, int dy) {
        return new GridPoint(x + dx, y + dy);
    }

    /**
     * Check whether this cell lies on the outermost ring of a grid.
     *
     * @param gridSize side length of the grid
     * @return true if x or y touches a grid edge
     */
    public boolean isOnOuterRing(int gridSize) {
        return x == 0 || y == 0 || x == gridSize - 1 || y == gridSize - 1;
    }

    /**
     * Check whether this cell is one of the four grid corners.
     *
     * @param gridSize side length of the grid
     * @return true for (0,0), (0,N-1), (N-1,0) and (N-1,N-1)
     */
    public boolean isCorner(int gridSize) {
        boolean edgeX = x == 0 || x == gridSize - 1;
        boolean edgeY = y == 0 || y == gridSize - 1;
        return edgeX && edgeY;
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
