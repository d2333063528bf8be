package com.neuroscape.navigation;

import com.neuroscape.grid.GridPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Integer line rasterization between two cells.
 */
public final class LineRasterizer {

    private LineRasterizer() {
        // Utility class - prevent instantiation
    }

    /**
     * Bresenham line from {@code from} to {@code to}, both endpoints included.
     *
     * <p>Consecutive cells may touch only at a corner (8-connected).
     *
     * @param from first endpoint
     * @param to   second endpoint
     * @return the cells of the line in order
     */
    public static List<GridPoint> bresenham(GridPoint from, GridPoint to) {
        return rasterize(from, to, false);
    }

    /**
     * Bresenham line that inserts the horizontal neighbour before every diagonal step,
     * so consecutive cells always share an edge and a 4-directional walker can follow it.
     *
     * @param from first endpoint
     * @param to   second endpoint
     * @return the cells of the line in order
     */
    public static List<GridPoint> fourConnected(GridPoint from, GridPoint to) {
        return rasterize(from, to, true);
    }

    private static List<GridPoint> rasterize(GridPoint from, GridPoint to, boolean fourConnected) {
        List<GridPoint> cells = new ArrayList<>();
        int x = from.getX();
        int y = from.getY();
        int x1 = to.getX();
        int y1 = to.getY();
        int dx = Math.abs(x1 - x);
        int dy = Math.abs(y1 - y);
        int sx = x < x1 ? 1 : -1;
        int sy = y < y1 ? 1 : -1;
        int err = dx - dy;

        while (true) {
            cells.add(GridPoint.of(x, y));
            if (x == x1 && y == y1) {
                break;
            }
            int e2 = 2 * err;
            boolean stepX = e2 > -dy;
            boolean stepY = e2 < dx;
            if (stepX) {
                err -= dy;
                x += sx;
            }
            if (stepY) {
                if (fourConnected && stepX) {
                    cells.add(GridPoint.of(x, y));
                }
                err += dx;
                y += sy;
            }
        }
        return cells;
    }
}
