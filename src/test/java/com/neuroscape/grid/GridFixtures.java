package com.neuroscape.grid;

/**
 * Builds obstacle grids from ASCII maps for tests.
 *
 * <p>Legend: {@code .} empty, {@code #} indestructible, {@code D} destructible with
 * {@link #DESTRUCTIBLE_HEALTH}, {@code M} main block with {@link #MAIN_BLOCK_HEALTH}.
 * Row {@code y} of the map is the string at index {@code y}.
 */
public final class GridFixtures {

    public static final int DESTRUCTIBLE_HEALTH = 20;
    public static final int MAIN_BLOCK_HEALTH = 40;

    private GridFixtures() {
    }

    public static ObstacleGrid parse(String... rows) {
        ObstacleGrid grid = new ObstacleGrid(rows.length);
        for (int y = 0; y < rows.length; y++) {
            if (rows[y].length() != rows.length) {
                throw new IllegalArgumentException("Map must be square, row " + y + " is " + rows[y]);
            }
            for (int x = 0; x < rows[y].length(); x++) {
                GridPoint cell = GridPoint.of(x, y);
                switch (rows[y].charAt(x)) {
                    case '.':
                        break;
                    case '#':
                        grid.place(Obstacle.indestructible(cell));
                        break;
                    case 'D':
                        grid.place(Obstacle.destructible(cell, DESTRUCTIBLE_HEALTH));
                        break;
                    case 'M':
                        grid.place(Obstacle.mainBlock(cell, MAIN_BLOCK_HEALTH));
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown map symbol '" + rows[y].charAt(x) + "'");
                }
            }
        }
        return grid;
    }
}
