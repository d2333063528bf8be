package com.neuroscape.navigation;

import com.neuroscape.grid.Obstacle;
import com.neuroscape.grid.ObstacleGrid;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Singleton;
import java.util.Arrays;

/**
 * Converts the current obstacle state into a {@link GridGraph}.
 *
 * <p>Pure function of its inputs: building twice from the same grid yields equal graphs,
 * so it is safe to call every time the navigation graph is marked dirty.
 */
@Slf4j
@Singleton
public class GraphBuilder {

    /**
     * Orthogonal offsets: left, right, up, down. No diagonals.
     */
    private static final int[][] DIRECTIONS = {
            {-1, 0},
            {1, 0},
            {0, -1},
            {0, 1}
    };

    /**
     * Build the adjacency and weight tables for a grid.
     *
     * @param grid      the obstacle state
     * @param costModel edge weight rules
     * @return a fresh graph
     */
    public GridGraph build(ObstacleGrid grid, EdgeCostModel costModel) {
        long startTime = System.nanoTime();

        int size = grid.getSize();
        int cellCount = grid.getCellCount();
        boolean[] nodes = new boolean[cellCount];
        int[][] neighbors = new int[cellCount][];
        double[][] weights = new double[cellCount][];

        for (int index = 0; index < cellCount; index++) {
            nodes[index] = isTraversable(grid.getByIndex(index));
        }

        int[] scratchNeighbors = new int[DIRECTIONS.length];
        double[] scratchWeights = new double[DIRECTIONS.length];

        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                int index = grid.indexOf(x, y);
                if (!nodes[index]) {
                    continue;
                }

                int count = 0;
                for (int[] direction : DIRECTIONS) {
                    int nx = x + direction[0];
                    int ny = y + direction[1];
                    if (!grid.inBounds(nx, ny)) {
                        continue;
                    }
                    int neighborIndex = grid.indexOf(nx, ny);
                    if (!nodes[neighborIndex]) {
                        continue;
                    }
                    scratchNeighbors[count] = neighborIndex;
                    scratchWeights[count] = costModel.weightInto(grid.getByIndex(neighborIndex));
                    count++;
                }

                neighbors[index] = Arrays.copyOf(scratchNeighbors, count);
                weights[index] = Arrays.copyOf(scratchWeights, count);
            }
        }

        GridGraph graph = new GridGraph(size, nodes, neighbors, weights);

        long elapsed = System.nanoTime() - startTime;
        log.trace("Built graph {}x{}: {} nodes, {} edges in {}us",
                size, size, graph.getNodeCount(), graph.getEdgeCount(), elapsed / 1_000);
        return graph;
    }

    private static boolean isTraversable(Obstacle obstacle) {
        return obstacle == null || obstacle.getType().isTraversable();
    }
}
