package com.neuroscape.navigation;

import com.neuroscape.grid.GridPoint;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Weighted 4-directional adjacency over a square grid, derived from an obstacle grid.
 *
 * <p>Nodes and edges are stored in flat arrays keyed by the cell index
 * {@code y * size + x}. For every node the outgoing neighbours and the weight of
 * each edge sit at the same position of {@link #neighbors} and {@link #weights}.
 *
 * <p>Instances are produced by {@link GraphBuilder}. The only mutation after
 * construction is the in-place weight patch applied by {@link NavigationGraph} when a
 * destructible cell takes non-lethal damage.
 */
public class GridGraph {

    private static final int[] NO_NEIGHBORS = new int[0];
    private static final double[] NO_WEIGHTS = new double[0];

    @Getter
    private final int size;

    private final boolean[] nodes;
    private final int[][] neighbors;
    private final double[][] weights;

    @Getter
    private final int nodeCount;

    @Getter
    private final int edgeCount;

    GridGraph(int size, boolean[] nodes, int[][] neighbors, double[][] weights) {
        this.size = size;
        this.nodes = nodes;
        this.neighbors = neighbors;
        this.weights = weights;

        int nodeTotal = 0;
        int edgeTotal = 0;
        for (int i = 0; i < nodes.length; i++) {
            if (neighbors[i] == null) {
                neighbors[i] = NO_NEIGHBORS;
                weights[i] = NO_WEIGHTS;
            }
            if (nodes[i]) {
                nodeTotal++;
                edgeTotal += neighbors[i].length;
            }
        }
        this.nodeCount = nodeTotal;
        this.edgeCount = edgeTotal;
    }

    // ========================================================================
    // Coordinates
    // ========================================================================

    public int getCellCount() {
        return nodes.length;
    }

    public boolean inBounds(GridPoint point) {
        return point != null
                && point.getX() >= 0 && point.getX() < size
                && point.getY() >= 0 && point.getY() < size;
    }

    public int indexOf(GridPoint point) {
        return point.getY() * size + point.getX();
    }

    public GridPoint pointAt(int index) {
        return GridPoint.of(index % size, index / size);
    }

    // ========================================================================
    // Topology
    // ========================================================================

    public boolean containsNode(GridPoint point) {
        return inBounds(point) && nodes[indexOf(point)];
    }

    public boolean containsNode(int index) {
        return index >= 0 && index < nodes.length && nodes[index];
    }

    /**
     * Outgoing neighbour indices of a node. The returned array is shared and must not be modified.
     */
    int[] neighborIndices(int index) {
        return neighbors[index];
    }

    /**
     * Weights parallel to {@link #neighborIndices(int)}. Shared, must not be modified.
     */
    double[] neighborWeights(int index) {
        return weights[index];
    }

    public List<GridPoint> neighborsOf(GridPoint point) {
        if (!containsNode(point)) {
            return Collections.emptyList();
        }
        int[] adjacent = neighbors[indexOf(point)];
        List<GridPoint> result = new ArrayList<>(adjacent.length);
        for (int neighbor : adjacent) {
            result.add(pointAt(neighbor));
        }
        return result;
    }

    /**
     * Weight of the edge from one cell to another.
     *
     * @return the weight, or {@link Double#POSITIVE_INFINITY} if there is no such edge
     */
    public double cost(GridPoint from, GridPoint to) {
        if (!containsNode(from) || !inBounds(to)) {
            return Double.POSITIVE_INFINITY;
        }
        return costByIndex(indexOf(from), indexOf(to));
    }

    double costByIndex(int from, int to) {
        int[] adjacent = neighbors[from];
        for (int i = 0; i < adjacent.length; i++) {
            if (adjacent[i] == to) {
                return weights[from][i];
            }
        }
        return Double.POSITIVE_INFINITY;
    }

    /**
     * Overwrite the weight of every edge leading into a target cell.
     *
     * @param target    index of the target cell
     * @param newWeight weight to store
     * @return number of edges updated
     */
    int updateIncomingWeights(int target, double newWeight) {
        int updated = 0;
        int[] adjacent = neighbors[target];
        // Adjacency is symmetric: every edge into target comes from one of target's neighbours.
        for (int source : adjacent) {
            int[] sourceAdjacent = neighbors[source];
            for (int i = 0; i < sourceAdjacent.length; i++) {
                if (sourceAdjacent[i] == target) {
                    weights[source][i] = newWeight;
                    updated++;
                }
            }
        }
        return updated;
    }
}
