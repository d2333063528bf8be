package com.neuroscape.navigation;

import com.neuroscape.grid.GridPoint;

import javax.inject.Singleton;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Whole-graph reachability checks.
 *
 * <p>Where {@link PathFinder} answers a single start/goal query, this class floods the
 * graph once from a source so that generation-time validation can test every cell
 * without one search per destination. Edge weights are irrelevant here: a destructible
 * cell is reachable, only indestructible cells are not.
 */
@Singleton
public class Reachability {

    /**
     * Breadth-first flood from a source cell.
     *
     * @param graph  the graph
     * @param source the cell to flood from
     * @return a mask indexed like the graph's cells; all false if the source is not a node
     */
    public boolean[] reachableMask(GridGraph graph, GridPoint source) {
        boolean[] reached = new boolean[graph.getCellCount()];
        if (!graph.containsNode(source)) {
            return reached;
        }

        Deque<Integer> queue = new ArrayDeque<>();
        int sourceIndex = graph.indexOf(source);
        reached[sourceIndex] = true;
        queue.add(sourceIndex);

        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (int neighbor : graph.neighborIndices(current)) {
                if (!reached[neighbor]) {
                    reached[neighbor] = true;
                    queue.add(neighbor);
                }
            }
        }
        return reached;
    }

    /**
     * Nodes of the graph that cannot be reached from the source, in index order.
     */
    public List<GridPoint> unreachableNodes(GridGraph graph, GridPoint source) {
        boolean[] reached = reachableMask(graph, source);
        List<GridPoint> result = new ArrayList<>();
        for (int i = 0; i < reached.length; i++) {
            if (graph.containsNode(i) && !reached[i]) {
                result.add(graph.pointAt(i));
            }
        }
        return result;
    }

    /**
     * Check that every node of the graph is reachable from the source.
     */
    public boolean isFullyConnected(GridGraph graph, GridPoint source) {
        return graph.containsNode(source) && unreachableNodes(graph, source).isEmpty();
    }
}
