package com.neuroscape.navigation;

import com.neuroscape.grid.GridPoint;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Cost-aware A* search over a {@link GridGraph}.
 *
 * <p>Features:
 * <ul>
 *   <li>Frontier ordered by {@code g + h}, ties served in insertion order</li>
 *   <li>Manhattan heuristic, admissible and consistent because every edge weight is at least 1</li>
 *   <li>Destructible cells are expandable at their inflated weight, so the search routes
 *       around blocks unless breaking through is strictly cheaper</li>
 *   <li>Explicit {@link PathResult.Status#NO_PATH} for unreachable goals</li>
 * </ul>
 *
 * <p>Stateless: the same instance serves agent navigation and connectivity repair.
 */
@Slf4j
@Singleton
public class PathFinder {

    private static final int NONE = -1;

    /**
     * Find the lowest-cost path between two cells.
     *
     * @param graph the graph to search
     * @param start the starting cell
     * @param goal  the destination cell
     * @return the path result; never null
     */
    public PathResult findPath(GridGraph graph, GridPoint start, GridPoint goal) {
        if (start == null || goal == null) {
            log.warn("PathFinder: null start or goal");
            return PathResult.noPath(start, goal, "null endpoint");
        }
        if (!graph.inBounds(start) || !graph.inBounds(goal)) {
            log.debug("PathFinder: {} -> {} leaves the {}x{} grid", start, goal, graph.getSize(), graph.getSize());
            return PathResult.noPath(start, goal, "endpoint out of bounds");
        }
        if (!graph.containsNode(start)) {
            return PathResult.noPath(start, goal, "start cell is not traversable");
        }
        if (!graph.containsNode(goal)) {
            return PathResult.noPath(start, goal, "goal cell is not traversable");
        }

        // Already at destination
        if (start.equals(goal)) {
            return PathResult.builder()
                    .status(PathResult.Status.FOUND)
                    .start(start)
                    .goal(goal)
                    .path(Collections.singletonList(start))
                    .cumulativeCosts(Collections.singletonList(0.0))
                    .totalCost(0.0)
                    .costTable(Collections.singletonMap(start, 0.0))
                    .build();
        }

        return runAStar(graph, start, goal);
    }

    /**
     * Check whether any path exists between two cells.
     */
    public boolean hasPath(GridGraph graph, GridPoint start, GridPoint goal) {
        return findPath(graph, start, goal).isFound();
    }

    // ========================================================================
    // A* Implementation
    // ========================================================================

    private PathResult runAStar(GridGraph graph, GridPoint start, GridPoint goal) {
        int cellCount = graph.getCellCount();
        int startIndex = graph.indexOf(start);
        int goalIndex = graph.indexOf(goal);

        double[] gScore = new double[cellCount];
        Arrays.fill(gScore, Double.POSITIVE_INFINITY);
        int[] cameFrom = new int[cellCount];
        Arrays.fill(cameFrom, NONE);
        boolean[] closed = new boolean[cellCount];

        PriorityQueue<FrontierEntry> openSet = new PriorityQueue<>(
                Comparator.comparingDouble((FrontierEntry e) -> e.priority)
                        .thenComparingLong(e -> e.sequence));
        long sequence = 0;

        gScore[startIndex] = 0.0;
        openSet.add(new FrontierEntry(startIndex, 0.0, heuristic(graph, startIndex, goal), sequence++));

        int expanded = 0;

        while (!openSet.isEmpty()) {
            FrontierEntry current = openSet.poll();
            int currentIndex = current.index;

            if (closed[currentIndex] || current.gScore > gScore[currentIndex]) {
                continue;
            }
            closed[currentIndex] = true;
            expanded++;

            if (currentIndex == goalIndex) {
                return reconstructPath(graph, start, goal, cameFrom, gScore, expanded);
            }

            int[] neighbors = graph.neighborIndices(currentIndex);
            double[] weights = graph.neighborWeights(currentIndex);
            for (int i = 0; i < neighbors.length; i++) {
                int neighbor = neighbors[i];
                if (closed[neighbor]) {
                    continue;
                }

                double tentativeG = gScore[currentIndex] + weights[i];
                if (tentativeG < gScore[neighbor]) {
                    gScore[neighbor] = tentativeG;
                    cameFrom[neighbor] = currentIndex;
                    double priority = tentativeG + heuristic(graph, neighbor, goal);
                    openSet.add(new FrontierEntry(neighbor, tentativeG, priority, sequence++));
                }
            }
        }

        log.debug("PathFinder: no path from {} to {} ({} nodes expanded)", start, goal, expanded);
        return PathResult.builder()
                .status(PathResult.Status.NO_PATH)
                .start(start)
                .goal(goal)
                .totalCost(Double.POSITIVE_INFINITY)
                .costTable(costTable(graph, gScore))
                .expandedNodes(expanded)
                .failureReason("goal unreachable")
                .build();
    }

    /**
     * Walk the predecessor chain from goal back to start.
     */
    private PathResult reconstructPath(GridGraph graph, GridPoint start, GridPoint goal,
                                       int[] cameFrom, double[] gScore, int expanded) {
        List<GridPoint> path = new ArrayList<>();
        List<Double> cumulative = new ArrayList<>();

        int current = graph.indexOf(goal);
        while (current != NONE) {
            path.add(graph.pointAt(current));
            cumulative.add(gScore[current]);
            current = cameFrom[current];
        }
        Collections.reverse(path);
        Collections.reverse(cumulative);

        double totalCost = gScore[graph.indexOf(goal)];
        log.trace("PathFinder: {} -> {} in {} steps, cost {}", start, goal, path.size() - 1, totalCost);

        return PathResult.builder()
                .status(PathResult.Status.FOUND)
                .start(start)
                .goal(goal)
                .path(Collections.unmodifiableList(path))
                .cumulativeCosts(Collections.unmodifiableList(cumulative))
                .totalCost(totalCost)
                .costTable(costTable(graph, gScore))
                .expandedNodes(expanded)
                .build();
    }

    private static Map<GridPoint, Double> costTable(GridGraph graph, double[] gScore) {
        Map<GridPoint, Double> table = new HashMap<>();
        for (int i = 0; i < gScore.length; i++) {
            if (gScore[i] != Double.POSITIVE_INFINITY) {
                table.put(graph.pointAt(i), gScore[i]);
            }
        }
        return Collections.unmodifiableMap(table);
    }

    /**
     * Manhattan distance from a cell index to the goal.
     */
    private static int heuristic(GridGraph graph, int index, GridPoint goal) {
        int size = graph.getSize();
        int x = index % size;
        int y = index / size;
        return Math.abs(goal.getX() - x) + Math.abs(goal.getY() - y);
    }

    // ========================================================================
    // Inner Classes
    // ========================================================================

    /**
     * One frontier push. The same cell may be pushed several times; outdated entries are
     * recognised by a gScore larger than the best known one and skipped on poll.
     */
    private static final class FrontierEntry {
        final int index;
        final double gScore;
        final double priority;
        final long sequence;

        FrontierEntry(int index, double gScore, double priority, long sequence) {
            this.index = index;
            this.gScore = gScore;
            this.priority = priority;
            this.sequence = sequence;
        }
    }
}
