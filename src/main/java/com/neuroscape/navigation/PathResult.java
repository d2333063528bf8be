package com.neuroscape.navigation;

import com.neuroscape.grid.GridPoint;
import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Outcome of a path query.
 *
 * <p>A {@link Status#NO_PATH} result is never confused with a short path: it carries an
 * empty path, while a query whose start equals its goal is {@link Status#FOUND} with a
 * single-cell path and zero cost.
 */
@Value
@Builder
public class PathResult {

    public enum Status {
        /** A minimum-cost path from start to goal exists. */
        FOUND,
        /** The goal cannot be reached from the start. */
        NO_PATH
    }

    Status status;

    GridPoint start;

    GridPoint goal;

    /**
     * Cells from start to goal inclusive. Empty when no path exists.
     */
    @Builder.Default
    List<GridPoint> path = Collections.emptyList();

    /**
     * Accumulated cost at each position of {@link #path}; the first entry is 0.
     */
    @Builder.Default
    List<Double> cumulativeCosts = Collections.emptyList();

    /**
     * Sum of edge weights along the path. {@link Double#POSITIVE_INFINITY} when no path exists.
     */
    double totalCost;

    /**
     * Best known accumulated cost of every cell the search reached.
     */
    @Builder.Default
    Map<GridPoint, Double> costTable = Collections.emptyMap();

    /**
     * Number of frontier entries expanded by the search.
     */
    int expandedNodes;

    /**
     * Why no path was returned.
     */
    @Nullable
    String failureReason;

    public static PathResult noPath(GridPoint start, GridPoint goal, String reason) {
        return PathResult.builder()
                .status(Status.NO_PATH)
                .start(start)
                .goal(goal)
                .totalCost(Double.POSITIVE_INFINITY)
                .failureReason(reason)
                .build();
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    /**
     * Number of steps (edges) along the path, or -1 if no path exists.
     */
    public int getStepCount() {
        return isFound() ? path.size() - 1 : -1;
    }

    /**
     * Look up the accumulated cost the search recorded for a cell.
     *
     * @param point the cell
     * @return the cost, or empty if the search never reached the cell
     */
    public OptionalDouble getCostTo(GridPoint point) {
        Double cost = costTable.get(point);
        return cost == null ? OptionalDouble.empty() : OptionalDouble.of(cost);
    }

    /**
     * The cell after the start, which is where an agent should step next.
     *
     * @return the next cell, or null if there is no path or the agent is already at the goal
     */
    @Nullable
    public GridPoint getNextStep() {
        if (!isFound() || path.size() < 2) {
            return null;
        }
        return path.get(1);
    }
}
