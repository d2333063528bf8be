package com.neuroscape.generation;

import com.neuroscape.config.GeneratorConfig;
import com.neuroscape.grid.GridPoint;
import com.neuroscape.grid.ObstacleGrid;
import com.neuroscape.grid.ObstacleType;
import com.neuroscape.navigation.EdgeCostModel;
import com.neuroscape.navigation.GraphBuilder;
import com.neuroscape.navigation.GridGraph;
import com.neuroscape.navigation.LineRasterizer;
import com.neuroscape.navigation.PathFinder;
import com.neuroscape.navigation.Reachability;
import com.neuroscape.util.Randomization;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Makes a freshly generated level traversable from the player spawn.
 *
 * <p>Repair runs in this order:
 * <ol>
 *   <li>Carve the spawn's full row and column, if enabled</li>
 *   <li>Carve a configured number of random corridors</li>
 *   <li>Build the graph once and probe the four grid exits in line with the spawn plus
 *       every entity cell; carve a corridor from the spawn to each unreachable one</li>
 *   <li>Sweep: connect every remaining unreachable non-indestructible cell to the nearest
 *       reachable cell, then verify on a rebuilt graph; repeat up to the pass limit</li>
 * </ol>
 *
 * <p>Repair never throws. If the level is still disconnected after the last pass it is
 * returned as best-effort with {@link RepairReport#isFullyConnected()} false.
 */
@Slf4j
@Singleton
public class ConnectivityRepair {

    private final GeneratorConfig config;
    private final GraphBuilder graphBuilder;
    private final PathFinder pathFinder;
    private final Reachability reachability;
    private final Randomization randomization;

    @Inject
    public ConnectivityRepair(GeneratorConfig config, GraphBuilder graphBuilder, PathFinder pathFinder,
                              Reachability reachability, Randomization randomization) {
        this.config = config;
        this.graphBuilder = graphBuilder;
        this.pathFinder = pathFinder;
        this.reachability = reachability;
        this.randomization = randomization;
    }

    /**
     * Repair a blueprint in place and record the report on it.
     *
     * @param blueprint the level to repair; its obstacle grid is modified
     * @return the report
     */
    public RepairReport repair(LevelBlueprint blueprint) {
        ObstacleGrid grid = blueprint.getObstacleGrid();
        GridPoint spawn = blueprint.getPlayerSpawn();
        EdgeCostModel costModel = config.edgeCostModel();
        CorridorCarver carver = new CorridorCarver(config.getCorridorHalfWidth());
        Tally tally = new Tally();

        // Baseline corridors
        if (config.isCarveCross()) {
            int n = grid.getSize();
            tally.corridor(carver.carve(grid, GridPoint.of(0, spawn.getY()), GridPoint.of(n - 1, spawn.getY())));
            tally.corridor(carver.carve(grid, GridPoint.of(spawn.getX(), 0), GridPoint.of(spawn.getX(), n - 1)));
        }
        for (int i = 0; i < config.getExtraCorridors(); i++) {
            tally.corridor(carver.carve(grid, randomCell(grid), randomCell(grid)));
        }

        // Targeted corridors to exits and entities
        GridGraph graph = graphBuilder.build(grid, costModel);
        int unreachableTargets = 0;
        for (GridPoint target : probeTargets(blueprint)) {
            if (!pathFinder.hasPath(graph, spawn, target)) {
                unreachableTargets++;
                tally.corridor(carver.carve(grid, spawn, target));
            }
        }

        // Sweep until every node is reachable
        List<GridPoint> unreachable = reachability.unreachableNodes(graphBuilder.build(grid, costModel), spawn);
        int passes = 0;
        while (!unreachable.isEmpty() && passes < config.getMaxRepairPasses()) {
            passes++;
            sweep(grid, spawn, carver, tally);
            unreachable = reachability.unreachableNodes(graphBuilder.build(grid, costModel), spawn);
        }

        RepairReport report = RepairReport.builder()
                .performed(true)
                .fullyConnected(unreachable.isEmpty())
                .corridorsCarved(tally.corridors)
                .obstaclesCleared(tally.cleared)
                .unreachableTargets(unreachableTargets)
                .sweepPasses(passes)
                .unreachableCells(unreachable.size())
                .build();
        blueprint.setRepairReport(report);

        if (report.isFullyConnected()) {
            log.debug("Level repaired: {} corridors, {} obstacles cleared, {} sweep pass(es)",
                    tally.corridors, tally.cleared, passes);
        } else {
            log.warn("Level only best-effort repaired: {} cells unreachable from {} after {} pass(es)",
                    unreachable.size(), spawn, passes);
        }
        return report;
    }

    /**
     * The four exits in line with the spawn, then every entity cell other than the spawn.
     */
    List<GridPoint> probeTargets(LevelBlueprint blueprint) {
        int n = blueprint.getGridSize();
        GridPoint spawn = blueprint.getPlayerSpawn();
        Set<GridPoint> targets = new LinkedHashSet<>();
        targets.add(GridPoint.of(spawn.getX(), 0));
        targets.add(GridPoint.of(spawn.getX(), n - 1));
        targets.add(GridPoint.of(0, spawn.getY()));
        targets.add(GridPoint.of(n - 1, spawn.getY()));
        targets.addAll(blueprint.entityCells());
        targets.remove(spawn);
        return new ArrayList<>(targets);
    }

    // ========================================================================
    // Sweep
    // ========================================================================

    /**
     * One sweep over the grid. The reached set is flooded from the spawn and extended
     * after every corridor, so each disconnected region costs exactly one corridor.
     */
    private void sweep(ObstacleGrid grid, GridPoint spawn, CorridorCarver carver, Tally tally) {
        boolean[] reached = new boolean[grid.getCellCount()];
        Deque<Integer> queue = new ArrayDeque<>();
        enqueue(grid, reached, queue, spawn);
        flood(grid, reached, queue);

        for (int index = 0; index < reached.length; index++) {
            GridPoint cell = grid.pointAt(index);
            if (reached[index] || !isTraversable(grid, cell)) {
                continue;
            }
            GridPoint anchor = nearestReached(grid, reached, cell);
            if (anchor == null) {
                // Spawn itself is walled in; nothing to grow a corridor from
                return;
            }
            tally.corridor(carver.carve(grid, anchor, cell));
            for (GridPoint carved : LineRasterizer.fourConnected(anchor, cell)) {
                enqueue(grid, reached, queue, carved);
            }
            flood(grid, reached, queue);
        }
    }

    private static void flood(ObstacleGrid grid, boolean[] reached, Deque<Integer> queue) {
        while (!queue.isEmpty()) {
            GridPoint cell = grid.pointAt(queue.poll());
            enqueue(grid, reached, queue, cell.translate(1, 0));
            enqueue(grid, reached, queue, cell.translate(-1, 0));
            enqueue(grid, reached, queue, cell.translate(0, 1));
            enqueue(grid, reached, queue, cell.translate(0, -1));
        }
    }

    private static void enqueue(ObstacleGrid grid, boolean[] reached, Deque<Integer> queue, GridPoint cell) {
        if (!isTraversable(grid, cell)) {
            return;
        }
        int index = grid.indexOf(cell);
        if (!reached[index]) {
            reached[index] = true;
            queue.add(index);
        }
    }

    private static boolean isTraversable(ObstacleGrid grid, GridPoint cell) {
        return grid.inBounds(cell) && grid.typeAt(cell) != ObstacleType.INDESTRUCTIBLE;
    }

    @Nullable
    private static GridPoint nearestReached(ObstacleGrid grid, boolean[] reached, GridPoint target) {
        GridPoint best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (int index = 0; index < reached.length; index++) {
            if (!reached[index]) {
                continue;
            }
            GridPoint candidate = grid.pointAt(index);
            int distance = candidate.manhattanDistance(target);
            if (distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return best;
    }

    private GridPoint randomCell(ObstacleGrid grid) {
        int max = grid.getSize() - 1;
        return GridPoint.of(randomization.uniformRandomInt(0, max), randomization.uniformRandomInt(0, max));
    }

    private static final class Tally {
        int corridors;
        int cleared;

        void corridor(int clearedByCorridor) {
            corridors++;
            cleared += clearedByCorridor;
        }
    }
}
