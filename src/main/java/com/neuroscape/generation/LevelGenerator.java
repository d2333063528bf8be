package com.neuroscape.generation;

import com.neuroscape.config.GeneratorConfig;
import com.neuroscape.grid.GridPoint;
import com.neuroscape.grid.Obstacle;
import com.neuroscape.grid.ObstacleGrid;
import com.neuroscape.navigation.GraphBuilder;
import com.neuroscape.navigation.PathFinder;
import com.neuroscape.navigation.Reachability;
import com.neuroscape.util.Randomization;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Procedural level generator.
 *
 * <p>Generation order:
 * <ol>
 *   <li>All cells except the four corners are candidates</li>
 *   <li>Player and enemy spawns are rejection-sampled by {@link SpawnPlacer}</li>
 *   <li>The goal is picked among free interior cells and covered by the main block</li>
 *   <li>Ordinary obstacles are sampled from the free cells; a fixed share is destructible</li>
 *   <li>Ordinary items are sampled from the cells still free; the main item goes on the goal</li>
 *   <li>{@link ConnectivityRepair} carves the level traversable</li>
 * </ol>
 *
 * <p>All randomness comes from the injected {@link Randomization}, so a seeded instance
 * reproduces the same level for the same parameters.
 */
@Slf4j
@Singleton
public class LevelGenerator {

    private final GeneratorConfig config;
    private final Randomization randomization;
    private final ConnectivityRepair connectivityRepair;

    @Inject
    public LevelGenerator(GeneratorConfig config, Randomization randomization,
                          ConnectivityRepair connectivityRepair) {
        config.validate();
        this.config = config;
        this.randomization = randomization;
        this.connectivityRepair = connectivityRepair;
    }

    /**
     * Generator with its own repair step sharing the same random source.
     */
    public LevelGenerator(GeneratorConfig config, Randomization randomization) {
        this(config, randomization, new ConnectivityRepair(
                config, new GraphBuilder(), new PathFinder(), new Reachability(), randomization));
    }

    /**
     * Generate a level.
     *
     * @param parameters the request
     * @return the finished blueprint, repaired unless repair is disabled
     * @throws GenerationFailedException if no valid spawn layout is found within the retry budget
     */
    public LevelBlueprint generate(LevelParameters parameters) {
        long startTime = System.currentTimeMillis();
        int n = parameters.getGridSize();

        List<GridPoint> candidates = new ArrayList<>(n * n - 4);
        for (int y = 0; y < n; y++) {
            for (int x = 0; x < n; x++) {
                GridPoint cell = GridPoint.of(x, y);
                if (!cell.isCorner(n)) {
                    candidates.add(cell);
                }
            }
        }

        // Spawns; one candidate stays reserved for the goal
        int enemyCount = clamp("enemy", parameters.getEnemyCount(), candidates.size() - 2);
        SpawnPlacer spawnPlacer = new SpawnPlacer(
                randomization, config.getMinSpawnDistance(), config.getMaxPlacementAttempts());
        SpawnLayout layout = spawnPlacer.place(candidates, enemyCount, n)
                .orElseThrow(() -> new GenerationFailedException(String.format(
                        "No spawn layout with %d enemies at distance >= %d on a %dx%d grid after %d attempts",
                        enemyCount, config.getMinSpawnDistance(), n, n, config.getMaxPlacementAttempts())));

        Set<GridPoint> taken = new HashSet<>(layout.getEnemySpawns());
        taken.add(layout.getPlayerSpawn());

        // Goal under the main block
        List<GridPoint> interiorFree = new ArrayList<>();
        for (GridPoint cell : candidates) {
            if (!taken.contains(cell) && !cell.isOnOuterRing(n)) {
                interiorFree.add(cell);
            }
        }
        if (interiorFree.isEmpty()) {
            throw new GenerationFailedException("No free interior cell left for the goal on a " + n + "x" + n + " grid");
        }
        GridPoint goal = randomization.pick(interiorFree);
        taken.add(goal);

        ObstacleGrid grid = new ObstacleGrid(n);
        grid.place(Obstacle.mainBlock(goal, parameters.getBaseObstacleHealth()));

        // Ordinary obstacles
        List<GridPoint> free = freeCells(candidates, taken);
        int ordinaryObstacles = clamp("obstacle", Math.max(0, parameters.getObstacleCount() - 1), free.size());
        List<GridPoint> obstacleCells = randomization.sample(free, ordinaryObstacles);
        int destructibleCount = (int) Math.floor(ordinaryObstacles * config.getDestructibleRatio());
        for (int i = 0; i < obstacleCells.size(); i++) {
            GridPoint cell = obstacleCells.get(i);
            if (i < destructibleCount) {
                grid.place(Obstacle.destructible(cell, config.getStandardObstacleHealth()));
            } else {
                grid.place(Obstacle.indestructible(cell));
            }
        }
        taken.addAll(obstacleCells);

        // Items, main item last
        free = freeCells(candidates, taken);
        int ordinaryItems = clamp("item", Math.max(0, parameters.getItemCount() - 1), free.size());
        List<Item> items = new ArrayList<>(ordinaryItems + 1);
        for (GridPoint cell : randomization.sample(free, ordinaryItems)) {
            items.add(Item.ordinary(cell));
        }
        items.add(Item.main(goal));

        LevelBlueprint blueprint = new LevelBlueprint(parameters, layout.getPlayerSpawn(),
                layout.getEnemySpawns(), grid, items, goal);

        if (config.isRepairEnabled()) {
            connectivityRepair.repair(blueprint);
        }

        log.info("Generated {} in {}ms", blueprint, System.currentTimeMillis() - startTime);
        return blueprint;
    }

    private static List<GridPoint> freeCells(List<GridPoint> candidates, Set<GridPoint> taken) {
        List<GridPoint> free = new ArrayList<>();
        for (GridPoint cell : candidates) {
            if (!taken.contains(cell)) {
                free.add(cell);
            }
        }
        return free;
    }

    private static int clamp(String what, int requested, int available) {
        int limit = Math.max(0, available);
        if (requested > limit) {
            log.warn("Requested {} {} count exceeds the {} available cells; clamping", requested, what, limit);
            return limit;
        }
        return requested;
    }
}
