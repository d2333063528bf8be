package com.neuroscape.core;

import com.neuroscape.config.GeneratorConfig;
import com.neuroscape.generation.LevelBlueprint;
import com.neuroscape.generation.LevelConfig;
import com.neuroscape.generation.LevelGenerator;
import com.neuroscape.generation.LevelParameters;
import com.neuroscape.generation.LevelProgression;
import com.neuroscape.grid.GridPoint;
import com.neuroscape.navigation.CollisionChecker;
import com.neuroscape.navigation.GraphBuilder;
import com.neuroscape.navigation.GridGraph;
import com.neuroscape.navigation.PathFinder;
import com.neuroscape.navigation.PathResult;
import com.neuroscape.state.LevelState;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Entry point for the game layer.
 *
 * <p>Generates level blueprints, opens play sessions on them and answers one-off path
 * queries. Everything a renderer or game loop needs from the level core goes through here.
 */
@Slf4j
@Singleton
public class LevelService {

    private final GeneratorConfig config;
    private final LevelGenerator levelGenerator;
    private final LevelProgression levelProgression;
    private final GraphBuilder graphBuilder;
    private final PathFinder pathFinder;
    private final CollisionChecker collisionChecker;

    @Inject
    public LevelService(GeneratorConfig config, LevelGenerator levelGenerator, LevelProgression levelProgression,
                        GraphBuilder graphBuilder, PathFinder pathFinder, CollisionChecker collisionChecker) {
        this.config = config;
        this.levelGenerator = levelGenerator;
        this.levelProgression = levelProgression;
        this.graphBuilder = graphBuilder;
        this.pathFinder = pathFinder;
        this.collisionChecker = collisionChecker;
    }

    // ========================================================================
    // Generation
    // ========================================================================

    /**
     * Generate a level.
     *
     * @throws IllegalArgumentException for invalid parameters
     * @throws com.neuroscape.generation.GenerationFailedException if spawn placement fails
     */
    public LevelBlueprint generateLevel(int gridSize, int obstacleCount, int itemCount,
                                        int enemyCount, int baseObstacleHealth) {
        return generateLevel(LevelParameters.of(gridSize, obstacleCount, itemCount, enemyCount, baseObstacleHealth));
    }

    public LevelBlueprint generateLevel(LevelParameters parameters) {
        return levelGenerator.generate(parameters);
    }

    /**
     * Generate the level at a position of the progression.
     *
     * @param levelIndex zero-based level index
     * @param gridSize   grid side length
     */
    public LevelBlueprint generateLevelForProgression(int levelIndex, int gridSize) {
        LevelConfig levelConfig = levelProgression.forLevel(levelIndex);
        log.debug("Level {} config: {}", levelIndex, levelConfig);
        return generateLevel(levelConfig.toParameters(gridSize));
    }

    public LevelBlueprint generateLevelForProgression(int levelIndex) {
        return generateLevelForProgression(levelIndex, LevelProgression.DEFAULT_GRID_SIZE);
    }

    public LevelConfig getLevelConfig(int levelIndex) {
        return levelProgression.forLevel(levelIndex);
    }

    // ========================================================================
    // Sessions and queries
    // ========================================================================

    /**
     * Start playing a generated level. The session takes over the blueprint's obstacle grid.
     */
    public LevelState openSession(LevelBlueprint blueprint) {
        return new LevelState(blueprint, config.edgeCostModel(), graphBuilder, pathFinder, collisionChecker);
    }

    /**
     * Build a standalone graph snapshot of a blueprint's current obstacles.
     */
    public GridGraph buildGraph(LevelBlueprint blueprint) {
        return graphBuilder.build(blueprint.getObstacleGrid(), config.edgeCostModel());
    }

    public PathResult findPath(GridGraph graph, GridPoint start, GridPoint goal) {
        return pathFinder.findPath(graph, start, goal);
    }
}
