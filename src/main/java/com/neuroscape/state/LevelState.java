package com.neuroscape.state;

import com.neuroscape.generation.Item;
import com.neuroscape.generation.LevelBlueprint;
import com.neuroscape.grid.DamageOutcome;
import com.neuroscape.grid.GridPoint;
import com.neuroscape.grid.Obstacle;
import com.neuroscape.grid.ObstacleGrid;
import com.neuroscape.navigation.AgentPathCache;
import com.neuroscape.navigation.CollisionChecker;
import com.neuroscape.navigation.EdgeCostModel;
import com.neuroscape.navigation.GraphBuilder;
import com.neuroscape.navigation.GridGraph;
import com.neuroscape.navigation.NavigationGraph;
import com.neuroscape.navigation.PathFinder;
import com.neuroscape.navigation.PathResult;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runtime state of one level being played.
 *
 * <p>Owns a private copy of the blueprint's obstacle grid, the navigation graph derived
 * from it and the items still on the floor. The blueprint itself is never changed, so
 * every session opened on it starts from the generated layout. Obstacles change at
 * runtime only through {@link #damageObstacle(GridPoint, int)}; destroying one marks the
 * navigation graph dirty so the next path query sees the opened cell.
 *
 * <p>The main item is gated: it cannot be collected while the main block still stands.
 */
@Slf4j
public class LevelState {

    @Getter
    private final LevelBlueprint blueprint;

    private final ObstacleGrid grid;
    private final NavigationGraph navigationGraph;
    private final CollisionChecker collisionChecker;

    @Getter
    private final AgentPathCache agentPathCache;

    private final Map<GridPoint, Item> remainingItems = new LinkedHashMap<>();
    private final List<ObstacleDestroyedListener> destroyedListeners = new ArrayList<>();

    @Getter
    private boolean mainItemCollected;

    @Getter
    private int destroyedCount;

    public LevelState(LevelBlueprint blueprint, EdgeCostModel costModel, GraphBuilder graphBuilder,
                      PathFinder pathFinder, CollisionChecker collisionChecker) {
        this.blueprint = blueprint;
        this.grid = blueprint.getObstacleGrid().copy();
        this.navigationGraph = new NavigationGraph(grid, costModel, graphBuilder, pathFinder);
        this.collisionChecker = collisionChecker;
        this.agentPathCache = new AgentPathCache(navigationGraph);
        for (Item item : blueprint.getItems()) {
            remainingItems.put(item.getPosition(), item);
        }
    }

    // ========================================================================
    // Obstacles
    // ========================================================================

    /**
     * Damage the obstacle at a cell.
     *
     * <p>Empty, indestructible and out-of-bounds cells, and non-positive amounts, are
     * ignored. On destruction the obstacle leaves the grid, the destructible count drops
     * by one, the navigation graph is marked dirty and destroyed listeners fire.
     *
     * @param cell   the cell that was hit
     * @param amount damage dealt
     * @return what happened
     */
    public DamageOutcome damageObstacle(GridPoint cell, int amount) {
        Obstacle target = grid.get(cell);
        DamageOutcome outcome = grid.damage(cell, amount);

        if (outcome == DamageOutcome.DESTROYED) {
            destroyedCount++;
            log.debug("{} destroyed at {}", target.getType(), cell);
            for (ObstacleDestroyedListener listener : new ArrayList<>(destroyedListeners)) {
                listener.onObstacleDestroyed(target);
            }
        }
        return outcome;
    }

    public Optional<Obstacle> getObstacle(GridPoint cell) {
        return Optional.ofNullable(grid.get(cell));
    }

    public int getRemainingDestructibleCount() {
        return grid.getRemainingDestructibleCount();
    }

    public boolean isMainBlockPresent() {
        return grid.isMainBlockPresent();
    }

    public void addDestroyedListener(ObstacleDestroyedListener listener) {
        destroyedListeners.add(listener);
    }

    public void removeDestroyedListener(ObstacleDestroyedListener listener) {
        destroyedListeners.remove(listener);
    }

    // ========================================================================
    // Collision
    // ========================================================================

    public boolean isBlocked(GridPoint cell) {
        return collisionChecker.isBlocked(grid, cell);
    }

    public boolean isClearWithRadius(GridPoint cell, int radius) {
        return collisionChecker.isClearWithRadius(grid, cell, radius);
    }

    /**
     * First obstacle on the straight line between two cells, e.g. a block an agent should
     * attack to reach its target.
     */
    public Optional<Obstacle> firstObstacleOnLine(GridPoint from, GridPoint to) {
        return collisionChecker.firstObstacleOnLine(grid, from, to);
    }

    // ========================================================================
    // Navigation
    // ========================================================================

    /**
     * Cheapest path between two cells on the current graph.
     */
    public PathResult findPath(GridPoint start, GridPoint goal) {
        return navigationGraph.findPath(start, goal);
    }

    /**
     * Path for an agent, reused from its cache until stale.
     *
     * @see AgentPathCache#getPath(String, GridPoint, GridPoint, long)
     */
    public PathResult findAgentPath(String agentId, GridPoint start, GridPoint goal, long currentTick) {
        return agentPathCache.getPath(agentId, start, goal, currentTick);
    }

    /**
     * Forget an agent that left the level, e.g. a killed enemy.
     */
    public void releaseAgent(String agentId) {
        agentPathCache.invalidate(agentId);
    }

    public GridGraph getGraph() {
        return navigationGraph.getGraph();
    }

    public NavigationGraph getNavigationGraph() {
        return navigationGraph;
    }

    // ========================================================================
    // Items
    // ========================================================================

    /**
     * Collect the item at a cell.
     *
     * @param cell the cell the collector stands on
     * @return true if an item was collected; false for an empty cell or a main item still
     *         guarded by the main block
     */
    public boolean collectItem(GridPoint cell) {
        Item item = remainingItems.get(cell);
        if (item == null) {
            return false;
        }
        if (item.isMain() && grid.isMainBlockPresent()) {
            log.debug("Main item at {} is locked until the main block is destroyed", cell);
            return false;
        }

        remainingItems.remove(cell);
        if (item.isMain()) {
            mainItemCollected = true;
            log.info("Main item collected at {}", cell);
        }
        return true;
    }

    public Collection<Item> getRemainingItems() {
        return Collections.unmodifiableCollection(remainingItems.values());
    }

    /**
     * The level is cleared once the main item has been collected.
     */
    public boolean isComplete() {
        return mainItemCollected;
    }

    /**
     * Stop tracking grid changes. The session must not be used afterwards.
     */
    public void close() {
        navigationGraph.detach();
    }
}
