package com.neuroscape.navigation;

import com.neuroscape.grid.GridPoint;
import com.neuroscape.grid.Obstacle;
import com.neuroscape.grid.ObstacleChangeListener;
import com.neuroscape.grid.ObstacleGrid;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Live navigation graph of one level, rebuilt lazily behind an explicit dirty flag.
 *
 * <p>Placing or removing an obstacle only sets the flag; the adjacency is rebuilt on the
 * next {@link #getGraph()} or {@link #findPath} call. Several obstacles destroyed between
 * two path queries therefore cost a single rebuild. Non-lethal damage does not change
 * topology, so instead of a rebuild the inflated weights of the edges into the damaged
 * cell are patched in place.
 *
 * <p>{@link #getVersion()} increases with every rebuild and weight patch; agents compare it
 * with the version their cached path was computed against.
 */
@Slf4j
public class NavigationGraph implements ObstacleChangeListener {

    private final ObstacleGrid grid;
    private final EdgeCostModel costModel;
    private final GraphBuilder graphBuilder;
    private final PathFinder pathFinder;

    private GridGraph cachedGraph;

    @Getter
    private boolean dirty = true;

    @Getter
    private long version;

    @Getter
    private int rebuildCount;

    /**
     * Create a navigation graph and subscribe it to changes of the grid.
     */
    public NavigationGraph(ObstacleGrid grid, EdgeCostModel costModel,
                           GraphBuilder graphBuilder, PathFinder pathFinder) {
        this.grid = grid;
        this.costModel = costModel;
        this.graphBuilder = graphBuilder;
        this.pathFinder = pathFinder;
        grid.addListener(this);
    }

    /**
     * Get the current graph, rebuilding it first if the dirty flag is set.
     */
    public GridGraph getGraph() {
        if (!dirty && cachedGraph != null) {
            return cachedGraph;
        }
        return rebuild();
    }

    /**
     * Force a rebuild regardless of the dirty flag.
     */
    public GridGraph rebuild() {
        long startTime = System.nanoTime();

        cachedGraph = graphBuilder.build(grid, costModel);
        dirty = false;
        version++;
        rebuildCount++;

        long elapsed = System.nanoTime() - startTime;
        if (elapsed > 1_000_000) { // > 1ms
            log.debug("Navigation graph rebuild #{} took {}ms", rebuildCount, elapsed / 1_000_000.0);
        }
        return cachedGraph;
    }

    /**
     * Mark the cached graph stale so the next query rebuilds it.
     */
    public void markDirty() {
        if (!dirty) {
            log.trace("Navigation graph marked dirty");
        }
        dirty = true;
    }

    public PathResult findPath(GridPoint start, GridPoint goal) {
        return pathFinder.findPath(getGraph(), start, goal);
    }

    public EdgeCostModel getCostModel() {
        return costModel;
    }

    /**
     * Stop listening to the grid. The graph keeps answering from its last state.
     */
    public void detach() {
        grid.removeListener(this);
    }

    // ========================================================================
    // ObstacleChangeListener
    // ========================================================================

    @Override
    public void onObstaclePlaced(Obstacle obstacle) {
        markDirty();
    }

    @Override
    public void onObstacleRemoved(Obstacle obstacle) {
        markDirty();
    }

    @Override
    public void onObstacleDamaged(Obstacle obstacle) {
        if (dirty || cachedGraph == null) {
            // The pending rebuild will read the new health anyway
            return;
        }
        int target = cachedGraph.indexOf(obstacle.getPosition());
        double weight = costModel.weightInto(obstacle);
        int updated = cachedGraph.updateIncomingWeights(target, weight);
        version++;
        log.trace("Patched {} edge weights into {} to {}", updated, obstacle.getPosition(), weight);
    }
}
