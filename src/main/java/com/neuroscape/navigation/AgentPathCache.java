package com.neuroscape.navigation;

import com.neuroscape.grid.GridPoint;
import lombok.Getter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-agent cache of the last computed path.
 *
 * <p>Agents do not search every simulation step. A cached path is reused until one of
 * the following happens:
 * <ul>
 *   <li>the agent asks for a different start or goal</li>
 *   <li>the navigation graph version advanced (rebuild or weight patch)</li>
 *   <li>{@link #getRequeryIntervalTicks()} ticks passed since the path was computed</li>
 * </ul>
 *
 * <p>This bounds search cost when many agents share one level.
 *
 * <p>There is one entry per agent id; a new start or goal replaces the agent's entry.
 * Entries are only dropped by {@link #invalidate(String)} or {@link #clear()}, so callers
 * must invalidate agents that leave the level.
 */
@Slf4j
public class AgentPathCache {

    public static final int DEFAULT_REQUERY_INTERVAL_TICKS = 30;

    private final NavigationGraph navigationGraph;

    @Getter
    private final int requeryIntervalTicks;

    private final Map<String, CachedPathResult> cache = new HashMap<>();

    @Value
    private static class CachedPathResult {
        PathResult result;
        long graphVersion;
        long tick;
    }

    public AgentPathCache(NavigationGraph navigationGraph) {
        this(navigationGraph, DEFAULT_REQUERY_INTERVAL_TICKS);
    }

    public AgentPathCache(NavigationGraph navigationGraph, int requeryIntervalTicks) {
        if (requeryIntervalTicks <= 0) {
            throw new IllegalArgumentException("Requery interval must be positive, got " + requeryIntervalTicks);
        }
        this.navigationGraph = navigationGraph;
        this.requeryIntervalTicks = requeryIntervalTicks;
    }

    /**
     * Get the agent's path, recomputing it only when the cached one is stale.
     *
     * @param agentId     stable identifier of the agent
     * @param start       the agent's current cell
     * @param goal        where the agent wants to go
     * @param currentTick the simulation tick of the query
     * @return the path result
     */
    public PathResult getPath(String agentId, GridPoint start, GridPoint goal, long currentTick) {
        // Rebuild first so a dirty graph is reflected in the version we compare against
        navigationGraph.getGraph();

        CachedPathResult cached = cache.get(agentId);
        if (cached != null && !isStale(cached, start, goal, currentTick)) {
            return cached.result;
        }

        PathResult result = navigationGraph.findPath(start, goal);
        cache.put(agentId, new CachedPathResult(result, navigationGraph.getVersion(), currentTick));
        log.trace("Agent {} re-queried path {} -> {} at tick {}: {}",
                agentId, start, goal, currentTick, result.getStatus());
        return result;
    }

    /**
     * Get whatever path is cached for an agent without recomputing.
     */
    public Optional<PathResult> getCached(String agentId) {
        CachedPathResult cached = cache.get(agentId);
        return cached == null ? Optional.empty() : Optional.of(cached.result);
    }

    public void invalidate(String agentId) {
        cache.remove(agentId);
    }

    public void clear() {
        int size = cache.size();
        cache.clear();
        log.debug("Agent path cache cleared ({} entries)", size);
    }

    public int getCacheSize() {
        return cache.size();
    }

    private boolean isStale(CachedPathResult cached, GridPoint start, GridPoint goal, long currentTick) {
        if (!Objects.equals(cached.result.getStart(), start) || !Objects.equals(cached.result.getGoal(), goal)) {
            return true;
        }
        if (cached.graphVersion != navigationGraph.getVersion()) {
            return true;
        }
        return currentTick - cached.tick >= requeryIntervalTicks;
    }
}
