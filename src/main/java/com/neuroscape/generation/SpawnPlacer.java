package com.neuroscape.generation;

import com.neuroscape.grid.GridPoint;
import com.neuroscape.util.Randomization;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rejection sampler for the player and enemy spawn cells.
 *
 * <p>Each attempt draws {@code 1 + enemyCount} distinct candidate cells; the first is the
 * player. An attempt is accepted when every enemy is at least the minimum Manhattan
 * distance from the player and at least one interior cell stays free for the goal.
 * Attempts are bounded; running out yields an empty result instead of looping forever.
 */
@Slf4j
public class SpawnPlacer {

    private final Randomization randomization;
    private final int minSpawnDistance;
    private final int maxAttempts;

    public SpawnPlacer(Randomization randomization, int minSpawnDistance, int maxAttempts) {
        this.randomization = randomization;
        this.minSpawnDistance = minSpawnDistance;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Sample a spawn layout.
     *
     * @param candidates cells spawns may occupy (corners already excluded)
     * @param enemyCount number of enemy spawns; must leave room in {@code candidates}
     * @param gridSize   side length of the grid, used to tell interior cells apart
     * @return the accepted layout, or empty if no attempt was accepted
     */
    public Optional<SpawnLayout> place(List<GridPoint> candidates, int enemyCount, int gridSize) {
        if (candidates.size() < enemyCount + 1) {
            return Optional.empty();
        }
        int interiorCandidates = countInterior(candidates, gridSize);

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            List<GridPoint> picks = randomization.sample(candidates, enemyCount + 1);
            GridPoint player = picks.get(0);
            List<GridPoint> enemies = picks.subList(1, picks.size());

            if (isAccepted(player, enemies, interiorCandidates, gridSize)) {
                log.debug("Spawn layout accepted after {} attempt(s): player={}, enemies={}",
                        attempt, player, enemies);
                return Optional.of(new SpawnLayout(player, List.copyOf(enemies)));
            }
        }
        log.debug("No spawn layout accepted in {} attempts (enemies={}, minDistance={})",
                maxAttempts, enemyCount, minSpawnDistance);
        return Optional.empty();
    }

    private boolean isAccepted(GridPoint player, List<GridPoint> enemies, int interiorCandidates, int gridSize) {
        for (GridPoint enemy : enemies) {
            if (player.manhattanDistance(enemy) < minSpawnDistance) {
                return false;
            }
        }
        Set<GridPoint> spawns = new HashSet<>(enemies);
        spawns.add(player);
        return interiorCandidates - countInterior(spawns, gridSize) > 0;
    }

    private static int countInterior(Iterable<GridPoint> cells, int gridSize) {
        int count = 0;
        for (GridPoint cell : cells) {
            if (!cell.isOnOuterRing(gridSize)) {
                count++;
            }
        }
        return count;
    }
}
