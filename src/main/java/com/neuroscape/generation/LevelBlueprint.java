package com.neuroscape.generation;

import com.neuroscape.grid.GridPoint;
import com.neuroscape.grid.ObstacleGrid;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A generated level: spawns, obstacles, items and the goal.
 *
 * <p>The obstacle grid is the live, mutable part. Connectivity repair carves it before the
 * blueprint is handed out, and a {@code LevelState} session mutates it afterwards through
 * damage only.
 */
@Getter
public class LevelBlueprint {

    private final LevelParameters parameters;
    private final GridPoint playerSpawn;
    private final List<GridPoint> enemySpawns;
    private final ObstacleGrid obstacleGrid;
    private final List<Item> items;
    private final GridPoint goal;

    @Setter(AccessLevel.PACKAGE)
    private RepairReport repairReport = RepairReport.SKIPPED;

    public LevelBlueprint(LevelParameters parameters, GridPoint playerSpawn, List<GridPoint> enemySpawns,
                          ObstacleGrid obstacleGrid, List<Item> items, GridPoint goal) {
        this.parameters = parameters;
        this.playerSpawn = playerSpawn;
        this.enemySpawns = Collections.unmodifiableList(new ArrayList<>(enemySpawns));
        this.obstacleGrid = obstacleGrid;
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
        this.goal = goal;
    }

    public int getGridSize() {
        return obstacleGrid.getSize();
    }

    public int getRemainingDestructibleCount() {
        return obstacleGrid.getRemainingDestructibleCount();
    }

    /**
     * The item bound to the goal cell.
     *
     * @throws IllegalStateException if the blueprint has no main item
     */
    public Item getMainItem() {
        for (Item item : items) {
            if (item.isMain()) {
                return item;
            }
        }
        throw new IllegalStateException("Blueprint has no main item");
    }

    /**
     * Cells holding the player, enemies and items, in that order, without duplicates.
     */
    public Set<GridPoint> entityCells() {
        Set<GridPoint> cells = new LinkedHashSet<>();
        cells.add(playerSpawn);
        cells.addAll(enemySpawns);
        for (Item item : items) {
            cells.add(item.getPosition());
        }
        return cells;
    }

    @Override
    public String toString() {
        return "LevelBlueprint{size=" + getGridSize()
                + ", player=" + playerSpawn
                + ", enemies=" + enemySpawns.size()
                + ", obstacles=" + obstacleGrid.getObstacleCount()
                + ", items=" + items.size()
                + ", goal=" + goal
                + ", connected=" + repairReport.isFullyConnected() + "}";
    }
}
