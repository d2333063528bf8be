package com.neuroscape.grid;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative obstacle state of one level.
 *
 * <p>Obstacles live in a flat arena of {@code size * size} slots indexed by
 * {@code y * size + x}, so lookups need no hashing and a bounds check is a single
 * range comparison on the index. The remaining destructible count (main block
 * included) is maintained incrementally on every placement and removal.
 *
 * <p>Every change is reported to registered {@link ObstacleChangeListener}s, which is
 * how the navigation graph learns that it has gone stale.
 */
@Slf4j
public class ObstacleGrid {

    @Getter
    private final int size;

    private final Obstacle[] cells;

    private final List<ObstacleChangeListener> listeners = new ArrayList<>();

    @Getter
    private int obstacleCount;

    @Getter
    private int remainingDestructibleCount;

    public ObstacleGrid(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Grid size must be positive, got " + size);
        }
        this.size = size;
        this.cells = new Obstacle[size * size];
    }

    // ========================================================================
    // Coordinates
    // ========================================================================

    public int getCellCount() {
        return cells.length;
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && x < size && y >= 0 && y < size;
    }

    public boolean inBounds(GridPoint point) {
        return point != null && inBounds(point.getX(), point.getY());
    }

    /**
     * Flat arena index of an in-bounds cell.
     */
    public int indexOf(int x, int y) {
        return y * size + x;
    }

    public int indexOf(GridPoint point) {
        return indexOf(point.getX(), point.getY());
    }

    public GridPoint pointAt(int index) {
        return GridPoint.of(index % size, index / size);
    }

    // ========================================================================
    // Queries
    // ========================================================================

    /**
     * Get the obstacle at a cell.
     *
     * @param point the cell
     * @return the obstacle, or null if the cell is empty or out of bounds
     */
    @Nullable
    public Obstacle get(GridPoint point) {
        if (!inBounds(point)) {
            return null;
        }
        return cells[indexOf(point)];
    }

    @Nullable
    public Obstacle getByIndex(int index) {
        return cells[index];
    }

    /**
     * Type of a cell. Out-of-bounds cells report {@link ObstacleType#INDESTRUCTIBLE},
     * matching how movement treats the grid boundary.
     */
    public ObstacleType typeAt(GridPoint point) {
        if (!inBounds(point)) {
            return ObstacleType.INDESTRUCTIBLE;
        }
        Obstacle obstacle = cells[indexOf(point)];
        return obstacle == null ? ObstacleType.EMPTY : obstacle.getType();
    }

    public boolean isOccupied(GridPoint point) {
        return get(point) != null;
    }

    public Optional<Obstacle> findMainBlock() {
        for (Obstacle obstacle : cells) {
            if (obstacle != null && obstacle.isMainBlock()) {
                return Optional.of(obstacle);
            }
        }
        return Optional.empty();
    }

    public boolean isMainBlockPresent() {
        return findMainBlock().isPresent();
    }

    /**
     * All obstacles in arena order (row by row).
     */
    public List<Obstacle> obstacles() {
        List<Obstacle> result = new ArrayList<>(obstacleCount);
        for (Obstacle obstacle : cells) {
            if (obstacle != null) {
                result.add(obstacle);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Deep copy of the current obstacle state. Listeners are not copied, so changes to the
     * copy and to this grid are invisible to each other.
     */
    public ObstacleGrid copy() {
        ObstacleGrid copy = new ObstacleGrid(size);
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] != null) {
                copy.cells[i] = cells[i].copy();
            }
        }
        copy.obstacleCount = obstacleCount;
        copy.remainingDestructibleCount = remainingDestructibleCount;
        return copy;
    }

    // ========================================================================
    // Mutation
    // ========================================================================

    /**
     * Place an obstacle on its cell.
     *
     * @param obstacle the obstacle
     * @throws IllegalArgumentException if the cell is out of bounds
     * @throws IllegalStateException    if the cell is already occupied, or a second main block is placed
     */
    public void place(Obstacle obstacle) {
        GridPoint point = obstacle.getPosition();
        if (!inBounds(point)) {
            throw new IllegalArgumentException("Obstacle outside grid: " + obstacle);
        }
        int index = indexOf(point);
        if (cells[index] != null) {
            throw new IllegalStateException("Cell " + point + " already holds " + cells[index]);
        }
        if (obstacle.isMainBlock() && isMainBlockPresent()) {
            throw new IllegalStateException("Grid already has a main block");
        }

        cells[index] = obstacle;
        obstacleCount++;
        if (obstacle.isDestructible()) {
            remainingDestructibleCount++;
        }
        for (ObstacleChangeListener listener : listeners) {
            listener.onObstaclePlaced(obstacle);
        }
    }

    /**
     * Remove whatever obstacle occupies a cell.
     *
     * @param point the cell
     * @return the removed obstacle, or null if there was none
     */
    @Nullable
    public Obstacle remove(GridPoint point) {
        if (!inBounds(point)) {
            return null;
        }
        int index = indexOf(point);
        Obstacle removed = cells[index];
        if (removed == null) {
            return null;
        }

        cells[index] = null;
        obstacleCount--;
        if (removed.isDestructible()) {
            remainingDestructibleCount--;
        }
        for (ObstacleChangeListener listener : listeners) {
            listener.onObstacleRemoved(removed);
        }
        return removed;
    }

    /**
     * Apply damage to the destructible obstacle at a cell.
     *
     * <p>When health first reaches zero the obstacle is removed in the same call, so
     * the destroyed transition happens exactly once. Empty, indestructible and
     * out-of-bounds cells, and non-positive amounts, are ignored.
     *
     * @param point  the cell that was hit
     * @param amount damage dealt
     * @return what happened
     */
    public DamageOutcome damage(GridPoint point, int amount) {
        Obstacle obstacle = get(point);
        if (obstacle == null || !obstacle.isDestructible() || amount <= 0) {
            return DamageOutcome.IGNORED;
        }

        if (obstacle.applyDamage(amount)) {
            remove(point);
            log.debug("Obstacle destroyed at {} ({} destructibles left)", point, remainingDestructibleCount);
            return DamageOutcome.DESTROYED;
        }

        for (ObstacleChangeListener listener : listeners) {
            listener.onObstacleDamaged(obstacle);
        }
        return DamageOutcome.DAMAGED;
    }

    // ========================================================================
    // Listeners
    // ========================================================================

    public void addListener(ObstacleChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ObstacleChangeListener listener) {
        listeners.remove(listener);
    }
}
