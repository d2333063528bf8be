package com.neuroscape.navigation;

import com.neuroscape.grid.Obstacle;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * Traversal cost of stepping into a cell.
 *
 * <p>Entering an empty cell costs exactly 1. Entering a destructible cell costs
 * {@code 1 + ceil(health / breakUnit) * breakFactor}: the number of hits an attacker
 * needs, scaled by how strongly durability should push routes around the block
 * rather than through it. Indestructible cells have no edge at all.
 */
@Value
public class EdgeCostModel {

    public static final double EMPTY_COST = 1.0;

    /** Per-hit damage dealt by the attacking agent. */
    int breakUnit;

    /** Extra cost per required hit. */
    double breakFactor;

    public EdgeCostModel(int breakUnit, double breakFactor) {
        if (breakUnit <= 0) {
            throw new IllegalArgumentException("breakUnit must be positive, got " + breakUnit);
        }
        if (!(breakFactor > 0)) {
            throw new IllegalArgumentException("breakFactor must be positive, got " + breakFactor);
        }
        this.breakUnit = breakUnit;
        this.breakFactor = breakFactor;
    }

    /**
     * Weight of any edge whose target holds the given obstacle.
     *
     * @param target obstacle in the target cell, or null for an empty cell
     * @return the weight, {@link Double#POSITIVE_INFINITY} when the cell cannot be entered
     */
    public double weightInto(@Nullable Obstacle target) {
        if (target == null) {
            return EMPTY_COST;
        }
        switch (target.getType()) {
            case EMPTY:
                return EMPTY_COST;
            case DESTRUCTIBLE:
            case MAIN_BLOCK:
                return destructibleWeight(target.getHealth());
            case INDESTRUCTIBLE:
                return Double.POSITIVE_INFINITY;
            default:
                throw new IllegalStateException("Unhandled obstacle type: " + target.getType());
        }
    }

    /**
     * Weight into a destructible cell with the given remaining health.
     */
    public double destructibleWeight(int health) {
        int hits = (int) Math.ceil(health / (double) breakUnit);
        return EMPTY_COST + hits * breakFactor;
    }
}
