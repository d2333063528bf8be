package com.neuroscape.grid;

import lombok.Getter;

/**
 * An obstacle occupying one grid cell.
 *
 * <p>Health only changes through {@link ObstacleGrid#damage(GridPoint, int)}; the
 * mutators here are package-private so no other component can alter obstacle state.
 */
@Getter
public class Obstacle {

    private final GridPoint position;
    private final ObstacleType type;
    private final int maxHealth;
    private int health;
    private boolean destroyed;

    private Obstacle(GridPoint position, ObstacleType type, int health) {
        if (type == ObstacleType.EMPTY) {
            throw new IllegalArgumentException("EMPTY is not an obstacle");
        }
        if (type.isDestructible() && health <= 0) {
            throw new IllegalArgumentException("Destructible obstacle needs positive health, got " + health);
        }
        this.position = position;
        this.type = type;
        this.maxHealth = type.isDestructible() ? health : 0;
        this.health = this.maxHealth;
    }

    public static Obstacle indestructible(GridPoint position) {
        return new Obstacle(position, ObstacleType.INDESTRUCTIBLE, 0);
    }

    public static Obstacle destructible(GridPoint position, int health) {
        return new Obstacle(position, ObstacleType.DESTRUCTIBLE, health);
    }

    public static Obstacle mainBlock(GridPoint position, int health) {
        return new Obstacle(position, ObstacleType.MAIN_BLOCK, health);
    }

    public boolean isMainBlock() {
        return type == ObstacleType.MAIN_BLOCK;
    }

    public boolean isDestructible() {
        return type.isDestructible();
    }

    /**
     * Subtract damage, clamping health at zero.
     *
     * @param amount positive damage
     * @return true only on the call that takes health from above zero to zero
     */
    boolean applyDamage(int amount) {
        if (!type.isDestructible() || destroyed || amount <= 0) {
            return false;
        }
        health = Math.max(0, health - amount);
        if (health == 0) {
            destroyed = true;
            return true;
        }
        return false;
    }

    /**
     * Independent copy carrying the current health.
     */
    Obstacle copy() {
        Obstacle copy = new Obstacle(position, type, type.isDestructible() ? maxHealth : 0);
        copy.health = health;
        copy.destroyed = destroyed;
        return copy;
    }

    @Override
    public String toString() {
        if (type.isDestructible()) {
            return type + "@" + position + "[" + health + "/" + maxHealth + "]";
        }
        return type + "@" + position;
    }
}
