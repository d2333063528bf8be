package com.neuroscape.grid;

/**
 * The state a grid cell can be in.
 *
 * <p>{@link #MAIN_BLOCK} is a destructible variant that additionally gates the
 * level's goal item until it has been cleared.
 */
public enum ObstacleType {

    /**
     * Free floor. Never stored in an {@link ObstacleGrid}; reported for unoccupied cells.
     */
    EMPTY,

    /**
     * Permanent wall. No graph edge ever leads into it.
     */
    INDESTRUCTIBLE,

    /**
     * Breakable block with health. Traversable at an inflated cost.
     */
    DESTRUCTIBLE,

    /**
     * Breakable block sitting on the goal cell.
     */
    MAIN_BLOCK;

    /**
     * Check if agents can path into a cell of this type (possibly by breaking through).
     *
     * @return false only for {@link #INDESTRUCTIBLE}
     */
    public boolean isTraversable() {
        switch (this) {
            case EMPTY:
            case DESTRUCTIBLE:
            case MAIN_BLOCK:
                return true;
            case INDESTRUCTIBLE:
                return false;
            default:
                throw new IllegalStateException("Unhandled obstacle type: " + this);
        }
    }

    /**
     * Check if cells of this type carry health and can be destroyed by damage.
     *
     * @return true for {@link #DESTRUCTIBLE} and {@link #MAIN_BLOCK}
     */
    public boolean isDestructible() {
        switch (this) {
            case DESTRUCTIBLE:
            case MAIN_BLOCK:
                return true;
            case EMPTY:
            case INDESTRUCTIBLE:
                return false;
            default:
                throw new IllegalStateException("Unhandled obstacle type: " + this);
        }
    }
}
