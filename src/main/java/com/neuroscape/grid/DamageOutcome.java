package com.neuroscape.grid;

/**
 * Result of applying damage to a cell.
 */
public enum DamageOutcome {
    /** Nothing destructible at the cell (empty, indestructible, out of bounds) or no damage. */
    IGNORED,
    /** Health reduced, obstacle still standing. */
    DAMAGED,
    /** Health reached zero; the obstacle has been removed. */
    DESTROYED
}
