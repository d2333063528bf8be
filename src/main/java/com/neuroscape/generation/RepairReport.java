package com.neuroscape.generation;

import lombok.Builder;
import lombok.Value;

/**
 * What connectivity repair did to a level.
 */
@Value
@Builder
public class RepairReport {

    /**
     * Report for a level that skipped repair.
     */
    public static final RepairReport SKIPPED = RepairReport.builder()
            .performed(false)
            .fullyConnected(false)
            .build();

    /** Whether repair ran at all. */
    boolean performed;

    /** Every non-indestructible cell is reachable from the player spawn. */
    boolean fullyConnected;

    /** Corridors carved, cross and random corridors included. */
    int corridorsCarved;

    /** Obstacles removed by carving. */
    int obstaclesCleared;

    /** Probe destinations (exits and entities) that were unreachable before targeted carving. */
    int unreachableTargets;

    /** Reachability sweeps executed after targeted carving. */
    int sweepPasses;

    /** Non-indestructible cells still unreachable when repair finished. */
    int unreachableCells;
}
