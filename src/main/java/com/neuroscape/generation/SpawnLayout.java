package com.neuroscape.generation;

import com.neuroscape.grid.GridPoint;
import lombok.Value;

import java.util.List;

/**
 * Accepted player and enemy spawn cells.
 */
@Value
public class SpawnLayout {

    GridPoint playerSpawn;

    List<GridPoint> enemySpawns;
}
