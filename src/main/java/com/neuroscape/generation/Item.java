package com.neuroscape.generation;

import com.neuroscape.grid.GridPoint;
import lombok.Value;

/**
 * A collectible placed on the grid. Exactly one item per level is the main item, which
 * sits on the goal cell under the main block.
 */
@Value
public class Item {

    GridPoint position;

    boolean main;

    public static Item ordinary(GridPoint position) {
        return new Item(position, false);
    }

    public static Item main(GridPoint position) {
        return new Item(position, true);
    }
}
