package com.neuroscape.navigation;

import com.neuroscape.grid.GridPoint;
import com.neuroscape.grid.Obstacle;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Tests for EdgeCostModel weights.
 */
public class EdgeCostModelTest {

    private static final double DELTA = 1e-9;

    private final EdgeCostModel model = new EdgeCostModel(10, 0.1);

    @Test
    public void testWeightInto_EmptyCellCostsOne() {
        assertEquals(1.0, model.weightInto(null), DELTA);
    }

    @Test
    public void testWeightInto_DestructibleScalesWithHitsNeeded() {
        assertEquals(1.2, model.weightInto(Obstacle.destructible(GridPoint.of(0, 0), 20)), DELTA);
        assertEquals("15 health needs two hits", 1.2, model.weightInto(Obstacle.destructible(GridPoint.of(0, 0), 15)), DELTA);
        assertEquals(1.3, model.weightInto(Obstacle.destructible(GridPoint.of(0, 0), 25)), DELTA);
        assertEquals(1.4, model.weightInto(Obstacle.mainBlock(GridPoint.of(0, 0), 40)), DELTA);
    }

    @Test
    public void testWeightInto_DestructibleAlwaysMoreThanEmpty() {
        for (int health = 1; health <= 100; health++) {
            assertTrue("Weight at health " + health, model.destructibleWeight(health) > 1.0);
        }
    }

    @Test
    public void testWeightInto_IndestructibleIsInfinite() {
        assertEquals(Double.POSITIVE_INFINITY, model.weightInto(Obstacle.indestructible(GridPoint.of(0, 0))), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConstructor_ZeroBreakFactorThrows() {
        new EdgeCostModel(10, 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConstructor_ZeroBreakUnitThrows() {
        new EdgeCostModel(0, 0.1);
    }
}
