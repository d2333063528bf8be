package com.neuroscape.navigation;

import com.neuroscape.grid.GridFixtures;
import com.neuroscape.grid.GridPoint;
import com.neuroscape.grid.Obstacle;
import com.neuroscape.grid.ObstacleGrid;
import com.neuroscape.grid.ObstacleType;
import org.junit.Before;
import org.junit.Test;

import java.util.Optional;

import static org.junit.Assert.*;

/**
 * Tests for CollisionChecker occupancy and line-of-sight queries.
 */
public class CollisionCheckerTest {

    private CollisionChecker collisionChecker;
    private ObstacleGrid grid;

    @Before
    public void setUp() {
        collisionChecker = new CollisionChecker();
        grid = GridFixtures.parse(
                "..D.#.",
                "......",
                "......",
                "...#..",
                "......",
                "......");
    }

    // ========================================================================
    // isBlocked
    // ========================================================================

    @Test
    public void testIsBlocked_EmptyCell_ReturnsFalse() {
        assertFalse(collisionChecker.isBlocked(grid, GridPoint.of(0, 0)));
    }

    @Test
    public void testIsBlocked_AnyObstacle_ReturnsTrue() {
        assertTrue("Destructible blocks occupancy", collisionChecker.isBlocked(grid, GridPoint.of(2, 0)));
        assertTrue(collisionChecker.isBlocked(grid, GridPoint.of(4, 0)));
    }

    @Test
    public void testIsBlocked_OutOfBounds_ReturnsTrue() {
        assertTrue(collisionChecker.isBlocked(grid, GridPoint.of(-1, 0)));
        assertTrue(collisionChecker.isBlocked(grid, GridPoint.of(0, 6)));
    }

    // ========================================================================
    // isClearWithRadius
    // ========================================================================

    @Test
    public void testIsClearWithRadius_UsesManhattanDistance() {
        GridPoint cell = GridPoint.of(2, 2);

        assertTrue("Wall at (3, 3) is two steps away", collisionChecker.isClearWithRadius(grid, cell, 1));
        assertFalse(collisionChecker.isClearWithRadius(grid, cell, 2));
    }

    @Test
    public void testIsClearWithRadius_ZeroChecksCentreOnly() {
        assertTrue(collisionChecker.isClearWithRadius(grid, GridPoint.of(3, 2), 0));
        assertFalse(collisionChecker.isClearWithRadius(grid, GridPoint.of(3, 3), 0));
    }

    @Test
    public void testIsClearWithRadius_GridEdgeIsNotAnObstacle() {
        assertTrue(collisionChecker.isClearWithRadius(grid, GridPoint.of(0, 5), 2));
    }

    @Test(timeout = 2000)
    public void testIsClearWithRadius_HugeRadiusCoversWholeGrid() {
        ObstacleGrid empty = new ObstacleGrid(6);
        assertTrue(collisionChecker.isClearWithRadius(empty, GridPoint.of(2, 2), 200_000));
        assertTrue(collisionChecker.isClearWithRadius(empty, GridPoint.of(2, 2), Integer.MAX_VALUE));

        assertFalse("Far corner wall is within reach",
                collisionChecker.isClearWithRadius(grid, GridPoint.of(0, 5), Integer.MAX_VALUE));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testIsClearWithRadius_NegativeRadiusThrows() {
        collisionChecker.isClearWithRadius(grid, GridPoint.of(1, 1), -1);
    }

    // ========================================================================
    // Line of sight
    // ========================================================================

    @Test
    public void testFirstObstacleOnLine_ReturnsNearest() {
        Optional<Obstacle> hit = collisionChecker.firstObstacleOnLine(grid, GridPoint.of(0, 0), GridPoint.of(5, 0));

        assertTrue(hit.isPresent());
        assertEquals(ObstacleType.DESTRUCTIBLE, hit.get().getType());
        assertEquals(GridPoint.of(2, 0), hit.get().getPosition());
        assertFalse(collisionChecker.hasLineOfSight(grid, GridPoint.of(0, 0), GridPoint.of(5, 0)));
    }

    @Test
    public void testFirstObstacleOnLine_ClearLine() {
        assertFalse(collisionChecker.firstObstacleOnLine(grid, GridPoint.of(0, 1), GridPoint.of(5, 1)).isPresent());
        assertTrue(collisionChecker.hasLineOfSight(grid, GridPoint.of(0, 5), GridPoint.of(5, 5)));
    }
}
