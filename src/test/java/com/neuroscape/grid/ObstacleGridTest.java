package com.neuroscape.grid;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for ObstacleGrid placement, damage and change notification.
 */
public class ObstacleGridTest {

    private ObstacleGrid grid;

    @Before
    public void setUp() {
        grid = GridFixtures.parse(
                ".....",
                ".#D..",
                "..M..",
                ".....",
                "....D");
    }

    // ========================================================================
    // Coordinates and queries
    // ========================================================================

    @Test
    public void testIndexOf_RoundTripsThroughPointAt() {
        GridPoint point = GridPoint.of(3, 4);
        assertEquals(23, grid.indexOf(point));
        assertEquals(point, grid.pointAt(23));
    }

    @Test
    public void testTypeAt_ReportsEveryVariant() {
        assertEquals(ObstacleType.EMPTY, grid.typeAt(GridPoint.of(0, 0)));
        assertEquals(ObstacleType.INDESTRUCTIBLE, grid.typeAt(GridPoint.of(1, 1)));
        assertEquals(ObstacleType.DESTRUCTIBLE, grid.typeAt(GridPoint.of(2, 1)));
        assertEquals(ObstacleType.MAIN_BLOCK, grid.typeAt(GridPoint.of(2, 2)));
    }

    @Test
    public void testTypeAt_OutOfBoundsIsIndestructible() {
        assertEquals(ObstacleType.INDESTRUCTIBLE, grid.typeAt(GridPoint.of(-1, 0)));
        assertEquals(ObstacleType.INDESTRUCTIBLE, grid.typeAt(GridPoint.of(0, 5)));
        assertNull(grid.get(GridPoint.of(7, 7)));
    }

    @Test
    public void testCounters_MainBlockCountsAsDestructible() {
        assertEquals(4, grid.getObstacleCount());
        assertEquals(3, grid.getRemainingDestructibleCount());
        assertTrue(grid.isMainBlockPresent());
    }

    @Test
    public void testObstacles_InArenaOrder() {
        assertEquals(4, grid.obstacles().size());
        assertEquals(GridPoint.of(1, 1), grid.obstacles().get(0).getPosition());
        assertEquals(GridPoint.of(4, 4), grid.obstacles().get(3).getPosition());
    }

    // ========================================================================
    // Placement
    // ========================================================================

    @Test(expected = IllegalStateException.class)
    public void testPlace_OccupiedCellThrows() {
        grid.place(Obstacle.indestructible(GridPoint.of(2, 1)));
    }

    @Test(expected = IllegalStateException.class)
    public void testPlace_SecondMainBlockThrows() {
        grid.place(Obstacle.mainBlock(GridPoint.of(0, 0), 10));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPlace_OutOfBoundsThrows() {
        grid.place(Obstacle.indestructible(GridPoint.of(5, 0)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDestructible_NonPositiveHealthThrows() {
        Obstacle.destructible(GridPoint.of(0, 0), 0);
    }

    // ========================================================================
    // Damage
    // ========================================================================

    @Test
    public void testDamage_NonLethalReducesHealth() {
        DamageOutcome outcome = grid.damage(GridPoint.of(2, 1), 5);

        assertEquals(DamageOutcome.DAMAGED, outcome);
        assertEquals(15, grid.get(GridPoint.of(2, 1)).getHealth());
        assertEquals(3, grid.getRemainingDestructibleCount());
    }

    @Test
    public void testDamage_LethalRemovesObstacleOnce() {
        Obstacle obstacle = grid.get(GridPoint.of(2, 1));

        DamageOutcome outcome = grid.damage(GridPoint.of(2, 1), 500);

        assertEquals(DamageOutcome.DESTROYED, outcome);
        assertEquals("Health is clamped, never negative", 0, obstacle.getHealth());
        assertTrue(obstacle.isDestroyed());
        assertFalse(grid.isOccupied(GridPoint.of(2, 1)));
        assertEquals(2, grid.getRemainingDestructibleCount());

        assertEquals("A destroyed cell ignores further damage",
                DamageOutcome.IGNORED, grid.damage(GridPoint.of(2, 1), 10));
        assertEquals(2, grid.getRemainingDestructibleCount());
    }

    @Test
    public void testDamage_ExactHealthDestroys() {
        assertEquals(DamageOutcome.DAMAGED, grid.damage(GridPoint.of(4, 4), 10));
        assertEquals(DamageOutcome.DESTROYED, grid.damage(GridPoint.of(4, 4), 10));
    }

    @Test
    public void testDamage_IgnoredCases() {
        assertEquals(DamageOutcome.IGNORED, grid.damage(GridPoint.of(0, 0), 10));
        assertEquals(DamageOutcome.IGNORED, grid.damage(GridPoint.of(1, 1), 10));
        assertEquals(DamageOutcome.IGNORED, grid.damage(GridPoint.of(-3, 2), 10));
        assertEquals(DamageOutcome.IGNORED, grid.damage(GridPoint.of(2, 1), 0));
        assertEquals(DamageOutcome.IGNORED, grid.damage(GridPoint.of(2, 1), -4));

        assertEquals(20, grid.get(GridPoint.of(2, 1)).getHealth());
        assertTrue("Indestructible obstacle must survive", grid.isOccupied(GridPoint.of(1, 1)));
    }

    @Test
    public void testDamage_MainBlockCanBeDestroyed() {
        assertEquals(DamageOutcome.DESTROYED, grid.damage(GridPoint.of(2, 2), GridFixtures.MAIN_BLOCK_HEALTH));
        assertFalse(grid.isMainBlockPresent());
    }

    // ========================================================================
    // Listeners
    // ========================================================================

    @Test
    public void testListeners_NotifiedPerChange() {
        ObstacleChangeListener listener = mock(ObstacleChangeListener.class);
        grid.addListener(listener);

        grid.damage(GridPoint.of(2, 1), 5);
        grid.damage(GridPoint.of(2, 1), 15);
        grid.place(Obstacle.indestructible(GridPoint.of(0, 0)));

        verify(listener, times(1)).onObstacleDamaged(any(Obstacle.class));
        verify(listener, times(1)).onObstacleRemoved(any(Obstacle.class));
        verify(listener, times(1)).onObstaclePlaced(any(Obstacle.class));
    }

    @Test
    public void testRemoveListener_StopsNotifications() {
        ObstacleChangeListener listener = mock(ObstacleChangeListener.class);
        grid.addListener(listener);
        grid.removeListener(listener);

        grid.remove(GridPoint.of(1, 1));

        verifyNoInteractions(listener);
    }

    // ========================================================================
    // Copy
    // ========================================================================

    @Test
    public void testCopy_CarriesHealthAndCounters() {
        grid.damage(GridPoint.of(2, 1), 5);

        ObstacleGrid copy = grid.copy();

        assertEquals(4, copy.getObstacleCount());
        assertEquals(3, copy.getRemainingDestructibleCount());
        assertTrue(copy.isMainBlockPresent());
        assertEquals(15, copy.get(GridPoint.of(2, 1)).getHealth());
        assertNotSame(grid.get(GridPoint.of(2, 1)), copy.get(GridPoint.of(2, 1)));
    }

    @Test
    public void testCopy_ChangesDoNotLeakEitherWay() {
        ObstacleChangeListener listener = mock(ObstacleChangeListener.class);
        grid.addListener(listener);
        ObstacleGrid copy = grid.copy();

        assertEquals(DamageOutcome.DESTROYED, copy.damage(GridPoint.of(2, 2), GridFixtures.MAIN_BLOCK_HEALTH));
        grid.remove(GridPoint.of(4, 4));

        assertTrue("Original keeps its main block", grid.isMainBlockPresent());
        assertEquals(GridFixtures.MAIN_BLOCK_HEALTH, grid.get(GridPoint.of(2, 2)).getHealth());
        assertTrue("Copy keeps the obstacle removed from the original", copy.isOccupied(GridPoint.of(4, 4)));
        assertEquals(2, copy.getRemainingDestructibleCount());
        verify(listener, never()).onObstacleDamaged(any(Obstacle.class));
        verify(listener, times(1)).onObstacleRemoved(any(Obstacle.class));
    }
}
