package com.neuroscape.navigation;

import com.neuroscape.grid.GridFixtures;
import com.neuroscape.grid.GridPoint;
import com.neuroscape.grid.Obstacle;
import com.neuroscape.grid.ObstacleGrid;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for NavigationGraph dirty-flag rebuilds and weight patching.
 */
public class NavigationGraphTest {

    private static final double DELTA = 1e-9;
    private static final GridPoint BLOCK = GridPoint.of(1, 2);

    private ObstacleGrid grid;
    private NavigationGraph navigationGraph;

    @Before
    public void setUp() {
        grid = GridFixtures.parse(
                ".#.",
                ".#.",
                ".D.");
        navigationGraph = new NavigationGraph(grid, new EdgeCostModel(10, 0.1), new GraphBuilder(), new PathFinder());
    }

    @Test
    public void testGetGraph_BuildsOnceUntilDirty() {
        assertTrue("New graph starts dirty", navigationGraph.isDirty());

        GridGraph first = navigationGraph.getGraph();
        GridGraph second = navigationGraph.getGraph();

        assertSame(first, second);
        assertFalse(navigationGraph.isDirty());
        assertEquals(1, navigationGraph.getRebuildCount());
    }

    @Test
    public void testDestruction_MarksDirtyAndCollapsesWeight() {
        PathResult before = navigationGraph.findPath(GridPoint.of(0, 0), GridPoint.of(2, 0));
        assertEquals(6.2, before.getTotalCost(), DELTA);

        grid.damage(BLOCK, GridFixtures.DESTRUCTIBLE_HEALTH);

        assertTrue("Destroying an obstacle marks the graph dirty", navigationGraph.isDirty());
        PathResult after = navigationGraph.findPath(GridPoint.of(0, 0), GridPoint.of(2, 0));
        assertEquals(6.0, after.getTotalCost(), DELTA);
        assertEquals(1.0, navigationGraph.getGraph().cost(GridPoint.of(0, 2), BLOCK), DELTA);
        assertEquals(2, navigationGraph.getRebuildCount());
    }

    @Test
    public void testSeveralChanges_SingleRebuild() {
        navigationGraph.getGraph();

        grid.damage(BLOCK, 100);
        grid.remove(GridPoint.of(1, 0));
        grid.place(Obstacle.indestructible(GridPoint.of(2, 2)));

        navigationGraph.getGraph();
        navigationGraph.getGraph();
        assertEquals("Changes between queries cost one rebuild", 2, navigationGraph.getRebuildCount());
    }

    @Test
    public void testNonLethalDamage_PatchesWeightsWithoutRebuild() {
        navigationGraph.getGraph();
        long versionBefore = navigationGraph.getVersion();

        grid.damage(BLOCK, 15);

        assertFalse("Non-lethal damage keeps topology", navigationGraph.isDirty());
        assertEquals(1, navigationGraph.getRebuildCount());
        assertTrue(navigationGraph.getVersion() > versionBefore);
        GridGraph graph = navigationGraph.getGraph();
        assertEquals("Five health left needs one hit", 1.1, graph.cost(GridPoint.of(0, 2), BLOCK), DELTA);
        assertEquals(1.1, graph.cost(GridPoint.of(2, 2), BLOCK), DELTA);
        assertEquals("Edges out of the block are unchanged", 1.0, graph.cost(BLOCK, GridPoint.of(0, 2)), DELTA);
    }

    @Test
    public void testPatchedWeights_MatchFreshBuild() {
        navigationGraph.getGraph();
        grid.damage(BLOCK, 7);

        GridGraph patched = navigationGraph.getGraph();
        GridGraph fresh = navigationGraph.rebuild();

        assertEquals(fresh.cost(GridPoint.of(0, 2), BLOCK), patched.cost(GridPoint.of(0, 2), BLOCK), DELTA);
    }

    @Test
    public void testDetach_StopsTracking() {
        navigationGraph.getGraph();
        navigationGraph.detach();

        grid.damage(BLOCK, 100);

        assertFalse(navigationGraph.isDirty());
    }

    @Test
    public void testRebuild_UsesInjectedBuilder() {
        GraphBuilder builder = spy(new GraphBuilder());
        NavigationGraph graph = new NavigationGraph(grid, new EdgeCostModel(10, 0.1), builder, new PathFinder());

        graph.findPath(GridPoint.of(0, 0), GridPoint.of(2, 0));
        graph.findPath(GridPoint.of(0, 0), GridPoint.of(0, 2));

        verify(builder, times(1)).build(any(ObstacleGrid.class), any(EdgeCostModel.class));
    }
}
