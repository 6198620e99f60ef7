package logic;

import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import blocks.Tile;

import static org.junit.Assert.*;

public class GridStateTest {

    private GridState grid;

    @Before
    public void setup() {
        grid = new GridState(3, 2);
    }

    @Test
    public void testOutOfBoundsIsEmptyNotError() {
        assertNull(grid.get(-1, 0));
        assertNull(grid.get(3, 0));
        assertNull(grid.get(0, 2));
        assertFalse(grid.isValid(0, -1));

        // writes outside are ignored
        grid.set(5, 5, new Tile(1, 5, 5, 0));
        grid.clear(-1, -1);
        assertEquals(0, grid.countTiles());
    }

    @Test
    public void testSetGetClear() {
        Tile t = new Tile(grid.allocateTileId(), 1, 1, 2);
        grid.set(1, 1, t);
        assertSame(t, grid.get(1, 1));

        grid.clear(1, 1);
        assertNull(grid.get(1, 1));
    }

    @Test
    public void testForEachIsRowMajorFromBottom() {
        grid.set(2, 1, new Tile(1, 2, 1, 0));
        grid.set(0, 0, new Tile(2, 0, 0, 0));
        grid.set(1, 0, new Tile(3, 1, 0, 0));

        List<String> order = new ArrayList<>();
        grid.forEach((tile, x, y) -> order.add(x + "," + y));

        assertEquals(List.of("0,0", "1,0", "2,1"), order);
        assertEquals(3, grid.allTiles().size());
    }

    @Test
    public void testSnapshotAndConsistency() {
        grid.set(0, 0, new Tile(1, 0, 0, 4));
        grid.set(2, 1, new Tile(2, 2, 1, 3));

        int[][] snap = grid.snapshot();
        assertEquals(4, snap[0][0]);
        assertEquals(3, snap[1][2]);
        assertEquals(-1, snap[1][0]);
        assertTrue(grid.isConsistent());

        // tile claims another slot
        grid.set(1, 0, new Tile(3, 2, 0, 1));
        assertFalse(grid.isConsistent());
    }

    @Test
    public void testClearAll() {
        grid.set(0, 0, new Tile(1, 0, 0, 0));
        grid.set(1, 1, new Tile(2, 1, 1, 0));
        grid.clearAll();
        assertTrue(grid.allTiles().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroSizeRejected() {
        new GridState(0, 4);
    }
}
