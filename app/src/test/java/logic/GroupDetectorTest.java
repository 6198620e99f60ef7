package logic;

import org.junit.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import blocks.GridPos;
import blocks.IconTier;
import blocks.Tile;
import blocks.TileState;

import static org.junit.Assert.*;

public class GroupDetectorTest {

    private static final int A = 0;
    private static final int B = 1;

    private static Set<GridPos> positions(List<Tile> tiles) {
        Set<GridPos> set = new HashSet<>();
        for (Tile t : tiles) set.add(t.getPos());
        return set;
    }

    // ----------------------------------------
    // 3x3: [A A B / A B B / B B A], bottom row first
    // ----------------------------------------
    @Test
    public void testThreeByThreeScenario() {
        GridState grid = TestBoards.grid(3, 3,
                A, A, B,
                A, B, B,
                B, B, A);
        GroupDetector detector = new GroupDetector(grid, TestBoards.palette(2));

        List<Tile> aGroup = detector.findGroup(0, 0);
        assertNotNull(aGroup);
        assertEquals(Set.of(new GridPos(0, 0), new GridPos(1, 0), new GridPos(0, 1)), positions(aGroup));

        List<Tile> bGroup = detector.findGroup(2, 0);
        assertNotNull(bGroup);
        assertEquals(5, bGroup.size());

        // lone A in the top-right corner
        assertNull(detector.findGroup(2, 2));
    }

    @Test
    public void testEmptyAndOutOfBoundsSeed() {
        GridState grid = TestBoards.grid(2, 1, A, -1);
        GroupDetector detector = new GroupDetector(grid, TestBoards.palette(2));

        assertNull(detector.findGroup(1, 0));
        assertNull(detector.findGroup(-1, 0));
        assertNull(detector.findGroup(0, 5));
    }

    @Test
    public void testDiagonalsDoNotConnect() {
        GridState grid = TestBoards.grid(2, 2,
                A, B,
                B, A);
        GroupDetector detector = new GroupDetector(grid, TestBoards.palette(2));

        assertNull(detector.findGroup(0, 0));
        assertNull(detector.findGroup(1, 0));
    }

    @Test
    public void testBusyTilesAreNotGrouped() {
        GridState grid = TestBoards.grid(3, 1, A, A, A);
        GroupDetector detector = new GroupDetector(grid, TestBoards.palette(2));

        grid.get(1, 0).setState(TileState.FALLING);

        // the busy middle tile splits the row into two singletons
        assertNull(detector.findGroup(0, 0));
        assertNull(detector.findGroup(1, 0));

        grid.get(1, 0).setState(TileState.IDLE);
        assertEquals(3, detector.findGroup(0, 0).size());
    }

    @Test
    public void testMinimumSizeRespected() {
        GridState grid = TestBoards.grid(3, 1, A, A, B);
        GroupDetector detector = new GroupDetector(grid, TestBoards.palette(2, 3));

        assertNull(detector.findGroup(0, 0));
    }

    // ----------------------------------------
    // connected, same color, maximal - random boards
    // ----------------------------------------
    @Test
    public void testGroupsAreConnectedHomogeneousAndMaximal() {
        Random random = new Random(7);
        for (int round = 0; round < 50; round++) {
            GridState grid = TestBoards.randomGrid(5, 5, 3, random);
            GroupDetector detector = new GroupDetector(grid, TestBoards.palette(3));

            for (int y = 0; y < 5; y++) {
                for (int x = 0; x < 5; x++) {
                    List<Tile> group = detector.findGroup(x, y);
                    int expected = TestBoards.componentSize(grid, x, y);
                    if (expected < 2) {
                        assertNull(group);
                        continue;
                    }
                    assertNotNull(group);
                    assertEquals("maximal component at " + x + "," + y, expected, group.size());

                    int color = grid.get(x, y).getColorId();
                    Set<GridPos> members = positions(group);
                    assertEquals("no duplicates", group.size(), members.size());
                    for (Tile t : group) {
                        assertEquals(color, t.getColorId());
                        assertSame(t, grid.get(t.getX(), t.getY()));
                    }
                }
            }
        }
    }

    // ----------------------------------------
    // metadata refresh
    // ----------------------------------------
    @Test
    public void testRefreshAllGroupMetadata() {
        // bottom row of A plus two A above it, one B pair, two lone B
        GridState grid = TestBoards.grid(6, 2,
                A, A, A, A, A, A,
                B, B, A, B, A, B);
        GroupDetector detector = new GroupDetector(grid, TestBoards.palette(2));

        detector.refreshAllGroupMetadata();

        assertEquals(8, grid.get(0, 0).getGroupSize());
        assertEquals(IconTier.SECOND, grid.get(0, 0).getIconTier());
        assertEquals(8, grid.get(4, 1).getGroupSize());

        assertEquals(2, grid.get(0, 1).getGroupSize());
        assertEquals(IconTier.DEFAULT, grid.get(1, 1).getIconTier());

        assertEquals(1, grid.get(3, 1).getGroupSize());
        assertEquals(1, grid.get(5, 1).getGroupSize());
    }

    @Test
    public void testRefreshResetsStaleMetadata() {
        GridState grid = TestBoards.grid(2, 1, A, B);
        GroupDetector detector = new GroupDetector(grid, TestBoards.palette(2));

        grid.get(0, 0).setGroupInfo(12, IconTier.THIRD);
        detector.refreshAllGroupMetadata();

        assertEquals(1, grid.get(0, 0).getGroupSize());
        assertEquals(IconTier.DEFAULT, grid.get(0, 0).getIconTier());
    }
}
