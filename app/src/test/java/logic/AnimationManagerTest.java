package logic;

import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import blocks.Tile;
import blocks.TileState;

import static org.junit.Assert.*;

public class AnimationManagerTest {

    private AnimationManager mgr;
    private int completions;

    private Tile tile(int id) {
        Tile t = new Tile(id, id, 0, 0, mgr::onTileStateChanged);
        t.setState(TileState.IDLE);
        return t;
    }

    private void falling(Tile... tiles) {
        for (Tile t : tiles) t.setState(TileState.FALLING);
    }

    @Before
    public void setUp() {
        mgr = new AnimationManager(true);
        completions = 0;
    }

    @Test
    public void testHeadlessSettlesImmediately() {
        mgr.setAnimated(false);
        Tile a = tile(0);
        Tile b = tile(1);

        mgr.start(AnimationManager.AnimationType.GRAVITY, Arrays.asList(a, b),
                () -> falling(a, b), () -> completions++);

        assertEquals(1, completions);
        assertEquals(TileState.IDLE, a.getState());
        assertEquals(TileState.IDLE, b.getState());
        assertFalse(mgr.isAnimating());
        assertEquals(AnimationManager.AnimationType.NONE, mgr.getCurrentType());
        assertEquals(0, mgr.pendingCount());
    }

    @Test
    public void testWaitsForEveryTileToBeIdle() {
        Tile a = tile(0);
        Tile b = tile(1);

        mgr.start(AnimationManager.AnimationType.GRAVITY, Arrays.asList(a, b),
                () -> falling(a, b), () -> completions++);

        assertTrue(mgr.isAnimating());
        assertEquals(AnimationManager.AnimationType.GRAVITY, mgr.getCurrentType());
        assertEquals(2, mgr.pendingCount());

        a.setState(TileState.IDLE);
        assertEquals(0, completions);
        assertEquals(1, mgr.pendingCount());

        b.setState(TileState.IDLE);
        assertEquals(1, completions);
        assertFalse(mgr.isAnimating());
    }

    @Test
    public void testBlastWaitsForRemoval() {
        Tile a = tile(0);
        Tile b = tile(1);

        mgr.start(AnimationManager.AnimationType.BLAST, Arrays.asList(a, b), () -> {
            a.setState(TileState.BLASTING);
            b.setState(TileState.BLASTING);
        }, () -> completions++);

        mgr.finishRemoval(a);
        assertEquals(0, completions);
        mgr.finishRemoval(b);
        assertEquals(1, completions);

        // late report is ignored
        mgr.finishRemoval(a);
        assertEquals(1, completions);
    }

    @Test
    public void testHeadlessBlastDoesNotNeedRemovalReports() {
        mgr.setAnimated(false);
        Tile a = tile(0);

        mgr.start(AnimationManager.AnimationType.BLAST, Collections.singletonList(a),
                () -> a.setState(TileState.BLASTING), () -> completions++);

        assertEquals(1, completions);
        assertEquals(TileState.BLASTING, a.getState());
    }

    @Test(expected = IllegalStateException.class)
    public void testSecondPhaseWhileBusyIsRejected() {
        Tile a = tile(0);
        mgr.start(AnimationManager.AnimationType.GRAVITY, Collections.singletonList(a), () -> falling(a), null);
        mgr.start(AnimationManager.AnimationType.SHUFFLE, Collections.singletonList(a), null, null);
    }

    @Test
    public void testEmptyPhaseCompletesAtOnce() {
        mgr.start(AnimationManager.AnimationType.GRAVITY, Collections.emptyList(), null, () -> completions++);
        assertEquals(1, completions);
        assertFalse(mgr.isAnimating());
    }

    @Test
    public void testCompletionMayStartNextPhase() {
        Tile a = tile(0);

        mgr.start(AnimationManager.AnimationType.GRAVITY, Collections.singletonList(a), () -> falling(a), () -> {
            completions++;
            mgr.start(AnimationManager.AnimationType.SHUFFLE, Collections.singletonList(a),
                    () -> a.setState(TileState.SHUFFLING), () -> completions++);
        });

        a.setState(TileState.IDLE);
        assertEquals(1, completions);
        assertEquals(AnimationManager.AnimationType.SHUFFLE, mgr.getCurrentType());
        assertEquals(Collections.singletonList(a), mgr.pendingTiles());

        a.setState(TileState.IDLE);
        assertEquals(2, completions);
        assertFalse(mgr.isAnimating());
    }

    @Test
    public void testUnrelatedTileIsIgnored() {
        Tile a = tile(0);
        Tile other = tile(1);
        mgr.start(AnimationManager.AnimationType.GRAVITY, Collections.singletonList(a), () -> falling(a), () -> completions++);

        other.setState(TileState.FALLING);
        other.setState(TileState.IDLE);
        assertEquals(0, completions);
        assertEquals(1, mgr.pendingCount());
    }
}
