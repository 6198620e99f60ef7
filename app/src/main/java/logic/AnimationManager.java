package logic;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import blocks.Tile;
import blocks.TileState;

/**
 * AnimationManager
 * -----------------
 * - completion barrier between pipeline phases
 * - a phase registers the tiles it waits on, then changes their state
 * - FALLING / SPAWNING / SHUFFLING tiles settle when they go back to IDLE
 * - BLASTING tiles settle when the animation layer reports the removal
 * - when animations are disabled every tile is settled right away
 * - at most one phase is in flight (the pipeline is strictly sequential)
 */
public class AnimationManager {

    public enum AnimationType {
        NONE,
        BLAST,
        GRAVITY,
        SHUFFLE
    }

    private boolean animated;

    private AnimationType current = AnimationType.NONE;
    private final Set<Tile> pending = new LinkedHashSet<>();
    private boolean armed = false;
    private Runnable onComplete;

    public AnimationManager(boolean animated) {
        this.animated = animated;
    }

    public boolean isAnimated() {
        return animated;
    }

    public void setAnimated(boolean animated) {
        this.animated = animated;
    }

    /**
     * Starts waiting on {@code tiles}. {@code begin} runs right after registration
     * and puts the tiles into their animated state (and tells the animation layer
     * what to play); {@code onComplete} runs once all of them have settled.
     *
     * @throws IllegalStateException if another phase is still in flight
     */
    public void start(AnimationType type, Collection<Tile> tiles, Runnable begin, Runnable onComplete) {
        if (current != AnimationType.NONE) {
            throw new IllegalStateException("cannot start " + type + " while " + current + " is running");
        }
        current = type;
        this.onComplete = onComplete;
        armed = false;
        pending.clear();
        pending.addAll(tiles);

        System.out.println("[AnimMgr] " + type + " started (" + pending.size() + " tiles)");

        if (begin != null) {
            begin.run();
        }

        if (!animated) {
            // snapshot: settling removes entries from pending
            for (Tile t : new ArrayList<>(pending)) {
                settleNow(t);
            }
        }

        armed = true;
        checkComplete();
    }

    /**
     * Route every tile state change through here.
     */
    public void onTileStateChanged(Tile tile, TileState oldState, TileState newState) {
        if (newState == TileState.IDLE && pending.remove(tile)) {
            checkComplete();
        }
    }

    /**
     * Animation layer finished removing a blasted tile.
     */
    public void finishRemoval(Tile tile) {
        if (current != AnimationType.BLAST || !pending.remove(tile)) {
            System.out.println("[WARN] finishRemoval ignored for " + tile + " (phase=" + current + ")");
            return;
        }
        checkComplete();
    }

    private void settleNow(Tile t) {
        if (!pending.contains(t)) return;
        if (t.getState() == TileState.BLASTING || t.getState() == TileState.IDLE) {
            pending.remove(t);
        } else {
            t.setState(TileState.IDLE);
            pending.remove(t);
        }
    }

    private void checkComplete() {
        if (!armed || !pending.isEmpty() || current == AnimationType.NONE) {
            return;
        }
        AnimationType finished = current;
        Runnable callback = onComplete;
        current = AnimationType.NONE;
        onComplete = null;
        armed = false;

        System.out.println("[AnimMgr] " + finished + " finished");
        if (callback != null) {
            callback.run();
        }
    }

    public boolean isAnimating() {
        return current != AnimationType.NONE;
    }

    public AnimationType getCurrentType() {
        return current;
    }

    public int pendingCount() {
        return pending.size();
    }

    public List<Tile> pendingTiles() {
        return new ArrayList<>(pending);
    }
}
