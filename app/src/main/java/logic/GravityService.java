package logic;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import blocks.Tile;
import blocks.TileState;

/**
 * GravityService
 * -----------------------
 * - per column: compacts tiles downward keeping their order (stable partition)
 * - refills the vacated top slots with random palette colors
 * - tiles only ever move down or stay; y = 0 is the bottom row
 */
public class GravityService {

    private final GridState grid;
    private final TileSpawner spawner;
    private final AnimationManager animMgr;

    public GravityService(GridState grid, TileSpawner spawner, AnimationManager animMgr) {
        this.grid = grid;
        this.spawner = spawner;
        this.animMgr = animMgr;
    }

    /**
     * Runs one gravity pass and waits for every moved tile to settle.
     * {@code onMoved} gets the moves after the falling tiles are flagged, so the
     * animation layer knows where to send them; {@code onSettled} runs once all
     * of them are IDLE again.
     */
    public void run(Consumer<GravityResult> onMoved, Consumer<GravityResult> onSettled) {
        System.out.println("[GravityService] Starting gravity...");
        GravityResult result = applyGravityAndRefill();
        System.out.println("[GravityService] Falling: " + result.getFell().size()
                + ", Spawning: " + result.getSpawned().size());

        animMgr.start(AnimationManager.AnimationType.GRAVITY, result.movedTiles(),
                () -> {
                    for (TileMove m : result.getFell()) {
                        m.tile.setState(TileState.FALLING);
                    }
                    if (onMoved != null) {
                        onMoved.accept(result);
                    }
                },
                () -> {
                    System.out.println("[GravityService] Gravity complete");
                    if (onSettled != null) {
                        onSettled.accept(result);
                    }
                });
    }

    // ============================================
    // grid mutation only, no state transitions
    // ============================================
    public GravityResult applyGravityAndRefill() {
        List<TileMove> fell = new ArrayList<>();
        List<TileMove> spawned = new ArrayList<>();

        for (int x = 0; x < grid.getColumns(); x++) {
            int writeY = compactColumn(x, fell);
            refillColumn(x, writeY, spawned);
        }
        return new GravityResult(fell, spawned);
    }

    // bottom-up write cursor; returns the first empty row after compaction
    int compactColumn(int x, List<TileMove> fell) {
        int writeY = 0;

        for (int y = 0; y < grid.getRows(); y++) {
            Tile tile = grid.get(x, y);
            if (tile == null) continue;

            if (writeY != y) {
                grid.set(x, writeY, tile);
                grid.clear(x, y);
                tile.moveTo(x, writeY);
                fell.add(new TileMove(tile, x, y, x, writeY));
            }
            writeY++;
        }
        return writeY;
    }

    private void refillColumn(int x, int firstEmpty, List<TileMove> spawned) {
        int rows = grid.getRows();
        int toSpawn = rows - firstEmpty;
        for (int i = 0; i < toSpawn; i++) {
            int y = firstEmpty + i;
            Tile tile = spawner.spawnForRefill(x, y);
            // enters from above the board, one slot per refill index
            spawned.add(new TileMove(tile, x, rows + i, x, y));
        }
    }
}
