package logic;

import java.util.Random;

import blocks.Tile;
import blocks.TileState;
import blocks.TileStateListener;
import component.ColorPalette;
import component.GameConfig;

/**
 * TileSpawner
 * -----------------------
 * - initial fill from the level layout (random color where the layout has none)
 * - refill tiles for slots emptied by a blast
 */
public class TileSpawner {

    private final GridState grid;
    private final ColorPalette palette;
    private final Random random;
    private final TileStateListener observer;

    public TileSpawner(GridState grid, ColorPalette palette, Random random, TileStateListener observer) {
        this.grid = grid;
        this.palette = palette;
        this.random = random;
        this.observer = observer;
    }

    /**
     * Fills every slot. Layout colors outside the palette are replaced by a random one.
     * Initial tiles are IDLE right away.
     */
    public void spawnAll(GameConfig config) {
        int replaced = 0;
        for (int y = 0; y < grid.getRows(); y++) {
            for (int x = 0; x < grid.getColumns(); x++) {
                int color = config.layoutColorAt(x, y);
                if (!palette.isAvailable(color)) {
                    if (config.hasLayout()) replaced++;
                    color = palette.randomColorId(random);
                }
                Tile tile = spawn(x, y, color);
                tile.setState(TileState.IDLE);
            }
        }
        if (replaced > 0) {
            System.out.println("[TileSpawner] " + replaced + " layout cells had unknown colors, randomized");
        }
        System.out.println("[TileSpawner] Spawned " + (grid.getColumns() * grid.getRows()) + " tiles");
    }

    /**
     * New SPAWNING tile with a uniformly random palette color, placed at (x, y).
     */
    public Tile spawnForRefill(int x, int y) {
        return spawn(x, y, palette.randomColorId(random));
    }

    public Tile spawn(int x, int y, int colorId) {
        Tile tile = new Tile(grid.allocateTileId(), x, y, colorId, observer);
        grid.set(x, y, tile);
        return tile;
    }
}
