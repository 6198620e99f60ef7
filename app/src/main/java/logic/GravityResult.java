package logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import blocks.Tile;

/**
 * Outcome of one gravity pass: tiles that fell and tiles spawned to refill.
 */
public final class GravityResult {

    private final List<TileMove> fell;
    private final List<TileMove> spawned;

    public GravityResult(List<TileMove> fell, List<TileMove> spawned) {
        this.fell = Collections.unmodifiableList(new ArrayList<>(fell));
        this.spawned = Collections.unmodifiableList(new ArrayList<>(spawned));
    }

    public List<TileMove> getFell() { return fell; }
    public List<TileMove> getSpawned() { return spawned; }

    public boolean isEmpty() {
        return fell.isEmpty() && spawned.isEmpty();
    }

    public List<Tile> movedTiles() {
        List<Tile> tiles = new ArrayList<>(fell.size() + spawned.size());
        for (TileMove m : fell) tiles.add(m.tile);
        for (TileMove m : spawned) tiles.add(m.tile);
        return tiles;
    }

    @Override
    public String toString() {
        return "GravityResult{fell=" + fell.size() + ", spawned=" + spawned.size() + "}";
    }
}
