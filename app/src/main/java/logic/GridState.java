package logic;

import java.util.ArrayList;
import java.util.List;

import blocks.Tile;

/**
 * GridState
 * -----------------------
 * - dense columns x rows slot array, at most one tile per slot
 * - pure data access: no rules, no events
 * - out-of-bounds reads return null and out-of-bounds writes are ignored
 */
public class GridState {

    /** Callback for {@link #forEach}: tile plus the slot it sits in. */
    public interface TileVisitor {
        void visit(Tile tile, int x, int y);
    }

    private final int columns;
    private final int rows;
    private final Tile[][] slots;

    // id handed to the next spawned tile
    private int nextTileId = 1;

    public GridState(int columns, int rows) {
        if (columns <= 0 || rows <= 0) {
            throw new IllegalArgumentException("grid must be at least 1x1, got " + columns + "x" + rows);
        }
        this.columns = columns;
        this.rows = rows;
        this.slots = new Tile[columns][rows];
    }

    // === Getter ===
    public int getColumns() { return columns; }
    public int getRows() { return rows; }

    public boolean isValid(int x, int y) {
        return x >= 0 && x < columns && y >= 0 && y < rows;
    }

    public Tile get(int x, int y) {
        if (!isValid(x, y)) return null;
        return slots[x][y];
    }

    public void set(int x, int y, Tile tile) {
        if (!isValid(x, y)) return;
        slots[x][y] = tile;
    }

    public void clear(int x, int y) {
        if (!isValid(x, y)) return;
        slots[x][y] = null;
    }

    public void clearAll() {
        for (int x = 0; x < columns; x++) {
            for (int y = 0; y < rows; y++) {
                slots[x][y] = null;
            }
        }
    }

    /** Row-major (y outer, x inner) walk over occupied slots. */
    public void forEach(TileVisitor visitor) {
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < columns; x++) {
                Tile tile = slots[x][y];
                if (tile != null) {
                    visitor.visit(tile, x, y);
                }
            }
        }
    }

    public List<Tile> allTiles() {
        List<Tile> list = new ArrayList<>();
        forEach((tile, x, y) -> list.add(tile));
        return list;
    }

    public int countTiles() {
        int[] count = { 0 };
        forEach((tile, x, y) -> count[0]++);
        return count[0];
    }

    public int allocateTileId() {
        if (nextTileId == Integer.MAX_VALUE) {
            nextTileId = 1;
        }
        return nextTileId++;
    }

    /**
     * True when every occupied slot's tile reports that slot's coordinates.
     */
    public boolean isConsistent() {
        boolean[] ok = { true };
        forEach((tile, x, y) -> {
            if (tile.getX() != x || tile.getY() != y) ok[0] = false;
        });
        return ok[0];
    }

    /**
     * Color ids as [row][column] with row 0 at the bottom, -1 for empty slots.
     */
    public int[][] snapshot() {
        int[][] colors = new int[rows][columns];
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < columns; x++) {
                Tile t = slots[x][y];
                colors[y][x] = t == null ? -1 : t.getColorId();
            }
        }
        return colors;
    }
}
