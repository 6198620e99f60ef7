package logic;

import blocks.Tile;

/**
 * One tile changing slot. Spawned tiles start above the board (fromY >= rows).
 */
public final class TileMove {
    public final Tile tile;
    public final int fromX;
    public final int fromY;
    public final int toX;
    public final int toY;

    public TileMove(Tile tile, int fromX, int fromY, int toX, int toY) {
        this.tile = tile;
        this.fromX = fromX;
        this.fromY = fromY;
        this.toX = toX;
        this.toY = toY;
    }

    public int distance() {
        return Math.abs(fromX - toX) + Math.abs(fromY - toY);
    }

    @Override
    public String toString() {
        return "TileMove{#" + tile.getId() + " (" + fromX + "," + fromY + ")->(" + toX + "," + toY + ")}";
    }
}
