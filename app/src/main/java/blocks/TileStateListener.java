package blocks;

/**
 * Receives every lifecycle transition of a tile.
 * The animation layer binds one of these to start the matching effect and,
 * for FALLING / SHUFFLING, sets the tile back to IDLE when the effect ends.
 */
public interface TileStateListener {
    void onStateChanged(Tile tile, TileState oldState, TileState newState);
}
