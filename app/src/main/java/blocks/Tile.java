package blocks;

/**
 * Tile
 * -----------------------
 * - one colored cell of the board: slot coordinates, color id, lifecycle state
 * - groupSize / iconTier are caches rebuilt by GroupDetector after every phase
 * - every state change goes to the single observer handed in at spawn time
 */
public class Tile {

    private final int id;
    private int x;
    private int y;
    private int colorId;

    private int groupSize = 1;
    private IconTier iconTier = IconTier.DEFAULT;
    private TileState state = TileState.SPAWNING;

    private final TileStateListener observer;

    public Tile(int id, int x, int y, int colorId, TileStateListener observer) {
        this.id = id;
        this.x = x;
        this.y = y;
        this.colorId = colorId;
        this.observer = observer;
    }

    public Tile(int id, int x, int y, int colorId) {
        this(id, x, y, colorId, null);
    }

    // === Getter / Setter ===
    public int getId() { return id; }
    public int getX() { return x; }
    public int getY() { return y; }
    public GridPos getPos() { return new GridPos(x, y); }

    public void moveTo(int x, int y) {
        this.x = x;
        this.y = y;
    }

    public int getColorId() { return colorId; }
    public void setColorId(int colorId) { this.colorId = colorId; }

    public int getGroupSize() { return groupSize; }
    public IconTier getIconTier() { return iconTier; }

    public void setGroupInfo(int groupSize, IconTier iconTier) {
        this.groupSize = groupSize;
        this.iconTier = iconTier;
    }

    public void resetGroupInfo() {
        setGroupInfo(1, IconTier.DEFAULT);
    }

    public TileState getState() { return state; }

    /**
     * Moves the tile to {@code newState} and notifies the observer.
     * Setting the current state again is a no-op.
     *
     * @throws IllegalStateException if the lifecycle does not allow the transition
     */
    public void setState(TileState newState) {
        if (newState == state) {
            return;
        }
        if (!state.canTransitionTo(newState)) {
            throw new IllegalStateException(
                    "Tile#" + id + " at (" + x + "," + y + "): " + state + " -> " + newState + " not allowed");
        }
        TileState old = state;
        state = newState;
        if (observer != null) {
            observer.onStateChanged(this, old, newState);
        }
    }

    public boolean canBeGrouped() {
        return state == TileState.IDLE;
    }

    public boolean canInteract() {
        return state == TileState.IDLE;
    }

    @Override
    public String toString() {
        return "Tile#" + id + "{(" + x + "," + y + "), color=" + colorId + ", " + state + "}";
    }
}
