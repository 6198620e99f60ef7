package logic;

import java.util.List;
import java.util.Random;
import java.util.function.Consumer;

import blocks.Tile;
import blocks.TileState;
import blocks.TileStateListener;
import component.GameConfig;

/**
 * BoardLogic
 * -----------------------
 * - owns the grid and every resolver, and the single "processing" lock
 * - pipeline: blast -> gravity -> icon refresh -> deadlock check -> [shuffle]
 * - while processing, move requests are rejected (not queued)
 * - each phase waits for the animation layer to settle its tiles before the next
 *   one starts; with animations disabled the whole cycle runs inside requestBlast
 */
public class BoardLogic {

    public enum Phase {
        IDLE,
        BLAST,
        GRAVITY,
        CHECK,
        SHUFFLE
    }

    private final GameConfig config;
    private final GridState grid;
    private final AnimationManager animMgr;
    private final TileSpawner spawner;
    private final GroupDetector groupDetector;
    private final DeadlockChecker deadlockChecker;
    private final BlastService blast;
    private final GravityService gravity;
    private final ShuffleService shuffle;

    private boolean processing = false;
    private boolean inputEnabled = true;
    private boolean started = false;
    private Phase phase = Phase.IDLE;

    // === stats ===
    private int moves = 0;
    private int tilesCleared = 0;
    private int shuffles = 0;

    // === callbacks (animation / UI layer) ===
    private TileStateListener tileStateListener;
    private Consumer<List<Tile>> onBlastComplete;
    private Consumer<GravityResult> onGravityComplete;
    private Consumer<ShuffleResult> onShuffleComplete;
    private Consumer<ShuffleResult> onShuffleSettled;
    private Runnable onReady;

    public BoardLogic(GameConfig config) {
        this(config, new Random());
    }

    public BoardLogic(GameConfig config, Random random) {
        this.config = config;
        this.grid = new GridState(config.columns(), config.rows());
        this.animMgr = new AnimationManager(config.animated());
        this.spawner = new TileSpawner(grid, config.palette(), random, this::routeTileState);
        this.groupDetector = new GroupDetector(grid, config.palette());
        this.deadlockChecker = new DeadlockChecker(grid, groupDetector);
        this.blast = new BlastService(grid, animMgr, groupDetector);
        this.gravity = new GravityService(grid, spawner, animMgr);
        this.shuffle = new ShuffleService(grid, groupDetector, deadlockChecker, animMgr, random);

        System.out.println("[BoardLogic] Systems initialized: " + config.columns() + "x" + config.rows() + " grid");
    }

    /**
     * Fills the board and refreshes group metadata. A board that starts
     * deadlocked is shuffled right away (input stays locked until it is done).
     * Bind the tile state listener before calling this when animations are on.
     */
    public void start() {
        if (started) {
            throw new IllegalStateException("board already started");
        }
        started = true;
        System.out.println("[BoardLogic] === GAME START ===");

        spawner.spawnAll(config);
        groupDetector.refreshAllGroupMetadata();

        if (deadlockChecker.isDeadlocked()) {
            System.out.println("[WARN] [BoardLogic] === INITIAL DEADLOCK - SHUFFLING ===");
            processing = true;
            startShuffle();
        } else {
            finishProcessing();
        }
    }

    // ============================================
    // input side
    // ============================================
    public boolean canProcessInput() {
        if (!inputEnabled) {
            return false;
        }
        if (processing) {
            System.out.println("[BoardLogic] Input blocked - processing");
            return false;
        }
        return true;
    }

    /**
     * Read-only query: the group a click at (x, y) would blast.
     *
     * @return the group, or null when input is blocked, the slot is empty or
     *         busy, or the group is below the minimum size
     */
    public List<Tile> evaluateMove(int x, int y) {
        if (!started || !canProcessInput()) {
            return null;
        }
        Tile tile = grid.get(x, y);
        if (tile == null || !tile.canInteract()) {
            return null;
        }
        return groupDetector.findGroup(x, y);
    }

    /**
     * Starts the pipeline for {@code group}.
     *
     * @return false (and nothing changes) if the board is busy, input is off,
     *         or the group is not blastable
     */
    public boolean requestBlast(List<Tile> group) {
        if (!started || !canProcessInput()) {
            return false;
        }
        if (group == null || group.size() < config.minGroupSize()) {
            return false;
        }

        processing = true;
        phase = Phase.BLAST;
        try {
            System.out.println("[BoardLogic] === BLAST START === (" + group.size() + " tiles)");
            moves++;
            blast.blast(group, () -> handleBlastComplete(group));
        } catch (InvalidGroupException e) {
            System.out.println("[BoardLogic] Blast rejected: " + e.getMessage());
            moves--;
            processing = false;
            phase = Phase.IDLE;
            return false;
        }
        return true;
    }

    /**
     * evaluateMove + requestBlast in one step (a click).
     */
    public boolean tryBlastAt(int x, int y) {
        List<Tile> group = evaluateMove(x, y);
        if (group == null) {
            return false;
        }
        return requestBlast(group);
    }

    /**
     * The animation layer finished the removal effect of a blasted tile.
     */
    public void completeRemoval(Tile tile) {
        animMgr.finishRemoval(tile);
    }

    // ============================================
    // pipeline
    // ============================================
    private void handleBlastComplete(List<Tile> group) {
        tilesCleared += group.size();
        if (onBlastComplete != null) {
            onBlastComplete.accept(group);
        }

        System.out.println("[BoardLogic] === GRAVITY START ===");
        phase = Phase.GRAVITY;
        gravity.run(result -> {
            if (onGravityComplete != null) {
                onGravityComplete.accept(result);
            }
        }, result -> handleGravitySettled());
    }

    private void handleGravitySettled() {
        phase = Phase.CHECK;
        System.out.println("[BoardLogic] === UPDATING ICONS ===");
        groupDetector.refreshAllGroupMetadata();

        if (deadlockChecker.isDeadlocked()) {
            System.out.println("[WARN] [BoardLogic] === DEADLOCK - SHUFFLING ===");
            startShuffle();
        } else {
            finishProcessing();
        }
    }

    private void startShuffle() {
        phase = Phase.SHUFFLE;
        shuffles++;
        shuffle.run(config.guaranteedColorCount(), result -> {
            if (onShuffleComplete != null) {
                onShuffleComplete.accept(result);
            }
        }, result -> {
            if (onShuffleSettled != null) {
                onShuffleSettled.accept(result);
            }
            finishProcessing();
        });
    }

    private void finishProcessing() {
        processing = false;
        phase = Phase.IDLE;
        System.out.println("[BoardLogic] === READY FOR INPUT ===");
        if (onReady != null) {
            onReady.run();
        }
    }

    // one message per transition: bound animation handle first, then the phase barrier
    private void routeTileState(Tile tile, TileState oldState, TileState newState) {
        if (tileStateListener != null) {
            tileStateListener.onStateChanged(tile, oldState, newState);
        }
        animMgr.onTileStateChanged(tile, oldState, newState);
    }

    // ============================================
    // callbacks
    // ============================================
    public void setTileStateListener(TileStateListener listener) {
        this.tileStateListener = listener;
    }

    public void setOnBlastComplete(Consumer<List<Tile>> callback) {
        this.onBlastComplete = callback;
    }

    /** Fires once the grid is compacted and refilled; moved tiles are still animating. */
    public void setOnGravityComplete(Consumer<GravityResult> callback) {
        this.onGravityComplete = callback;
    }

    /**
     * Fires once the new layout is committed; tiles are still SHUFFLING.
     * Emergency-fix fields of the result are not filled in yet.
     */
    public void setOnShuffleComplete(Consumer<ShuffleResult> callback) {
        this.onShuffleComplete = callback;
    }

    /**
     * Fires after every shuffled tile is IDLE again and any emergency recolor has
     * been applied ({@link ShuffleResult#getEmergencyTile()} has the new color), right
     * before the lock is released.
     */
    public void setOnShuffleSettled(Consumer<ShuffleResult> callback) {
        this.onShuffleSettled = callback;
    }

    /** Fires every time the lock is released. */
    public void setOnReady(Runnable callback) {
        this.onReady = callback;
    }

    public void setInputEnabled(boolean enabled) {
        this.inputEnabled = enabled;
        System.out.println("[BoardLogic] Input globally " + (enabled ? "enabled" : "disabled"));
    }

    public void setAnimationsEnabled(boolean enabled) {
        if (animMgr.isAnimating()) {
            throw new IllegalStateException("cannot switch animations while " + animMgr.getCurrentType() + " runs");
        }
        animMgr.setAnimated(enabled);
    }

    // === Getters ===
    public GameConfig getConfig() { return config; }
    public GridState getGrid() { return grid; }
    public AnimationManager getAnimationManager() { return animMgr; }
    public GroupDetector getGroupDetector() { return groupDetector; }
    public DeadlockChecker getDeadlockChecker() { return deadlockChecker; }

    public int getColumns() { return grid.getColumns(); }
    public int getRows() { return grid.getRows(); }
    public Tile getTile(int x, int y) { return grid.get(x, y); }
    public boolean isValidPosition(int x, int y) { return grid.isValid(x, y); }

    public boolean isStarted() { return started; }
    public boolean isProcessing() { return processing; }
    public boolean isInputEnabled() { return inputEnabled; }
    public Phase getPhase() { return phase; }

    public int getMoves() { return moves; }
    public int getTilesCleared() { return tilesCleared; }
    public int getShuffles() { return shuffles; }

    public boolean isDeadlocked() {
        return deadlockChecker.isDeadlocked();
    }

    /** Color ids as [row][column], row 0 at the bottom, -1 for empty. */
    public int[][] snapshot() {
        return grid.snapshot();
    }
}
