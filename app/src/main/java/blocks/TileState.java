package blocks;

/**
 * TileState
 * -----------------------
 * - SPAWNING -> IDLE
 * - IDLE -> BLASTING (then removed) / FALLING -> IDLE / SHUFFLING -> IDLE
 * - only IDLE tiles can be grouped or clicked
 */
public enum TileState {
    SPAWNING,
    IDLE,
    BLASTING,
    FALLING,
    SHUFFLING;

    public boolean canTransitionTo(TileState next) {
        return switch (this) {
            case SPAWNING, FALLING, SHUFFLING -> next == IDLE;
            case IDLE -> next == BLASTING || next == FALLING || next == SHUFFLING;
            case BLASTING -> false;
        };
    }
}
