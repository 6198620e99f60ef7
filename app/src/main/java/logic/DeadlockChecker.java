package logic;

import blocks.Tile;

/**
 * Tells whether any playable group is left on the board.
 */
public class DeadlockChecker {

    private final GridState grid;
    private final GroupDetector groupDetector;

    public DeadlockChecker(GridState grid, GroupDetector groupDetector) {
        this.grid = grid;
        this.groupDetector = groupDetector;
    }

    /**
     * Row-major scan, stops at the first playable group. Logging is left to the caller.
     */
    public boolean isDeadlocked() {
        for (int y = 0; y < grid.getRows(); y++) {
            for (int x = 0; x < grid.getColumns(); x++) {
                Tile tile = grid.get(x, y);
                if (tile == null || !tile.canBeGrouped()) continue;

                if (groupDetector.findGroup(x, y) != null) {
                    return false;
                }
            }
        }
        return true;
    }
}
