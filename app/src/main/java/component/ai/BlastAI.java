package component.ai;

import java.util.List;
import java.util.Random;

import blocks.Tile;
import logic.BoardLogic;

/**
 * BlastAI - picks the next group to blast
 *
 * EASY: any playable group, at random
 * NORMAL: the largest group (ties: lowest row, then leftmost column)
 */
public class BlastAI {

    public enum Strategy { EASY, NORMAL }

    /** Seed slot of the chosen group. */
    public static final class Move {
        public final int x;
        public final int y;
        public final int groupSize;

        public Move(int x, int y, int groupSize) {
            this.x = x;
            this.y = y;
            this.groupSize = groupSize;
        }

        @Override
        public String toString() {
            return "Move{(" + x + "," + y + "), size=" + groupSize + "}";
        }
    }

    private final BoardLogic logic;
    private final Random random;
    private Strategy strategy = Strategy.NORMAL;

    public BlastAI(BoardLogic logic, Random random) {
        this.logic = logic;
        this.random = random;
    }

    public void setStrategy(Strategy strategy) {
        this.strategy = strategy;
    }

    public Strategy getStrategy() {
        return strategy;
    }

    /**
     * @return null when the board is busy or has no playable group
     */
    public Move findMove() {
        if (logic.isProcessing()) {
            return null;
        }

        int columns = logic.getColumns();
        int rows = logic.getRows();
        boolean[][] seen = new boolean[columns][rows];

        Move best = null;
        int candidates = 0;

        // row-major, so the first hit of a size is the lowest / leftmost
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < columns; x++) {
                if (seen[x][y]) continue;

                List<Tile> group = logic.getGroupDetector().findGroup(x, y);
                if (group == null) {
                    seen[x][y] = true;
                    continue;
                }
                for (Tile t : group) {
                    seen[t.getX()][t.getY()] = true;
                }

                candidates++;
                Move move = new Move(x, y, group.size());
                switch (strategy) {
                    case EASY -> {
                        // reservoir sampling over the groups
                        if (random.nextInt(candidates) == 0) best = move;
                    }
                    case NORMAL -> {
                        if (best == null || move.groupSize > best.groupSize) best = move;
                    }
                }
            }
        }
        return best;
    }
}
