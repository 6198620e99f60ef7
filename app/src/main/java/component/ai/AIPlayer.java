package component.ai;

import java.util.Random;

import logic.BoardLogic;

/**
 * AIPlayer - drives a headless BoardLogic with BlastAI
 */
public class AIPlayer {

    /** Totals for one autoplay session. */
    public static final class Summary {
        public final int moves;
        public final int tilesCleared;
        public final int shuffles;
        public final boolean stuck;

        public Summary(int moves, int tilesCleared, int shuffles, boolean stuck) {
            this.moves = moves;
            this.tilesCleared = tilesCleared;
            this.shuffles = shuffles;
            this.stuck = stuck;
        }

        @Override
        public String toString() {
            return "Summary{moves=" + moves + ", tilesCleared=" + tilesCleared
                    + ", shuffles=" + shuffles + ", stuck=" + stuck + "}";
        }
    }

    private final BlastAI ai;
    private final BoardLogic logic;

    /**
     * @param logic board to play; must run with animations disabled
     */
    public AIPlayer(BoardLogic logic, Random random) {
        if (logic.getAnimationManager().isAnimated()) {
            throw new IllegalArgumentException("AIPlayer needs a board with animations disabled");
        }
        this.logic = logic;
        this.ai = new BlastAI(logic, random);
    }

    /**
     * @param difficulty "easy" or "normal"
     */
    public void setDifficulty(String difficulty) {
        switch (difficulty.toLowerCase()) {
            case "easy":
                ai.setStrategy(BlastAI.Strategy.EASY);
                break;
            case "normal":
                ai.setStrategy(BlastAI.Strategy.NORMAL);
                break;
            default:
                throw new IllegalArgumentException("unknown difficulty: " + difficulty);
        }
    }

    /**
     * Plays up to {@code maxMoves} moves. Stops early if no move can be found
     * (which means the board is stuck, since deadlocks are shuffled away).
     */
    public Summary play(int maxMoves) {
        if (!logic.isStarted()) {
            logic.start();
        }

        boolean stuck = false;
        for (int i = 0; i < maxMoves; i++) {
            BlastAI.Move move = ai.findMove();
            if (move == null) {
                stuck = true;
                break;
            }
            if (!logic.tryBlastAt(move.x, move.y)) {
                System.out.println("[AIPlayer] " + move + " was rejected");
                stuck = true;
                break;
            }
        }

        Summary summary = new Summary(logic.getMoves(), logic.getTilesCleared(), logic.getShuffles(), stuck);
        System.out.println("[AIPlayer] " + summary);
        return summary;
    }
}
