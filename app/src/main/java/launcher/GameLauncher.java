package launcher;

import java.nio.file.Path;
import java.util.Random;

import component.GameConfig;
import component.ai.AIPlayer;
import component.config.LevelConfigException;
import component.config.LevelConfigLoader;
import logic.BoardLogic;

/**
 * Headless session: loads a level, lets the AI play, prints the final board.
 *
 * <pre>
 * GameLauncher [levelFile|-] [moves] [seed] [easy|normal]
 * </pre>
 */
public class GameLauncher {

    static final int DEFAULT_MOVES = 50;

    public static void main(String[] args) {
        System.out.println("[DEBUG] main started");
        try {
            run(args);
        } catch (LevelConfigException | IllegalArgumentException e) {
            System.err.println("[ERROR] " + e.getMessage());
            System.exit(1);
        }
    }

    static AIPlayer.Summary run(String[] args) {
        GameConfig config = args.length > 0 && !args[0].equals("-")
                ? LevelConfigLoader.loadFile(Path.of(args[0]))
                : LevelConfigLoader.loadDefault();
        int moves = args.length > 1 ? parsePositive(args[1], "moves") : DEFAULT_MOVES;
        Random random = args.length > 2 ? new Random(Long.parseLong(args[2])) : new Random();
        String difficulty = args.length > 3 ? args[3] : "normal";

        BoardLogic logic = new BoardLogic(config.withAnimated(false), random);
        AIPlayer player = new AIPlayer(logic, random);
        player.setDifficulty(difficulty);

        AIPlayer.Summary summary = player.play(moves);
        System.out.println(render(logic.snapshot()));
        return summary;
    }

    static int parsePositive(String value, String name) {
        int n;
        try {
            n = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number, got '" + value + "'");
        }
        if (n <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + n);
        }
        return n;
    }

    /** Top row first, '.' for empty slots. */
    static String render(int[][] colors) {
        StringBuilder sb = new StringBuilder();
        for (int y = colors.length - 1; y >= 0; y--) {
            for (int x = 0; x < colors[y].length; x++) {
                int c = colors[y][x];
                sb.append(c < 0 ? "." : Integer.toString(c, 36));
                if (x + 1 < colors[y].length) sb.append(' ');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
