package logic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;

import blocks.GridPos;
import blocks.Tile;
import blocks.TileState;

/**
 * ShuffleService
 * -----------------------
 * - rearranges a deadlocked board so that up to N colors have a playable cluster
 * - guaranteed colors get a reserved cluster found by randomized BFS
 * - every other tile goes to a Fisher-Yates shuffled free slot
 * - if the result is still deadlocked, one tile is recolored to match its neighbor
 */
public class ShuffleService {

    static final int MAX_CLUSTER_SIZE = 5;
    static final int MAX_CLUSTER_ATTEMPTS = 20;

    private static final int[][] DIRECTIONS = { { 0, 1 }, { 0, -1 }, { -1, 0 }, { 1, 0 } };

    private final GridState grid;
    private final GroupDetector groupDetector;
    private final DeadlockChecker deadlockChecker;
    private final AnimationManager animMgr;
    private final Random random;
    private final int minGroupSize;

    public ShuffleService(GridState grid, GroupDetector groupDetector, DeadlockChecker deadlockChecker,
                          AnimationManager animMgr, Random random) {
        this.grid = grid;
        this.groupDetector = groupDetector;
        this.deadlockChecker = deadlockChecker;
        this.animMgr = animMgr;
        this.random = random;
        this.minGroupSize = groupDetector.getMinGroupSize();
    }

    /**
     * Full shuffle phase: rearrange and commit, flag every tile SHUFFLING, wait for
     * all of them to be IDLE, then repair a leftover deadlock and refresh metadata.
     */
    public void run(int guaranteedColorCount, Consumer<ShuffleResult> onCommitted, Consumer<ShuffleResult> onSettled) {
        System.out.println("[ShuffleService] ========================================");
        System.out.println("[ShuffleService] STARTING SHUFFLE WITH " + guaranteedColorCount + " GUARANTEED COLORS");
        System.out.println("[ShuffleService] ========================================");

        ShuffleResult result = shuffle(guaranteedColorCount);

        animMgr.start(AnimationManager.AnimationType.SHUFFLE, result.getMapping().keySet(),
                () -> {
                    for (Tile t : result.getMapping().keySet()) {
                        t.setState(TileState.SHUFFLING);
                    }
                    if (onCommitted != null) {
                        onCommitted.accept(result);
                    }
                },
                () -> {
                    resolveRemainingDeadlock(result);
                    groupDetector.refreshAllGroupMetadata();
                    System.out.println("[ShuffleService] SHUFFLE COMPLETE " + result);
                    if (onSettled != null) {
                        onSettled.accept(result);
                    }
                });
    }

    // ============================================
    // placement (grid mutation only, no state transitions)
    // ============================================
    public ShuffleResult shuffle(int guaranteedColorCount) {
        List<Tile> allTiles = grid.allTiles();
        List<GridPos> allPositions = new ArrayList<>();
        for (Tile t : allTiles) {
            allPositions.add(t.getPos());
        }

        Map<Integer, List<Tile>> byColor = groupByColor(allTiles);
        List<Integer> selected = selectColorsToGuarantee(byColor, guaranteedColorCount);

        Map<Tile, GridPos> mapping = new LinkedHashMap<>();
        Set<GridPos> reserved = new HashSet<>();
        List<ShuffleResult.Guarantee> guarantees = new ArrayList<>();

        for (int color : selected) {
            List<Tile> colorTiles = byColor.get(color);
            int upper = Math.max(minGroupSize, Math.min(colorTiles.size(), MAX_CLUSTER_SIZE));
            int target = minGroupSize + random.nextInt(upper - minGroupSize + 1);

            List<GridPos> cluster = findRandomCluster(target, reserved);
            if (cluster.size() < minGroupSize) {
                System.out.println("[ShuffleService] shortfall: no free cluster of " + target
                        + " for color " + color + ", guarantee dropped");
                continue;
            }

            // first-N tiles of the color take the cluster
            for (int i = 0; i < cluster.size() && i < colorTiles.size(); i++) {
                mapping.put(colorTiles.get(i), cluster.get(i));
                reserved.add(cluster.get(i));
            }
            guarantees.add(new ShuffleResult.Guarantee(color, cluster));
        }

        List<GridPos> freePositions = new ArrayList<>();
        for (GridPos p : allPositions) {
            if (!reserved.contains(p)) freePositions.add(p);
        }
        List<Tile> freeTiles = new ArrayList<>();
        for (Tile t : allTiles) {
            if (!mapping.containsKey(t)) freeTiles.add(t);
        }

        fisherYates(freePositions, random);
        for (int i = 0; i < freeTiles.size() && i < freePositions.size(); i++) {
            mapping.put(freeTiles.get(i), freePositions.get(i));
        }

        commit(mapping);

        ShuffleResult result = new ShuffleResult(mapping, guaranteedColorCount, selected.size(), guarantees);
        if (guarantees.size() < guaranteedColorCount) {
            System.out.println("[ShuffleService] guaranteed " + guarantees.size() + " of "
                    + guaranteedColorCount + " requested colors (" + selected.size() + " eligible)");
        }
        return result;
    }

    private Map<Integer, List<Tile>> groupByColor(List<Tile> tiles) {
        Map<Integer, List<Tile>> result = new TreeMap<>();
        for (Tile t : tiles) {
            result.computeIfAbsent(t.getColorId(), k -> new ArrayList<>()).add(t);
        }
        return result;
    }

    List<Integer> selectColorsToGuarantee(Map<Integer, List<Tile>> byColor, int guaranteedColorCount) {
        List<Integer> eligible = new ArrayList<>();
        for (Map.Entry<Integer, List<Tile>> e : byColor.entrySet()) {
            if (e.getValue().size() >= minGroupSize) {
                eligible.add(e.getKey());
            }
        }
        fisherYates(eligible, random);
        int take = Math.max(0, Math.min(guaranteedColorCount, eligible.size()));
        return new ArrayList<>(eligible.subList(0, take));
    }

    /**
     * Up to {@code count} mutually adjacent occupied slots outside {@code reserved}.
     * Each attempt starts from a random free occupied slot and expands in random
     * neighbor order. The first attempt reaching {@code count} wins; otherwise the
     * largest attempt of at least the minimum size, or an empty list.
     */
    List<GridPos> findRandomCluster(int count, Set<GridPos> reserved) {
        List<GridPos> starts = new ArrayList<>();
        grid.forEach((tile, x, y) -> {
            GridPos p = new GridPos(x, y);
            if (!reserved.contains(p)) starts.add(p);
        });
        if (starts.isEmpty()) {
            return new ArrayList<>();
        }

        List<GridPos> best = new ArrayList<>();
        for (int attempt = 0; attempt < MAX_CLUSTER_ATTEMPTS; attempt++) {
            GridPos start = starts.get(random.nextInt(starts.size()));
            List<GridPos> found = expandFrom(start, count, reserved);

            if (found.size() >= count) {
                return found;
            }
            if (found.size() > best.size()) {
                best = found;
            }
        }
        return best.size() >= minGroupSize ? best : new ArrayList<>();
    }

    private List<GridPos> expandFrom(GridPos start, int count, Set<GridPos> reserved) {
        List<GridPos> result = new ArrayList<>();
        Deque<GridPos> queue = new ArrayDeque<>();
        Set<GridPos> visited = new HashSet<>();
        queue.add(start);
        visited.add(start);

        List<int[]> dirs = new ArrayList<>(Arrays.asList(DIRECTIONS));
        while (!queue.isEmpty() && result.size() < count) {
            GridPos current = queue.poll();
            result.add(current);

            fisherYates(dirs, random);
            for (int[] d : dirs) {
                GridPos n = current.offset(d[0], d[1]);
                if (!grid.isValid(n.x, n.y)) continue;
                if (visited.contains(n) || reserved.contains(n)) continue;
                if (grid.get(n.x, n.y) == null) continue;

                visited.add(n);
                queue.add(n);
            }
        }
        return result;
    }

    private void commit(Map<Tile, GridPos> mapping) {
        grid.clearAll();
        for (Map.Entry<Tile, GridPos> e : mapping.entrySet()) {
            Tile t = e.getKey();
            GridPos p = e.getValue();
            t.moveTo(p.x, p.y);
            grid.set(p.x, p.y, t);
        }
    }

    // ============================================
    // emergency fix
    // ============================================
    /**
     * Recolors tiles until the board has a playable group, bounded by the board size.
     */
    void resolveRemainingDeadlock(ShuffleResult result) {
        int limit = grid.getColumns() * grid.getRows();
        int fixes = 0;
        if (deadlockChecker.isDeadlocked()) {
            System.out.println("[WARN] Still deadlocked after shuffle, applying emergency fix");
        }
        while (fixes < limit && deadlockChecker.isDeadlocked()) {
            if (!emergencyFix(result)) {
                break;
            }
            fixes++;
        }

        boolean stuck = deadlockChecker.isDeadlocked();
        result.setStillDeadlocked(stuck);
        if (stuck) {
            System.err.println("[ERROR] Board still deadlocked after " + fixes + " emergency fixes");
        }
    }

    /**
     * First horizontally adjacent pair (row-major) with different colors: the right
     * tile takes the left tile's color. Falls back to vertical pairs.
     *
     * @return false if no pair could be recolored
     */
    boolean emergencyFix(ShuffleResult result) {
        for (int y = 0; y < grid.getRows(); y++) {
            for (int x = 0; x + 1 < grid.getColumns(); x++) {
                if (recolorIfDifferent(grid.get(x, y), grid.get(x + 1, y), result)) return true;
            }
        }
        for (int x = 0; x < grid.getColumns(); x++) {
            for (int y = 0; y + 1 < grid.getRows(); y++) {
                if (recolorIfDifferent(grid.get(x, y), grid.get(x, y + 1), result)) return true;
            }
        }
        return false;
    }

    private boolean recolorIfDifferent(Tile first, Tile second, ShuffleResult result) {
        if (first == null || second == null) return false;
        if (!first.canBeGrouped() || !second.canBeGrouped()) return false;
        if (first.getColorId() == second.getColorId()) return false;

        int old = second.getColorId();
        second.setColorId(first.getColorId());
        result.recordEmergencyFix(second, old);
        System.out.println("[ShuffleService] emergency fix: " + second + " recolored from " + old);
        return true;
    }

    static <T> void fisherYates(List<T> list, Random random) {
        for (int i = list.size() - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            T tmp = list.get(i);
            list.set(i, list.get(j));
            list.set(j, tmp);
        }
    }
}
