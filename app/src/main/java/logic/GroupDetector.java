package logic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import blocks.IconTier;
import blocks.Tile;
import component.ColorPalette;

/**
 * GroupDetector
 * -----------------------
 * - breadth-first flood fill over 4-connected neighbors (no diagonals)
 * - only IDLE tiles of the seed's color join a group
 * - groups smaller than the palette's minimum size are reported as null
 */
public class GroupDetector {

    static final int[] DX = { 0, 0, -1, 1 };
    static final int[] DY = { 1, -1, 0, 0 };

    private final GridState grid;
    private final ColorPalette palette;

    public GroupDetector(GridState grid, ColorPalette palette) {
        this.grid = grid;
        this.palette = palette;
    }

    public int getMinGroupSize() {
        return palette.minGroupSize();
    }

    /**
     * Maximal connected same-color component containing (seedX, seedY).
     *
     * @return the member tiles, or null if the seed is empty, not groupable,
     *         out of bounds, or the component is below the minimum size
     */
    public List<Tile> findGroup(int seedX, int seedY) {
        List<Tile> group = floodFill(seedX, seedY);
        if (group == null || group.size() < palette.minGroupSize()) {
            return null;
        }
        return group;
    }

    private List<Tile> floodFill(int seedX, int seedY) {
        Tile seed = grid.get(seedX, seedY);
        if (seed == null || !seed.canBeGrouped()) {
            return null;
        }

        boolean[][] visited = new boolean[grid.getColumns()][grid.getRows()];

        int color = seed.getColorId();
        List<Tile> group = new ArrayList<>();
        Deque<Tile> queue = new ArrayDeque<>();
        queue.add(seed);
        visited[seedX][seedY] = true;

        while (!queue.isEmpty()) {
            Tile t = queue.poll();
            group.add(t);

            for (int dir = 0; dir < 4; dir++) {
                int nx = t.getX() + DX[dir];
                int ny = t.getY() + DY[dir];
                if (!grid.isValid(nx, ny) || visited[nx][ny])
                    continue;

                Tile n = grid.get(nx, ny);
                if (n == null || n.getColorId() != color || !n.canBeGrouped())
                    continue;

                visited[nx][ny] = true;
                queue.add(n);
            }
        }
        return group;
    }

    /**
     * Rebuilds every tile's group size and icon tier.
     * Row-major scan; a qualifying group marks all its members visited,
     * anything smaller only marks the seed.
     */
    public void refreshAllGroupMetadata() {
        grid.forEach((tile, x, y) -> {
            if (tile.canBeGrouped()) {
                tile.resetGroupInfo();
            }
        });

        boolean[][] done = new boolean[grid.getColumns()][grid.getRows()];
        int groups = 0;

        for (int y = 0; y < grid.getRows(); y++) {
            for (int x = 0; x < grid.getColumns(); x++) {
                if (done[x][y]) continue;

                Tile tile = grid.get(x, y);
                if (tile == null || !tile.canBeGrouped()) {
                    done[x][y] = true;
                    continue;
                }

                List<Tile> group = findGroup(x, y);
                if (group != null) {
                    IconTier tier = palette.tierFor(group.size());
                    for (Tile member : group) {
                        member.setGroupInfo(group.size(), tier);
                        done[member.getX()][member.getY()] = true;
                    }
                    groups++;
                } else {
                    done[x][y] = true;
                }
            }
        }
        System.out.println("[GroupDetector] metadata refreshed, " + groups + " playable groups");
    }
}
