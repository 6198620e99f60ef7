package logic;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import blocks.Tile;
import blocks.TileState;

/**
 * BlastService
 * -----------------------
 * - checks that a group may be removed
 * - puts its tiles into BLASTING and waits for the animation layer
 * - clears their slots once every removal has been reported
 */
public class BlastService {

    private final GridState grid;
    private final AnimationManager animMgr;
    private final GroupDetector groupDetector;
    private final int minGroupSize;

    public BlastService(GridState grid, AnimationManager animMgr, GroupDetector groupDetector) {
        this.grid = grid;
        this.animMgr = animMgr;
        this.groupDetector = groupDetector;
        this.minGroupSize = groupDetector.getMinGroupSize();
    }

    /**
     * Starts removing {@code group}. {@code onComplete} runs after the slots are cleared.
     *
     * @throws InvalidGroupException see {@link #validate}; nothing is changed in that case
     */
    public void blast(List<Tile> group, Runnable onComplete) {
        validate(group);
        List<Tile> members = List.copyOf(group);
        System.out.println("[BlastService] Blasting " + members.size() + " tiles");

        animMgr.start(AnimationManager.AnimationType.BLAST, members,
                () -> {
                    for (Tile t : members) {
                        t.setState(TileState.BLASTING);
                    }
                },
                () -> {
                    removeFromGrid(members);
                    if (onComplete != null) {
                        onComplete.run();
                    }
                });
    }

    /**
     * @throws InvalidGroupException if the group is null, below the minimum size,
     *         has mixed colors or duplicates, holds a tile that is not IDLE
     *         or not at its recorded slot any more, or is not exactly the
     *         connected group around its first tile
     */
    public void validate(List<Tile> group) {
        if (group == null || group.isEmpty()) {
            throw new InvalidGroupException("group is empty");
        }
        if (group.size() < minGroupSize) {
            throw new InvalidGroupException("group of " + group.size() + " is below minimum " + minGroupSize);
        }

        int color = group.get(0).getColorId();
        Set<Tile> seen = new HashSet<>();
        for (Tile t : group) {
            if (t == null) {
                throw new InvalidGroupException("group contains null");
            }
            if (!seen.add(t)) {
                throw new InvalidGroupException("group lists " + t + " twice");
            }
            if (t.getColorId() != color) {
                throw new InvalidGroupException("group mixes colors " + color + " and " + t.getColorId());
            }
            if (!t.canBeGrouped()) {
                throw new InvalidGroupException(t + " cannot be grouped");
            }
            if (grid.get(t.getX(), t.getY()) != t) {
                throw new InvalidGroupException(t + " is not on the board");
            }
        }

        Tile first = group.get(0);
        List<Tile> connected = groupDetector.findGroup(first.getX(), first.getY());
        if (connected == null || connected.size() != seen.size() || !seen.containsAll(connected)) {
            throw new InvalidGroupException("tiles are not one connected group (listed " + seen.size()
                    + ", connected " + (connected == null ? 0 : connected.size()) + ")");
        }
    }

    /**
     * Empties the slots of the given (already removed) tiles.
     */
    public void removeFromGrid(List<Tile> group) {
        for (Tile t : group) {
            if (grid.get(t.getX(), t.getY()) == t) {
                grid.clear(t.getX(), t.getY());
            }
        }
        System.out.println("[BlastService] " + group.size() + " tiles destroyed");
    }
}
