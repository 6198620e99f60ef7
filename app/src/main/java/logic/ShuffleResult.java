package logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import blocks.GridPos;
import blocks.Tile;

/**
 * ShuffleResult
 * -----------------------
 * - new slot of every tile
 * - which colors got a reserved cluster, and where
 * - shortfall: a selected color found no free cluster
 * - emergency fix: the tile recolored when the shuffle still left a deadlock
 */
public final class ShuffleResult {

    /** Reserved cluster for one guaranteed color. */
    public static final class Guarantee {
        public final int colorId;
        public final List<GridPos> positions;

        public Guarantee(int colorId, List<GridPos> positions) {
            this.colorId = colorId;
            this.positions = Collections.unmodifiableList(new ArrayList<>(positions));
        }

        @Override
        public String toString() {
            return "Guarantee{color=" + colorId + ", at=" + positions + "}";
        }
    }

    private final Map<Tile, GridPos> mapping;
    private final int requestedColors;
    private final int eligibleColors;
    private final List<Guarantee> guarantees;

    private Tile emergencyTile;
    private int emergencyOldColor = -1;
    private int emergencyFixCount = 0;
    private boolean stillDeadlocked = false;

    /**
     * @param requestedColors colors asked for
     * @param eligibleColors  colors actually selected (capped by how many colors have enough tiles)
     */
    public ShuffleResult(Map<Tile, GridPos> mapping, int requestedColors, int eligibleColors,
                         List<Guarantee> guarantees) {
        this.mapping = Collections.unmodifiableMap(new LinkedHashMap<>(mapping));
        this.requestedColors = requestedColors;
        this.eligibleColors = eligibleColors;
        this.guarantees = Collections.unmodifiableList(new ArrayList<>(guarantees));
    }

    public Map<Tile, GridPos> getMapping() { return mapping; }
    public int getRequestedColors() { return requestedColors; }
    public int getEligibleColors() { return eligibleColors; }
    public List<Guarantee> getGuarantees() { return guarantees; }
    public int getGuaranteedCount() { return guarantees.size(); }

    /** A selected color could not get a cluster. */
    public boolean isShortfall() {
        return guarantees.size() < eligibleColors;
    }

    // === emergency fix ===
    void recordEmergencyFix(Tile tile, int oldColor) {
        if (emergencyTile == null) {
            emergencyTile = tile;
            emergencyOldColor = oldColor;
        }
        emergencyFixCount++;
    }

    void setStillDeadlocked(boolean value) {
        this.stillDeadlocked = value;
    }

    public boolean isEmergencyFixApplied() { return emergencyFixCount > 0; }
    public int getEmergencyFixCount() { return emergencyFixCount; }
    public Tile getEmergencyTile() { return emergencyTile; }
    public int getEmergencyOldColor() { return emergencyOldColor; }
    public boolean isStillDeadlocked() { return stillDeadlocked; }

    @Override
    public String toString() {
        return "ShuffleResult{tiles=" + mapping.size() + ", guaranteed=" + guarantees.size() + "/" + requestedColors
                + ", emergencyFixes=" + emergencyFixCount + ", stillDeadlocked=" + stillDeadlocked + "}";
    }
}
