package component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import blocks.IconTier;

/**
 * ColorPalette
 * ---------------------
 * - ordered list of playable tile colors (id + display name)
 * - minimum legal group size (usually 2)
 * - tier thresholds A < B < C mapping a group size to an icon tier
 */
public class ColorPalette {

    public static final int DEFAULT_MIN_GROUP_SIZE = 2;
    public static final int DEFAULT_THRESHOLD_A = 4;
    public static final int DEFAULT_THRESHOLD_B = 7;
    public static final int DEFAULT_THRESHOLD_C = 9;

    public static final class TileColor {
        public final int id;
        public final String name;

        public TileColor(int id, String name) {
            this.id = id;
            this.name = name;
        }

        @Override
        public String toString() {
            return name + "#" + id;
        }
    }

    // === default palette (blue / green / red / yellow / purple / pink) ===
    private static final String[] DEFAULT_NAMES = { "BLUE", "GREEN", "RED", "YELLOW", "PURPLE", "PINK" };

    private final List<TileColor> colors;
    private final int minGroupSize;
    private final int thresholdA;
    private final int thresholdB;
    private final int thresholdC;

    public ColorPalette(List<TileColor> colors, int minGroupSize, int thresholdA, int thresholdB, int thresholdC) {
        if (colors == null || colors.isEmpty()) {
            throw new IllegalArgumentException("palette needs at least one color");
        }
        if (minGroupSize < 1) {
            throw new IllegalArgumentException("minGroupSize must be >= 1, got " + minGroupSize);
        }
        if (!(thresholdA < thresholdB && thresholdB < thresholdC)) {
            throw new IllegalArgumentException(
                    "thresholds must increase: A=" + thresholdA + ", B=" + thresholdB + ", C=" + thresholdC);
        }
        this.colors = Collections.unmodifiableList(new ArrayList<>(colors));
        this.minGroupSize = minGroupSize;
        this.thresholdA = thresholdA;
        this.thresholdB = thresholdB;
        this.thresholdC = thresholdC;
    }

    /**
     * First {@code colorCount} default colors with ids 0..n-1, default thresholds.
     */
    public static ColorPalette defaultPalette(int colorCount) {
        if (colorCount < 1 || colorCount > DEFAULT_NAMES.length) {
            throw new IllegalArgumentException("colorCount must be 1.." + DEFAULT_NAMES.length + ", got " + colorCount);
        }
        List<TileColor> list = new ArrayList<>();
        for (int i = 0; i < colorCount; i++) {
            list.add(new TileColor(i, DEFAULT_NAMES[i]));
        }
        return new ColorPalette(list, DEFAULT_MIN_GROUP_SIZE, DEFAULT_THRESHOLD_A, DEFAULT_THRESHOLD_B,
                DEFAULT_THRESHOLD_C);
    }

    public List<TileColor> colors() { return colors; }
    public int size() { return colors.size(); }
    public int minGroupSize() { return minGroupSize; }
    public int thresholdA() { return thresholdA; }
    public int thresholdB() { return thresholdB; }
    public int thresholdC() { return thresholdC; }

    public boolean isAvailable(int colorId) {
        for (TileColor c : colors) {
            if (c.id == colorId) return true;
        }
        return false;
    }

    public String nameOf(int colorId) {
        for (TileColor c : colors) {
            if (c.id == colorId) return c.name;
        }
        return "?" + colorId;
    }

    /** Uniform draw over the palette. */
    public int randomColorId(Random random) {
        return colors.get(random.nextInt(colors.size())).id;
    }

    /**
     * Pure function of the group size.
     */
    public IconTier tierFor(int groupSize) {
        if (groupSize > thresholdC) return IconTier.THIRD;
        if (groupSize > thresholdB) return IconTier.SECOND;
        if (groupSize > thresholdA) return IconTier.FIRST;
        return IconTier.DEFAULT;
    }

    @Override
    public String toString() {
        return "ColorPalette{colors=" + colors + ", min=" + minGroupSize
                + ", A=" + thresholdA + ", B=" + thresholdB + ", C=" + thresholdC + "}";
    }
}
