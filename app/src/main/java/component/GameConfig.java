package component;

import java.util.Arrays;

/**
 * GameConfig
 * -----------------------
 * - board size, palette and shuffle settings for one level
 * - layout: optional row-major color ids, bottom row first (length = columns * rows)
 * - animated = false runs every pipeline phase synchronously (headless play, tests)
 */
public final class GameConfig {

    public static final int DEFAULT_GUARANTEED_COLORS = 1;

    private final int columns;
    private final int rows;
    private final ColorPalette palette;
    private final int guaranteedColorCount;
    private final int[] layout;
    private final boolean animated;

    public GameConfig(int columns, int rows, ColorPalette palette, int guaranteedColorCount,
                      int[] layout, boolean animated) {
        if (columns <= 0 || rows <= 0) {
            throw new IllegalArgumentException("board must be at least 1x1, got " + columns + "x" + rows);
        }
        if (palette == null) {
            throw new IllegalArgumentException("palette is required");
        }
        if (guaranteedColorCount < 0) {
            throw new IllegalArgumentException("guaranteedColorCount must be >= 0, got " + guaranteedColorCount);
        }
        if (layout != null && layout.length != columns * rows) {
            throw new IllegalArgumentException(
                    "layout has " + layout.length + " cells, expected " + (columns * rows));
        }
        this.columns = columns;
        this.rows = rows;
        this.palette = palette;
        this.guaranteedColorCount = guaranteedColorCount;
        this.layout = layout == null ? null : layout.clone();
        this.animated = animated;
    }

    public GameConfig(int columns, int rows, ColorPalette palette) {
        this(columns, rows, palette, DEFAULT_GUARANTEED_COLORS, null, false);
    }

    public int columns() { return columns; }
    public int rows() { return rows; }
    public ColorPalette palette() { return palette; }
    public int minGroupSize() { return palette.minGroupSize(); }
    public int guaranteedColorCount() { return guaranteedColorCount; }
    public boolean animated() { return animated; }

    public boolean hasLayout() { return layout != null; }

    /** Color id at (x, y) from the layout, or -1 when there is none. */
    public int layoutColorAt(int x, int y) {
        if (layout == null || x < 0 || x >= columns || y < 0 || y >= rows) return -1;
        return layout[y * columns + x];
    }

    public int[] layout() {
        return layout == null ? null : layout.clone();
    }

    public GameConfig withLayout(int[] newLayout) {
        return new GameConfig(columns, rows, palette, guaranteedColorCount, newLayout, animated);
    }

    public GameConfig withAnimated(boolean value) {
        return new GameConfig(columns, rows, palette, guaranteedColorCount, layout, value);
    }

    public GameConfig withGuaranteedColorCount(int count) {
        return new GameConfig(columns, rows, palette, count, layout, animated);
    }

    @Override public String toString() {
        return "GameConfig{" + columns + "x" + rows + ", palette=" + palette.size()
                + " colors, min=" + minGroupSize() + ", guaranteed=" + guaranteedColorCount
                + ", layout=" + (layout == null ? "random" : Arrays.toString(layout))
                + ", animated=" + animated + "}";
    }
}
