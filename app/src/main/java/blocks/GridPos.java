package blocks;

/**
 * Immutable (x, y) slot coordinate. y = 0 is the bottom row.
 */
public final class GridPos {
    public final int x;
    public final int y;

    public GridPos(int x, int y) {
        this.x = x;
        this.y = y;
    }

    public GridPos offset(int dx, int dy) {
        return new GridPos(x + dx, y + dy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GridPos other)) return false;
        return x == other.x && y == other.y;
    }

    @Override
    public int hashCode() {
        return 31 * x + y;
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
