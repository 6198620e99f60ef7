package blocks;

/**
 * Cosmetic icon tier of a tile, derived from the size of its group.
 */
public enum IconTier {
    DEFAULT,
    FIRST,
    SECOND,
    THIRD
}
