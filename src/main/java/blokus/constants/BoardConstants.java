package blokus.constants;

/**
 * Central place for the fixed geometry and sizes of the standard game.
 */
public final class BoardConstants {

    private BoardConstants() {}

    /* ────────────── Board geometry ────────────── */
    public static final int ROWS = 20;
    public static final int COLS = 20;

    /* ────────────── Players ──────────────────── */
    public static final int NUM_PLAYERS = 4;

    /* ────────────── Cell markers ──────────────── */
    // 0 = empty, player index + 1 otherwise (same encoding as the observation tensor)
    public static final byte EMPTY = 0;

    /* ────────────── Contact directions ─────────── */
    // {dRow, dCol}; order is irrelevant for the sets they build, kept stable anyway
    public static final int[][] EDGE_DIRS = {{0, 1}, {0, -1}, {-1, 0}, {1, 0}};
    public static final int[][] CORNER_DIRS = {{-1, 1}, {-1, -1}, {1, -1}, {1, 1}};

    /* ────────────── Utilities ─────────────────── */
    public static final double MIN_UTILITY = -1;
    public static final double MAX_UTILITY = 1;
}
