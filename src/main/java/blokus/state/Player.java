package blokus.state;

import blokus.constants.BoardConstants;

/**
 * The four seats. Each owns one board corner that its first placement must cover.
 */
public enum Player {
  P1(true, true),
  P2(true, false),
  P3(false, false),
  P4(false, true);

  private static final Player[] VALUES = values();

  private final boolean bottom;
  private final boolean right;

  Player(boolean bottom, boolean right) {
    this.bottom = bottom;
    this.right = right;
  }

  /** Validating lookup from a raw player id. */
  public static Player of(int id) {
    if (id < 0 || id >= VALUES.length)
      throw new IllegalArgumentException("player id out of range: " + id);
    return VALUES[id];
  }

  public int index() {
    return ordinal();
  }

  /** Board marker for this player's cells. */
  public byte marker() {
    return (byte) (ordinal() + 1);
  }

  public Player next() {
    return VALUES[(ordinal() + 1) % BoardConstants.NUM_PLAYERS];
  }

  public Player previous() {
    return VALUES[(ordinal() + BoardConstants.NUM_PLAYERS - 1) % BoardConstants.NUM_PLAYERS];
  }

  public int startRow(int rows) {
    return bottom ? rows - 1 : 0;
  }

  public int startCol(int cols) {
    return right ? cols - 1 : 0;
  }

  /** Row-major index of the start corner on a {@code rows x cols} board. */
  public int startCell(int rows, int cols) {
    return startRow(rows) * cols + startCol(cols);
  }
}
