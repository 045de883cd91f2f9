package blokus.impl;

import blokus.state.Board;

/**
 * Text rendering of a board: one line per row, markers separated by spaces.
 */
public final class BoardRenderer {

  private static final String ESC = "\033";
  private static final String RESET = ESC + "[0m";
  private static final String[] COLORS = {
          ESC + "[1;33m", ESC + "[1;34m", ESC + "[1;35m", ESC + "[1;36m"
  };

  private BoardRenderer() {}

  public static String render(Board board) {
    return render(board, false);
  }

  public static String render(Board board, boolean ansi) {
    StringBuilder sb = new StringBuilder(board.numCells() * 2 + board.rows());
    for (int r = 0; r < board.rows(); r++) {
      for (int c = 0; c < board.cols(); c++) {
        int m = board.get(r, c);
        if (m == 0 || !ansi) {
          sb.append(m);
        } else {
          sb.append(COLORS[(m - 1) % COLORS.length]).append(m).append(RESET);
        }
        sb.append(' ');
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
