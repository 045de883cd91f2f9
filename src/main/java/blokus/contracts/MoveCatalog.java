package blokus.contracts;

import blokus.records.Move;

/**
 * Every placement of every piece orientation that fits on an empty board.
 * Built once per game definition; read-only afterwards.
 */
public interface MoveCatalog {

  int rows();

  int cols();

  /** Number of placements. Also the index of the pass action. */
  int size();

  Move move(int index);

  PieceCatalog pieces();

  /** First move index belonging to {@code piece}. */
  int pieceStart(int piece);

  /** One past the last move index belonging to {@code piece}. */
  int pieceEnd(int piece);

  /** Ascending indices of all moves whose cell set contains {@code cell}. */
  int[] movesCovering(int cell);

  default int passAction() {
    return size();
  }

  default int cellIndex(int row, int col) {
    return row * cols() + col;
  }
}
