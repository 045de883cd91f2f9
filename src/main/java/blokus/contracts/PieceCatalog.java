package blokus.contracts;

import blokus.records.Offset;
import blokus.records.Piece;

import java.util.List;

public interface PieceCatalog {

  /** Number of pieces each player owns. */
  int size();

  Piece piece(int index);

  List<Piece> pieces();

  /**
   * Distinct orientations of a piece, in discovery order. The first entry is always
   * the base shape; there are between 1 and 8 entries.
   */
  List<List<Offset>> orientations(int piece);

  /** Sum of all piece sizes: the score every player starts with. */
  default int totalCells() {
    int sum = 0;
    for (Piece p : pieces()) sum += p.size();
    return sum;
  }
}
