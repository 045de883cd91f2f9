package blokus.contracts;

import blokus.records.Move;
import blokus.state.Board;
import blokus.state.PlayerState;

public interface MoveGenerator {

  /** Placement rules for {@code player} on {@code board}; pass is not a placement. */
  boolean isLegal(Board board, PlayerState player, Move move);

  /**
   * Writes every legal placement index into {@code mv} starting at {@code n}, in ascending
   * order, and returns the new fill level. Does not add the pass action.
   */
  int generateLegal(Board board, PlayerState player, int[] mv, int n);
}
