package blokus.impl;

import blokus.contracts.MoveCatalog;
import blokus.contracts.MoveGenerator;
import blokus.records.Move;
import blokus.state.Board;
import blokus.state.PlayerState;

/**
 * Placement rules.
 *
 * <ul>
 *   <li>first placement: must cover the player's start corner, nothing else is checked;</li>
 *   <li>afterwards: piece in hand, all cells empty, no own cell edge-adjacent,
 *       at least one own cell diagonally adjacent.</li>
 * </ul>
 */
public final class MoveGeneratorImpl implements MoveGenerator {

  private final MoveCatalog catalog;

  public MoveGeneratorImpl(MoveCatalog catalog) {
    this.catalog = catalog;
  }

  @Override
  public boolean isLegal(Board board, PlayerState player, Move move) {
    if (player.isFirstMove()) {
      return move.covers(startCell(player));
    }
    return player.hasPiece(move.piece()) && fits(board, player.player().marker(), move);
  }

  @Override
  public int generateLegal(Board board, PlayerState player, int[] mv, int n) {
    if (player.isFirstMove()) {
      for (int idx : catalog.movesCovering(startCell(player))) {
        if (player.hasPiece(catalog.move(idx).piece())) mv[n++] = idx;
      }
      return n;
    }

    byte own = player.player().marker();
    int pieces = catalog.pieces().size();
    for (int p = 0; p < pieces; p++) {
      if (!player.hasPiece(p)) continue;
      for (int i = catalog.pieceStart(p), end = catalog.pieceEnd(p); i < end; i++) {
        Move m = catalog.move(i);
        if (fits(board, own, m)) mv[n++] = i;
      }
    }
    return n;
  }

  private int startCell(PlayerState player) {
    return player.player().startCell(catalog.rows(), catalog.cols());
  }

  /* ───────── subsequent-move checks, cheapest rejection first ───────── */

  private static boolean fits(Board board, byte own, Move m) {
    for (int i = 0, n = m.size(); i < n; i++) {
      if (!board.isEmpty(m.cellAt(i))) return false;
    }
    for (int i = 0, n = m.neighborCount(); i < n; i++) {
      if (board.at(m.neighborAt(i)) == own) return false;
    }
    for (int i = 0, n = m.cornerCount(); i < n; i++) {
      if (board.at(m.cornerAt(i)) == own) return true;
    }
    return false;
  }
}
