package blokus.impl;

import static org.junit.jupiter.api.Assertions.*;

import blokus.contracts.MoveCatalog;
import blokus.records.Move;
import blokus.state.Board;
import blokus.state.Player;
import blokus.state.PlayerState;
import java.util.Arrays;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class MoveGeneratorImplTest {

  /* ── wiring ───────────────────────────────────────────────────── */
  private static final PieceCatalogImpl PIECES = new PieceCatalogImpl();
  private static final MoveCatalog CATALOG = new MoveCatalogImpl(PIECES, 20, 20);
  private static final MoveGeneratorImpl GEN = new MoveGeneratorImpl(CATALOG);

  private static final int I1 = 0, I2 = 1;

  private Board board;

  @BeforeEach
  void freshBoard() {
    board = new Board(20, 20);
  }

  /* ── first placement ──────────────────────────────────────────── */

  @ParameterizedTest
  @EnumSource(Player.class)
  void firstMovesAreExactlyThoseCoveringTheStartCorner(Player p) {
    PlayerState ps = fresh(p);
    int corner = p.startCell(20, 20);

    int[] legal = generate(ps);
    assertEquals(58, legal.length);

    int k = 0;
    for (int i = 0; i < CATALOG.size(); i++) {
      boolean covers = CATALOG.move(i).covers(corner);
      assertEquals(covers, GEN.isLegal(board, ps, CATALOG.move(i)), "move " + i);
      if (covers) assertEquals(i, legal[k++], "legal list out of order");
    }
    assertEquals(legal.length, k);
  }

  @Test
  void startCornersSitInTheFourBoardCorners() {
    assertEquals(399, Player.P1.startCell(20, 20));
    assertEquals(380, Player.P2.startCell(20, 20));
    assertEquals(0, Player.P3.startCell(20, 20));
    assertEquals(19, Player.P4.startCell(20, 20));
  }

  /* ── subsequent placements ────────────────────────────────────── */

  @Test
  void cornerContactIsRequiredAndEdgeContactForbidden() {
    PlayerState ps = fresh(Player.P1);
    play(ps, CATALOG.move(399)); // I1 on (19,19)

    // horizontal I2 on (18,17),(18,18): touches (19,19) only at a corner
    assertTrue(GEN.isLegal(board, ps, CATALOG.move(find(I2, 377, 378))));
    // vertical I2 on (17,19),(18,19): edge-adjacent to (19,19)
    assertFalse(GEN.isLegal(board, ps, CATALOG.move(find(I2, 359, 379))));
    // far away, no contact at all
    assertFalse(GEN.isLegal(board, ps, CATALOG.move(find(I2, 0, 1))));
  }

  @Test
  void playedPieceIsNoLongerAvailable() {
    PlayerState ps = fresh(Player.P1);
    play(ps, CATALOG.move(399));

    // geometrically fine, but the monomino is gone
    assertFalse(GEN.isLegal(board, ps, CATALOG.move(378)));
    for (int idx : generate(ps)) assertNotEquals(I1, CATALOG.move(idx).piece());
  }

  @Test
  void occupiedCellsBlockPlacement() {
    PlayerState ps = fresh(Player.P1);
    play(ps, CATALOG.move(399));
    Move target = CATALOG.move(find(I2, 377, 378));
    assertTrue(GEN.isLegal(board, ps, target));

    board.place(CATALOG.move(377), Player.P2);
    assertFalse(GEN.isLegal(board, ps, target));
  }

  @Test
  void opponentCellsDoNotSatisfyCornerContact() {
    PlayerState ps = fresh(Player.P1);
    play(ps, CATALOG.move(399));
    board.place(CATALOG.move(0), Player.P3);

    // diagonal to P3's (0,0) only
    assertFalse(GEN.isLegal(board, ps, CATALOG.move(21)));
  }

  @Test
  void generatedListMatchesIsLegalScan() {
    PlayerState ps = fresh(Player.P1);
    play(ps, CATALOG.move(399));

    int[] legal = generate(ps);
    assertEquals(106, legal.length);
    int k = 0;
    for (int i = 0; i < CATALOG.size(); i++) {
      if (GEN.isLegal(board, ps, CATALOG.move(i))) assertEquals(i, legal[k++]);
    }
    assertEquals(legal.length, k);
  }

  /** Second-move counts summed over every opening placement of P1. */
  @Test
  void secondMoveTotalOverAllOpenings() {
    long total = 0;
    for (int first : CATALOG.movesCovering(399)) {
      board = new Board(20, 20);
      PlayerState ps = fresh(Player.P1);
      play(ps, CATALOG.move(first));
      total += generate(ps).length;
    }
    assertEquals(9729, total);
  }

  /* ── helpers ──────────────────────────────────────────────────── */

  private static PlayerState fresh(Player p) {
    return new PlayerState(p, PIECES.size(), PIECES.totalCells());
  }

  private void play(PlayerState ps, Move m) {
    board.place(m, ps.player());
    ps.playPiece(m.piece(), m.size());
  }

  private int[] generate(PlayerState ps) {
    int[] buf = new int[CATALOG.size()];
    return Arrays.copyOf(buf, GEN.generateLegal(board, ps, buf, 0));
  }

  private static int find(int piece, int... cells) {
    for (int i = CATALOG.pieceStart(piece); i < CATALOG.pieceEnd(piece); i++) {
      if (Arrays.equals(CATALOG.move(i).cells(), cells)) return i;
    }
    throw new AssertionError("no " + PIECES.piece(piece) + " on " + Arrays.toString(cells));
  }
}
