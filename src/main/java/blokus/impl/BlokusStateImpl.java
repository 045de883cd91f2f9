package blokus.impl;

import blokus.contracts.GameState;
import blokus.contracts.IllegalMoveException;
import blokus.contracts.MoveCatalog;
import blokus.contracts.MoveGenerator;
import blokus.records.Move;
import blokus.state.Board;
import blokus.state.Player;
import blokus.state.PlayerState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One play-through. Owns its board, player records and ply stack; the move catalog and
 * generator are shared with every other state of the same game.
 *
 * <p>Turn cycle: P1 → P2 → P3 → P4 → P1 … A player that has passed (or placed every piece)
 * is finished, keeps receiving turns and can only pass. The game ends when all four are
 * finished.
 */
public final class BlokusStateImpl implements GameState {

  private static final Logger LOG = LoggerFactory.getLogger(BlokusStateImpl.class);

  /** {@link #winner()} value for a game that is undecided or drawn. */
  public static final int NO_WINNER = -1;

  /* ───────── ply record layout: action << 1 | finished-on-this-ply ───────── */
  private static final int FINISHED_BIT = 1;
  private static final int INITIAL_PLY_CAP = 128;

  private final MoveCatalog catalog;
  private final MoveGenerator gen;

  private final Board board;
  private final PlayerState[] players;
  private Player current;
  private int numDone;
  private int winner;

  private int[] plies;
  private int plyCount;

  // legal-action scratch, allocated on first use and never shared between copies
  private int[] scratch;

  BlokusStateImpl(MoveCatalog catalog, MoveGenerator gen) {
    this.catalog = catalog;
    this.gen = gen;
    this.board = new Board(catalog.rows(), catalog.cols());

    int numPieces = catalog.pieces().size();
    int initialScore = catalog.pieces().totalCells();
    Player[] seats = Player.values();
    this.players = new PlayerState[seats.length];
    for (Player p : seats) players[p.index()] = new PlayerState(p, numPieces, initialScore);

    this.current = Player.P1;
    this.numDone = 0;
    this.winner = NO_WINNER;
    this.plies = new int[INITIAL_PLY_CAP];
    this.plyCount = 0;
  }

  private BlokusStateImpl(BlokusStateImpl o) {
    this.catalog = o.catalog;
    this.gen = o.gen;
    this.board = o.board.copy();
    this.players = new PlayerState[o.players.length];
    for (int i = 0; i < players.length; i++) players[i] = o.players[i].copy();
    this.current = o.current;
    this.numDone = o.numDone;
    this.winner = o.winner;
    this.plies = Arrays.copyOf(o.plies, Math.max(o.plyCount, INITIAL_PLY_CAP));
    this.plyCount = o.plyCount;
  }

  /* ═════════════════════════ queries ═════════════════════════ */

  @Override
  public int currentPlayer() {
    return isTerminal() ? TERMINAL_PLAYER_ID : current.index();
  }

  @Override
  public boolean isTerminal() {
    return numDone == players.length;
  }

  @Override
  public int[] legalActions() {
    if (isTerminal()) return new int[0];

    PlayerState ps = players[current.index()];
    int pass = catalog.passAction();
    if (ps.isFinished()) return new int[] {pass};

    if (scratch == null) scratch = new int[catalog.size()];
    int n = gen.generateLegal(board, ps, scratch, 0);
    return n == 0 ? new int[] {pass} : Arrays.copyOf(scratch, n);
  }

  @Override
  public double[] returns() {
    double[] r = new double[players.length];
    if (!isTerminal() || winner == NO_WINNER) return r;
    Arrays.fill(r, -1);
    r[winner] = 1;
    return r;
  }

  /** Index of the sole lowest scorer once terminal, {@link #NO_WINNER} otherwise. */
  public int winner() {
    return winner;
  }

  public int score(int player) {
    return players[Player.of(player).index()].score();
  }

  public int[] scores() {
    int[] s = new int[players.length];
    for (int i = 0; i < s.length; i++) s[i] = players[i].score();
    return s;
  }

  /** Copy of one player's record. */
  public PlayerState playerState(int player) {
    return players[Player.of(player).index()].copy();
  }

  /** Copy of the grid. */
  public Board board() {
    return board.copy();
  }

  public int finishedPlayers() {
    return numDone;
  }

  public MoveCatalog catalog() {
    return catalog;
  }

  /* ═════════════════════════ transitions ═════════════════════════ */

  @Override
  public void applyAction(int action) {
    if (isTerminal())
      throw new IllegalStateException("game is over, cannot apply action " + action);
    checkAction(action);

    PlayerState ps = players[current.index()];
    int pass = catalog.passAction();

    if (action != pass) {
      Move move = catalog.move(action);
      if (ps.isFinished())
        throw new IllegalMoveException(current.index(), action, "player has already finished");
      if (!gen.isLegal(board, ps, move))
        throw new IllegalMoveException(current.index(), action, describe(move));

      board.place(move, current);
      ps.playPiece(move.piece(), move.size());
    }

    boolean finishedNow = false;
    if (!ps.isFinished() && (ps.piecesRemaining() == 0 || action == pass)) {
      ps.setFinished(true);
      numDone++;
      finishedNow = true;
      LOG.debug("{} finished with score {} ({} of {} done)",
              current, ps.score(), numDone, players.length);
      if (numDone == players.length) {
        winner = winnerOf(scores());
        LOG.debug("game over, scores {} winner {}", Arrays.toString(scores()),
                winner == NO_WINNER ? "none" : Player.of(winner));
      }
    }

    pushPly(action, finishedNow);
    current = current.next();
  }

  @Override
  public void undoAction(int player, int action) {
    Player who = Player.of(player);
    checkAction(action);
    if (plyCount == 0) throw new IllegalStateException("no action to undo");

    int rec = plies[plyCount - 1];
    int lastAction = rec >>> 1;
    Player mover = current.previous();
    if (mover != who || lastAction != action)
      throw new IllegalStateException("undo (" + player + ", " + action + ") does not match last ply ("
              + mover.index() + ", " + lastAction + ")");

    PlayerState ps = players[who.index()];
    if ((rec & FINISHED_BIT) != 0) {
      winner = NO_WINNER;
      ps.setFinished(false);
      numDone--;
    }
    if (action != catalog.passAction()) {
      Move move = catalog.move(action);
      board.clear(move);
      ps.returnPiece(move.piece(), move.size());
    }

    plyCount--;
    current = mover;
  }

  @Override
  public BlokusStateImpl copy() {
    return new BlokusStateImpl(this);
  }

  /**
   * Sole strictly-lowest score wins; any tie for the minimum, however many players
   * share it, is a draw.
   */
  static int winnerOf(int[] scores) {
    int min = Integer.MAX_VALUE, at = NO_WINNER, ties = 0;
    for (int i = 0; i < scores.length; i++) {
      if (scores[i] < min) {
        min = scores[i];
        at = i;
        ties = 1;
      } else if (scores[i] == min) {
        ties++;
      }
    }
    return ties == 1 ? at : NO_WINNER;
  }

  private void pushPly(int action, boolean finishedNow) {
    if (plyCount == plies.length) plies = Arrays.copyOf(plies, plies.length * 2);
    plies[plyCount++] = (action << 1) | (finishedNow ? FINISHED_BIT : 0);
  }

  private void checkAction(int action) {
    if (action < 0 || action > catalog.passAction())
      throw new IllegalArgumentException("action " + action + " outside [0, "
              + catalog.passAction() + "]");
  }

  private String describe(Move move) {
    return catalog.pieces().piece(move.piece()).name() + " " + positions(move)
            + " breaks the placement rules";
  }

  /* ═════════════════════════ rendering / observation ═════════════════════════ */

  @Override
  public String actionToString(int player, int action) {
    Player.of(player);
    checkAction(action);
    if (action == catalog.passAction()) return "Null move";
    Move move = catalog.move(action);
    return catalog.pieces().piece(move.piece()).name() + " at " + positions(move);
  }

  private String positions(Move move) {
    StringJoiner sj = new StringJoiner(", ", "Positions: ", "");
    int cols = catalog.cols();
    for (int c : move.cells()) sj.add("(" + c / cols + ", " + c % cols + ")");
    return sj.toString();
  }

  @Override
  public String observationString(int player) {
    Player.of(player);
    return toString();
  }

  @Override
  public String informationStateString(int player) {
    Player.of(player);
    StringJoiner sj = new StringJoiner(" ");
    for (int i = 0; i < plyCount; i++) sj.add(Integer.toString(plies[i] >>> 1));
    return sj.toString();
  }

  @Override
  public float[] observationTensor(int player) {
    float[] values = new float[board.numCells()];
    observationTensor(player, values);
    return values;
  }

  @Override
  public void observationTensor(int player, float[] values) {
    Player.of(player);
    board.markers(values);
  }

  @Override
  public List<Integer> history() {
    List<Integer> out = new ArrayList<>(plyCount);
    for (int i = 0; i < plyCount; i++) out.add(plies[i] >>> 1);
    return Collections.unmodifiableList(out);
  }

  @Override
  public String toString() {
    return BoardRenderer.render(board);
  }

  /* ═════════════════════════ identity ═════════════════════════ */

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof BlokusStateImpl s)) return false;
    return catalog == s.catalog
            && current == s.current
            && numDone == s.numDone
            && winner == s.winner
            && board.equals(s.board)
            && Arrays.equals(players, s.players)
            && Arrays.equals(plies, 0, plyCount, s.plies, 0, s.plyCount);
  }

  @Override
  public int hashCode() {
    int h = board.hashCode();
    h = 31 * h + Arrays.hashCode(players);
    h = 31 * h + current.hashCode();
    return 31 * h + plyCount;
  }
}
