package blokus.state;

import java.util.Arrays;

/**
 * Per-player bookkeeping: which pieces are still in hand, how many cells they add up to,
 * and where the player stands in the turn cycle.
 */
public final class PlayerState {

  private final Player player;
  private final boolean[] available;
  private int remaining;
  private int score;
  private boolean firstMove;
  private boolean finished;

  public PlayerState(Player player, int numPieces, int initialScore) {
    this.player = player;
    this.available = new boolean[numPieces];
    Arrays.fill(available, true);
    this.remaining = numPieces;
    this.score = initialScore;
    this.firstMove = true;
    this.finished = false;
  }

  private PlayerState(PlayerState o) {
    this.player = o.player;
    this.available = o.available.clone();
    this.remaining = o.remaining;
    this.score = o.score;
    this.firstMove = o.firstMove;
    this.finished = o.finished;
  }

  public Player player() {
    return player;
  }

  public boolean hasPiece(int piece) {
    return available[piece];
  }

  public int piecesRemaining() {
    return remaining;
  }

  /** Cells still in hand; lower is better. */
  public int score() {
    return score;
  }

  public boolean isFirstMove() {
    return firstMove;
  }

  public boolean isFinished() {
    return finished;
  }

  public void playPiece(int piece, int size) {
    available[piece] = false;
    remaining--;
    score -= size;
    firstMove = false;
  }

  public void returnPiece(int piece, int size) {
    available[piece] = true;
    remaining++;
    score += size;
    firstMove = remaining == available.length;
  }

  public void setFinished(boolean finished) {
    this.finished = finished;
  }

  public PlayerState copy() {
    return new PlayerState(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PlayerState p)) return false;
    return player == p.player
            && remaining == p.remaining
            && score == p.score
            && firstMove == p.firstMove
            && finished == p.finished
            && Arrays.equals(available, p.available);
  }

  @Override
  public int hashCode() {
    int h = player.hashCode();
    h = 31 * h + remaining;
    h = 31 * h + score;
    h = 31 * h + (firstMove ? 1 : 0);
    h = 31 * h + (finished ? 1 : 0);
    return 31 * h + Arrays.hashCode(available);
  }

  @Override
  public String toString() {
    return player + "{remaining=" + remaining + ", score=" + score
            + (firstMove ? ", first" : "") + (finished ? ", finished" : "") + '}';
  }
}
