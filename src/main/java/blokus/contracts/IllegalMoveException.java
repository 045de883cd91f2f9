package blokus.contracts;

/**
 * A placement was applied that the current position does not allow. Callers are expected
 * to pick actions from {@link GameState#legalActions()}, so this signals a caller bug.
 */
public class IllegalMoveException extends IllegalStateException {

  private final int player;
  private final int action;

  public IllegalMoveException(int player, int action, String reason) {
    super("illegal action " + action + " for player " + player + ": " + reason);
    this.player = player;
    this.action = action;
  }

  public int player() {
    return player;
  }

  public int action() {
    return action;
  }
}
