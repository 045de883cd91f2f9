package blokus.contracts;

import java.util.List;

/**
 * Sequential, perfect-information game state as seen by search and self-play code.
 *
 * <p>Players are identified by index {@code 0..numPlayers-1}. Actions are dense indices
 * in {@code [0, numDistinctActions)}.
 */
public interface GameState {

  /** Returned by {@link #currentPlayer()} once the game is over. */
  int TERMINAL_PLAYER_ID = -4;

  int currentPlayer();

  /** Legal actions for the current player in ascending order; empty once terminal. */
  int[] legalActions();

  /**
   * Applies an action for the current player.
   *
   * @throws IllegalArgumentException action index out of range
   * @throws IllegalStateException    game already terminal, or the placement is illegal
   */
  void applyAction(int action);

  /**
   * Reverts the most recent {@link #applyAction}. {@code player} and {@code action}
   * must describe that ply exactly.
   */
  void undoAction(int player, int action);

  boolean isTerminal();

  /** Per-player returns; all zero until the game is terminal. */
  double[] returns();

  /** Independent deep copy; shared catalogs are not copied. */
  GameState copy();

  String actionToString(int player, int action);

  String observationString(int player);

  String informationStateString(int player);

  float[] observationTensor(int player);

  void observationTensor(int player, float[] values);

  List<Integer> history();
}
