package blokus.main;

import blokus.contracts.GameState;

/**
 * Leaf-node count of the game tree to a fixed depth, walked with apply/undo on one state.
 */
public final class Perft {

  private Perft() {}

  public static long perft(GameState state, int depth) {
    if (depth == 0 || state.isTerminal()) return 1;

    int[] actions = state.legalActions();
    if (depth == 1) return actions.length;

    int player = state.currentPlayer();
    long nodes = 0;
    for (int a : actions) {
      state.applyAction(a);
      nodes += perft(state, depth - 1);
      state.undoAction(player, a);
    }
    return nodes;
  }
}
