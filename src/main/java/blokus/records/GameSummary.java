package blokus.records;

import java.util.Arrays;

/**
 * Result of one finished self-play game.
 *
 * @param game       0-based game number within the run
 * @param seed       RNG seed the game was played with
 * @param plies      actions applied, passes included
 * @param placements non-pass actions applied
 * @param scores     final cells left in hand, per player
 * @param returns    final returns, per player
 * @param winner     winning player index, or -1 for a draw
 */
public record GameSummary(int game, long seed, int plies, int placements,
                          int[] scores, double[] returns, int winner) {

    public boolean isDraw() {
        return winner < 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GameSummary g)) return false;
        return game == g.game && seed == g.seed && plies == g.plies && placements == g.placements
                && winner == g.winner
                && Arrays.equals(scores, g.scores) && Arrays.equals(returns, g.returns);
    }

    @Override
    public int hashCode() {
        int h = 31 * game + Long.hashCode(seed);
        h = 31 * h + plies;
        h = 31 * h + Arrays.hashCode(scores);
        return 31 * h + winner;
    }

    @Override
    public String toString() {
        return "game " + game + " (seed " + seed + "): " + plies + " plies, " + placements
                + " placements, scores " + Arrays.toString(scores)
                + (isDraw() ? ", draw" : ", winner P" + (winner + 1));
    }
}
