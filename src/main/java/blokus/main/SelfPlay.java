package blokus.main;

import blokus.impl.BlokusGameImpl;
import blokus.impl.BlokusStateImpl;
import blokus.impl.BoardRenderer;
import blokus.records.GameSummary;
import blokus.records.SelfPlayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Plays seeded games where every player picks uniformly among its legal actions.
 */
public final class SelfPlay {

    private static final Logger LOG = LoggerFactory.getLogger(SelfPlay.class);

    private final BlokusGameImpl game;
    private final SelfPlayConfig config;

    public SelfPlay(BlokusGameImpl game, SelfPlayConfig config) {
        this.game = game;
        this.config = config;
    }

    public List<GameSummary> run() {
        List<GameSummary> out = new ArrayList<>(config.games());
        int[] wins = new int[game.numPlayers()];
        int draws = 0;

        for (int i = 0; i < config.games(); i++) {
            GameSummary s = playOne(i, config.seed() + i);
            out.add(s);
            if (s.isDraw()) draws++;
            else wins[s.winner()]++;
        }

        StringBuilder tally = new StringBuilder();
        for (int p = 0; p < wins.length; p++) tally.append(" P").append(p + 1).append('=').append(wins[p]);
        LOG.info("{} games:{} draws={}", config.games(), tally, draws);
        return out;
    }

    public GameSummary playOne(int gameNo, long seed) {
        Random rnd = new Random(seed);
        BlokusStateImpl state = game.newInitialState();
        int pass = game.moves().passAction();
        int placements = 0;

        while (!state.isTerminal()) {
            int[] legal = state.legalActions();
            int action = legal[rnd.nextInt(legal.length)];
            if (action != pass) placements++;
            state.applyAction(action);
        }

        GameSummary summary = new GameSummary(gameNo, seed, state.history().size(), placements,
                state.scores(), state.returns(), state.winner());
        LOG.info("{}", summary);
        if (config.renderFinalBoard()) {
            LOG.info("final board of game {}:\n{}", gameNo, BoardRenderer.render(state.board(), config.ansi()));
        }
        return summary;
    }
}
