package blokus.main;

import blokus.impl.BlokusGameImpl;
import blokus.impl.BlokusStateImpl;
import blokus.records.SelfPlayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the game definition and runs random self-play, or the perft bench with
 * {@code bench [depth]}.
 */
public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private Main() {}

    public static void main(String[] args) {
        SelfPlayConfig config = SelfPlayConfig.from(ConfigLoader.load());

        long t0 = System.nanoTime();
        BlokusGameImpl game = new BlokusGameImpl();
        LOG.info("Blokus: {} pieces, {} placements, catalog built in {} ms",
                game.pieces().size(), game.moves().size(), (System.nanoTime() - t0) / 1_000_000);

        if (args.length > 0 && "bench".equalsIgnoreCase(args[0])) {
            int depth = args.length > 1 ? Integer.parseInt(args[1]) : config.benchDepth();
            runPerftBench(game, depth);
            return;
        }

        new SelfPlay(game, config).run();
    }

    private static void runPerftBench(BlokusGameImpl game, int depth) {
        BlokusStateImpl root = game.newInitialState();

        long t0 = System.nanoTime();
        long nodes = Perft.perft(root, depth);
        long ms = (System.nanoTime() - t0) / 1_000_000;

        long nps = ms > 0 ? (1000L * nodes) / ms : 0;
        LOG.info("perft({}) = {} nodes in {} ms, {} nps", depth, nodes, ms, nps);
    }
}
