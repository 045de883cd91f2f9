package blokus.records;

import com.typesafe.config.Config;

/**
 * Settings for the random self-play driver, read from the {@code blokus} config tree.
 *
 * @param games            number of games to play
 * @param seed             base RNG seed; game {@code i} uses {@code seed + i}
 * @param renderFinalBoard log the final board of each game
 * @param ansi             colour rendered boards
 * @param benchDepth       perft depth for {@code bench}
 */
public record SelfPlayConfig(int games, long seed, boolean renderFinalBoard, boolean ansi, int benchDepth) {

    public SelfPlayConfig {
        if (games <= 0) throw new IllegalArgumentException("games must be positive, got " + games);
        if (benchDepth < 0) throw new IllegalArgumentException("bench depth must be >= 0, got " + benchDepth);
    }

    public static SelfPlayConfig from(Config config) {
        Config sp = config.getConfig("blokus.selfplay");
        return new SelfPlayConfig(
                sp.getInt("games"),
                sp.getLong("seed"),
                sp.getBoolean("render-final-board"),
                sp.getBoolean("ansi"),
                config.getInt("blokus.bench.depth"));
    }
}
