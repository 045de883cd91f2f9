package blokus.main;

import static org.junit.jupiter.api.Assertions.*;

import blokus.impl.BlokusGameImpl;
import blokus.records.GameSummary;
import blokus.records.SelfPlayConfig;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class SelfPlayTest {

    private static final BlokusGameImpl GAME = new BlokusGameImpl();

    @Test
    void sameSeedSameGames() {
        SelfPlayConfig cfg = new SelfPlayConfig(3, 99L, false, false, 1);
        List<GameSummary> first = new SelfPlay(GAME, cfg).run();
        List<GameSummary> second = new SelfPlay(GAME, cfg).run();
        assertEquals(first, second);
    }

    @Test
    void summariesAreConsistent() {
        SelfPlayConfig cfg = new SelfPlayConfig(2, 5L, true, true, 1);
        List<GameSummary> games = new SelfPlay(GAME, cfg).run();
        assertEquals(2, games.size());

        for (GameSummary g : games) {
            assertEquals(5L + g.game(), g.seed());
            assertTrue(g.placements() <= 84);
            assertTrue(g.plies() >= g.placements());
            assertEquals(g.isDraw() ? 0.0 : -2.0, Arrays.stream(g.returns()).sum(), 1e-12);
            if (g.isDraw()) {
                assertArrayEquals(new double[4], g.returns());
            } else {
                assertEquals(1.0, g.returns()[g.winner()]);
                int min = Arrays.stream(g.scores()).min().orElseThrow();
                assertEquals(min, g.scores()[g.winner()]);
            }
        }
    }
}
