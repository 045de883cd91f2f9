package blokus.impl;

import java.util.Random;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.*;

/**
 * Legal-action enumeration and apply/undo throughput on positions reached by seeded
 * random play, plus a cold catalog build.
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Thread)
public class LegalActionsBenchmark {

  /* ── engine wiring ─────────────────────────────────────────── */
  private static final BlokusGameImpl GAME = new BlokusGameImpl();

  @Param({"0", "16", "40"})
  public int plies;

  private BlokusStateImpl position;

  /* ── reach the sample position once per trial ─────────────── */
  @Setup(Level.Trial)
  public void init() {
    Random rnd = new Random(0xB10C05L);
    position = GAME.newInitialState();
    for (int i = 0; i < plies && !position.isTerminal(); i++) {
      int[] legal = position.legalActions();
      position.applyAction(legal[rnd.nextInt(legal.length)]);
    }
    if (position.isTerminal())
      throw new IllegalStateException("sample game ended before ply " + plies);
  }

  @Benchmark
  public int[] legalActions() {
    return position.legalActions();
  }

  @Benchmark
  public int applyUndoAll() {
    int player = position.currentPlayer();
    int n = 0;
    for (int a : position.legalActions()) {
      position.applyAction(a);
      position.undoAction(player, a);
      n++;
    }
    return n;
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  @OutputTimeUnit(TimeUnit.MILLISECONDS)
  public MoveCatalogImpl buildCatalog() {
    return new MoveCatalogImpl(new PieceCatalogImpl(), 20, 20);
  }
}
