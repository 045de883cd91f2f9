package blokus.impl;

import blokus.constants.BoardConstants;
import blokus.contracts.Game;
import blokus.contracts.MoveCatalog;
import blokus.contracts.MoveGenerator;
import blokus.contracts.PieceCatalog;

/**
 * Standard four-player game on a 20x20 board. Building one of these builds the piece and
 * move catalogs; every state it hands out shares them.
 */
public final class BlokusGameImpl implements Game {

  private final PieceCatalog pieces;
  private final MoveCatalog moves;
  private final MoveGenerator generator;

  public BlokusGameImpl() {
    this(new PieceCatalogImpl());
  }

  public BlokusGameImpl(PieceCatalog pieces) {
    this.pieces = pieces;
    this.moves = new MoveCatalogImpl(pieces, BoardConstants.ROWS, BoardConstants.COLS);
    this.generator = new MoveGeneratorImpl(moves);
  }

  @Override
  public String shortName() {
    return "blokus";
  }

  @Override
  public String longName() {
    return "Blokus";
  }

  @Override
  public BlokusStateImpl newInitialState() {
    return new BlokusStateImpl(moves, generator);
  }

  @Override
  public int numDistinctActions() {
    return moves.size() + 1;
  }

  @Override
  public int numPlayers() {
    return BoardConstants.NUM_PLAYERS;
  }

  @Override
  public double minUtility() {
    return BoardConstants.MIN_UTILITY;
  }

  @Override
  public double maxUtility() {
    return BoardConstants.MAX_UTILITY;
  }

  @Override
  public int maxGameLength() {
    return pieces.size() * BoardConstants.NUM_PLAYERS;
  }

  @Override
  public int[] observationTensorShape() {
    return new int[] {moves.rows(), moves.cols()};
  }

  @Override
  public PieceCatalog pieces() {
    return pieces;
  }

  @Override
  public MoveCatalog moves() {
    return moves;
  }
}
