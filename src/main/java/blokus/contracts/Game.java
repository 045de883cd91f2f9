package blokus.contracts;

/**
 * A game definition. Owns the shared catalogs and spawns independent play-throughs.
 */
public interface Game {

  String shortName();

  String longName();

  GameState newInitialState();

  /** Placements plus the pass action. */
  int numDistinctActions();

  int numPlayers();

  double minUtility();

  double maxUtility();

  /** Upper bound on placements in one game. */
  int maxGameLength();

  int[] observationTensorShape();

  PieceCatalog pieces();

  MoveCatalog moves();
}
