package blokus.impl;

import blokus.contracts.PieceCatalog;
import blokus.records.Offset;
import blokus.records.Piece;

import java.util.ArrayList;
import java.util.List;

public final class PieceCatalogImpl implements PieceCatalog {

  /* ───────── standard piece set, catalog order ───────── */
  private static final String[] NAMES = {
          "I1", "I2", "I3", "I4", "I5", "L5", "Y", "N", "V3", "U", "V5",
          "Z5", "X", "T5", "W", "P", "F", "O4", "L4", "T4", "Z4"
  };

  // {row, col} pairs, flattened
  private static final int[][] SHAPES = {
          {0, 0},
          {0, 0, 1, 0},
          {0, 0, 1, 0, 2, 0},
          {0, 0, 1, 0, 2, 0, 3, 0},
          {0, 0, 1, 0, 2, 0, 3, 0, 4, 0},
          {0, 0, 0, 1, 0, 2, 0, 3, 1, 3},
          {0, 0, 0, 1, 0, 2, 0, 3, 1, 1},
          {0, 0, 0, 1, 0, 2, 1, 2, 1, 3},
          {0, 0, 1, 0, 1, 1},
          {0, 0, 0, 1, 1, 1, 2, 0, 2, 1},
          {0, 0, 1, 0, 2, 0, 2, 1, 2, 2},
          {0, 0, 0, 1, 1, 1, 2, 1, 2, 2},
          {0, 1, 1, 0, 1, 1, 1, 2, 2, 1},
          {0, 0, 0, 1, 0, 2, 1, 1, 2, 1},
          {0, 0, 1, 0, 1, 1, 2, 1, 2, 2},
          {0, 0, 0, 1, 1, 0, 1, 1, 2, 0},
          {0, 1, 0, 2, 1, 0, 1, 1, 2, 1},
          {0, 0, 0, 1, 1, 0, 1, 1},
          {0, 0, 0, 1, 0, 2, 1, 2},
          {0, 0, 0, 1, 0, 2, 1, 1},
          {0, 0, 0, 1, 1, 1, 1, 2},
  };

  private final List<Piece> pieces;
  private final List<List<List<Offset>>> orientations;

  /** The standard 21-piece set. */
  public PieceCatalogImpl() {
    this(standardPieces());
  }

  public PieceCatalogImpl(List<Piece> pieces) {
    if (pieces.isEmpty()) throw new IllegalArgumentException("empty piece set");
    for (int i = 0; i < pieces.size(); i++) {
      if (pieces.get(i).index() != i)
        throw new IllegalArgumentException(
                "piece " + pieces.get(i).name() + " has index " + pieces.get(i).index()
                        + " but sits at position " + i);
    }
    this.pieces = List.copyOf(pieces);

    List<List<List<Offset>>> all = new ArrayList<>(pieces.size());
    for (Piece p : this.pieces) all.add(List.copyOf(enumerateOrientations(p.cells())));
    this.orientations = List.copyOf(all);
  }

  public static List<Piece> standardPieces() {
    List<Piece> out = new ArrayList<>(NAMES.length);
    for (int i = 0; i < NAMES.length; i++) {
      int[] flat = SHAPES[i];
      List<Offset> cells = new ArrayList<>(flat.length / 2);
      for (int k = 0; k < flat.length; k += 2) cells.add(new Offset(flat[k], flat[k + 1]));
      out.add(new Piece(i, NAMES[i], cells));
    }
    return out;
  }

  @Override
  public int size() {
    return pieces.size();
  }

  @Override
  public Piece piece(int index) {
    if (index < 0 || index >= pieces.size())
      throw new IllegalArgumentException("piece index out of range: " + index);
    return pieces.get(index);
  }

  @Override
  public List<Piece> pieces() {
    return pieces;
  }

  @Override
  public List<List<Offset>> orientations(int piece) {
    if (piece < 0 || piece >= pieces.size())
      throw new IllegalArgumentException("piece index out of range: " + piece);
    return orientations.get(piece);
  }

  /* =====================================================================
   *  Orientation enumeration
   *
   *  base, flip(base), then three times: rotate, flip(rotated).
   *  A shape is kept only the first time it shows up.
   * ===================================================================== */
  static List<List<Offset>> enumerateOrientations(List<Offset> base) {
    List<List<Offset>> out = new ArrayList<>(8);

    List<Offset> rotated = Piece.canonical(base);
    addIfNew(out, rotated);
    addIfNew(out, flip(rotated));

    for (int i = 0; i < 3; i++) {
      rotated = rotate90(rotated);
      addIfNew(out, rotated);
      addIfNew(out, flip(rotated));
    }
    return out;
  }

  private static void addIfNew(List<List<Offset>> out, List<Offset> shape) {
    if (!out.contains(shape)) out.add(shape);
  }

  /** Mirror across the horizontal axis: (r, c) → (-r, c). */
  static List<Offset> flip(List<Offset> shape) {
    List<Offset> t = new ArrayList<>(shape.size());
    for (Offset o : shape) t.add(new Offset(-o.row(), o.col()));
    return Piece.canonical(t);
  }

  /** Quarter turn: (r, c) → (-c, r). */
  static List<Offset> rotate90(List<Offset> shape) {
    List<Offset> t = new ArrayList<>(shape.size());
    for (Offset o : shape) t.add(new Offset(-o.col(), o.row()));
    return Piece.canonical(t);
  }
}
