package blokus.records;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Immutable named polyomino.
 *
 * @param index catalog position (0-based); fixes move-index numbering
 * @param name  short display name, e.g. {@code "L5"}
 * @param cells canonical shape: unique offsets anchored at row 0 / col 0, row-major order
 */
public record Piece(int index, String name, List<Offset> cells) {

  public Piece {
    if (index < 0) throw new IllegalArgumentException("negative piece index " + index);
    if (name == null || name.isBlank()) throw new IllegalArgumentException("piece needs a name");
    if (cells == null || cells.isEmpty())
      throw new IllegalArgumentException("piece " + name + " has no cells");
    cells = canonical(cells);
  }

  /** Number of unit cells; this is what a placement subtracts from the score. */
  public int size() {
    return cells.size();
  }

  @Override
  public String toString() {
    return name;
  }

  /**
   * Re-anchors a shape so its minimum row and column are both 0, drops duplicates
   * and returns the offsets in row-major order.
   */
  public static List<Offset> canonical(Collection<Offset> shape) {
    int minRow = Integer.MAX_VALUE, minCol = Integer.MAX_VALUE;
    for (Offset o : shape) {
      minRow = Math.min(minRow, o.row());
      minCol = Math.min(minCol, o.col());
    }
    TreeSet<Offset> out = new TreeSet<>();
    for (Offset o : shape) out.add(o.translate(-minRow, -minCol));
    return List.copyOf(out);
  }
}
