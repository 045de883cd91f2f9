package blokus.records;

import java.util.Arrays;

/**
 * One concrete placement from the move catalog.
 *
 * <p>All cell arrays hold row-major cell indices ({@code row * cols + col}) in ascending
 * order. The record keeps private copies; the array accessors return fresh copies, and the
 * indexed accessors read without copying.
 *
 * @param index     dense action index of this placement
 * @param piece     catalog index of the placed piece
 * @param cells     the occupied cells
 * @param neighbors in-bounds cells edge-adjacent to the placement, excluding its own cells
 * @param corners   in-bounds cells diagonally adjacent to the placement that are neither
 *                  its own cells nor edge-adjacent to any of them
 */
public record Move(int index, int piece, int[] cells, int[] neighbors, int[] corners) {

  public Move {
    cells = cells.clone();
    neighbors = neighbors.clone();
    corners = corners.clone();
  }

  @Override
  public int[] cells() {
    return cells.clone();
  }

  @Override
  public int[] neighbors() {
    return neighbors.clone();
  }

  @Override
  public int[] corners() {
    return corners.clone();
  }

  public boolean covers(int cell) {
    return Arrays.binarySearch(cells, cell) >= 0;
  }

  public int size() {
    return cells.length;
  }

  public int cellAt(int i) {
    return cells[i];
  }

  public int neighborCount() {
    return neighbors.length;
  }

  public int neighborAt(int i) {
    return neighbors[i];
  }

  public int cornerCount() {
    return corners.length;
  }

  public int cornerAt(int i) {
    return corners[i];
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Move m)) return false;
    return index == m.index
            && piece == m.piece
            && Arrays.equals(cells, m.cells)
            && Arrays.equals(neighbors, m.neighbors)
            && Arrays.equals(corners, m.corners);
  }

  @Override
  public int hashCode() {
    int h = 31 * index + piece;
    h = 31 * h + Arrays.hashCode(cells);
    h = 31 * h + Arrays.hashCode(neighbors);
    return 31 * h + Arrays.hashCode(corners);
  }

  @Override
  public String toString() {
    return "Move{" + index + ", piece=" + piece + ", cells=" + Arrays.toString(cells) + '}';
  }
}
