package blokus.state;

import static blokus.constants.BoardConstants.EMPTY;

import blokus.records.Move;
import java.util.Arrays;

/**
 * Grid of cell markers, stored row-major. 0 is empty, otherwise player index + 1.
 */
public final class Board {

  private final int rows;
  private final int cols;
  private final byte[] cells;

  public Board(int rows, int cols) {
    if (rows <= 0 || cols <= 0)
      throw new IllegalArgumentException("bad board size " + rows + "x" + cols);
    this.rows = rows;
    this.cols = cols;
    this.cells = new byte[rows * cols];
  }

  private Board(Board other) {
    this.rows = other.rows;
    this.cols = other.cols;
    this.cells = other.cells.clone();
  }

  public int rows() {
    return rows;
  }

  public int cols() {
    return cols;
  }

  public int numCells() {
    return cells.length;
  }

  public boolean inBounds(int row, int col) {
    return row >= 0 && row < rows && col >= 0 && col < cols;
  }

  /** Marker at (row, col). */
  public byte get(int row, int col) {
    if (!inBounds(row, col))
      throw new IllegalArgumentException("cell (" + row + ", " + col + ") outside "
              + rows + "x" + cols + " board");
    return cells[row * cols + col];
  }

  /** Marker at a row-major cell index; hot path, no range message. */
  public byte at(int cell) {
    return cells[cell];
  }

  public boolean isEmpty(int cell) {
    return cells[cell] == EMPTY;
  }

  public void place(Move move, Player player) {
    byte m = player.marker();
    for (int i = 0, n = move.size(); i < n; i++) cells[move.cellAt(i)] = m;
  }

  public void clear(Move move) {
    for (int i = 0, n = move.size(); i < n; i++) cells[move.cellAt(i)] = EMPTY;
  }

  public int count(Player player) {
    byte m = player.marker();
    int n = 0;
    for (byte b : cells) if (b == m) n++;
    return n;
  }

  /** Writes one float per cell, row-major, using the marker encoding. */
  public void markers(float[] out) {
    if (out.length != cells.length)
      throw new IllegalArgumentException("observation buffer has " + out.length
              + " slots, board has " + cells.length + " cells");
    for (int i = 0; i < cells.length; i++) out[i] = cells[i];
  }

  public byte[] snapshot() {
    return cells.clone();
  }

  public Board copy() {
    return new Board(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Board b)) return false;
    return rows == b.rows && cols == b.cols && Arrays.equals(cells, b.cells);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * rows + cols) + Arrays.hashCode(cells);
  }
}
