package blokus.impl;

import static blokus.constants.BoardConstants.CORNER_DIRS;
import static blokus.constants.BoardConstants.EDGE_DIRS;

import blokus.contracts.MoveCatalog;
import blokus.contracts.PieceCatalog;
import blokus.records.Move;
import blokus.records.Offset;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Precomputed placement tables.
 *
 * <p>Numbering: piece 0..n-1 in catalog order, then each orientation in discovery order,
 * then anchor positions scanned row-major. Only placements that stay on the board get an
 * index. Moves of one piece therefore occupy a contiguous index range.
 */
public final class MoveCatalogImpl implements MoveCatalog {

  private static final Logger LOG = LoggerFactory.getLogger(MoveCatalogImpl.class);

  private final PieceCatalog pieces;
  private final int rows;
  private final int cols;

  private final Move[] moves;
  private final int[] pieceStart;   // length pieces + 1
  private final int[][] covering;   // cell → ascending move indices

  public MoveCatalogImpl(PieceCatalog pieces, int rows, int cols) {
    if (rows <= 0 || cols <= 0)
      throw new IllegalArgumentException("bad board size " + rows + "x" + cols);
    this.pieces = pieces;
    this.rows = rows;
    this.cols = cols;

    long t0 = System.nanoTime();

    List<Move> list = new ArrayList<>();
    int n = pieces.size();
    pieceStart = new int[n + 1];

    for (int p = 0; p < n; p++) {
      pieceStart[p] = list.size();
      for (List<Offset> shape : pieces.orientations(p)) {
        int height = 0, width = 0;
        for (Offset o : shape) {
          height = Math.max(height, o.row());
          width = Math.max(width, o.col());
        }
        for (int r = 0; r + height < rows; r++) {
          for (int c = 0; c + width < cols; c++) {
            list.add(materialize(list.size(), p, shape, r, c));
          }
        }
      }
    }
    pieceStart[n] = list.size();
    moves = list.toArray(new Move[0]);
    covering = buildCoveringTable(moves, rows * cols);

    if (LOG.isDebugEnabled()) {
      LOG.debug("move catalog {}x{}: {} pieces, {} placements in {} ms",
              rows, cols, n, moves.length, (System.nanoTime() - t0) / 1_000_000);
    }
  }

  /* ───────── per-move geometry ───────── */

  private Move materialize(int index, int piece, List<Offset> shape, int dRow, int dCol) {
    int[] cells = new int[shape.size()];
    int k = 0;
    for (Offset o : shape) cells[k++] = (o.row() + dRow) * cols + (o.col() + dCol);
    Arrays.sort(cells);

    TreeSet<Integer> neighbors = new TreeSet<>();
    for (int cell : cells) {
      int r = cell / cols, c = cell % cols;
      for (int[] d : EDGE_DIRS) {
        int nr = r + d[0], nc = c + d[1];
        if (!inBounds(nr, nc)) continue;
        int nb = nr * cols + nc;
        if (Arrays.binarySearch(cells, nb) < 0) neighbors.add(nb);
      }
    }

    TreeSet<Integer> corners = new TreeSet<>();
    for (int cell : cells) {
      int r = cell / cols, c = cell % cols;
      for (int[] d : CORNER_DIRS) {
        int nr = r + d[0], nc = c + d[1];
        if (!inBounds(nr, nc)) continue;
        int cc = nr * cols + nc;
        // a diagonal cell that also touches an edge is a neighbor, not a corner
        if (Arrays.binarySearch(cells, cc) < 0 && !neighbors.contains(cc)) corners.add(cc);
      }
    }

    return new Move(index, piece, cells, toArray(neighbors), toArray(corners));
  }

  private boolean inBounds(int r, int c) {
    return r >= 0 && r < rows && c >= 0 && c < cols;
  }

  private static int[] toArray(TreeSet<Integer> set) {
    int[] out = new int[set.size()];
    int i = 0;
    for (int v : set) out[i++] = v;
    return out;
  }

  private static int[][] buildCoveringTable(Move[] moves, int numCells) {
    int[] counts = new int[numCells];
    for (Move m : moves) for (int i = 0; i < m.size(); i++) counts[m.cellAt(i)]++;

    int[][] table = new int[numCells][];
    for (int c = 0; c < numCells; c++) table[c] = new int[counts[c]];

    int[] fill = new int[numCells];
    for (Move m : moves) {
      for (int i = 0; i < m.size(); i++) {
        int c = m.cellAt(i);
        table[c][fill[c]++] = m.index();
      }
    }
    return table;
  }

  /* ───────── MoveCatalog ───────── */

  @Override
  public int rows() {
    return rows;
  }

  @Override
  public int cols() {
    return cols;
  }

  @Override
  public int size() {
    return moves.length;
  }

  @Override
  public Move move(int index) {
    if (index < 0 || index >= moves.length)
      throw new IllegalArgumentException("move index out of range: " + index);
    return moves[index];
  }

  @Override
  public PieceCatalog pieces() {
    return pieces;
  }

  @Override
  public int pieceStart(int piece) {
    checkPiece(piece);
    return pieceStart[piece];
  }

  @Override
  public int pieceEnd(int piece) {
    checkPiece(piece);
    return pieceStart[piece + 1];
  }

  private void checkPiece(int piece) {
    if (piece < 0 || piece >= pieceStart.length - 1)
      throw new IllegalArgumentException("piece index out of range: " + piece);
  }

  @Override
  public int[] movesCovering(int cell) {
    if (cell < 0 || cell >= covering.length)
      throw new IllegalArgumentException("cell index out of range: " + cell);
    return covering[cell].clone();
  }
}
