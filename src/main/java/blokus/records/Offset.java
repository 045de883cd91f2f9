package blokus.records;

/**
 * A (row, col) pair. Ordered row-major, so sorted collections of offsets
 * iterate the same way the board is scanned.
 */
public record Offset(int row, int col) implements Comparable<Offset> {

    public Offset translate(int dRow, int dCol) {
        return new Offset(row + dRow, col + dCol);
    }

    @Override
    public int compareTo(Offset o) {
        int c = Integer.compare(row, o.row);
        return c != 0 ? c : Integer.compare(col, o.col);
    }

    @Override
    public String toString() {
        return "(" + row + ", " + col + ")";
    }
}
