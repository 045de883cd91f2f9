package blokus.state;

import static org.junit.jupiter.api.Assertions.*;

import blokus.records.Move;
import org.junit.jupiter.api.Test;

class BoardTest {

  private static final Move DOMINO = new Move(0, 1, new int[] {0, 20}, new int[] {1, 21, 40}, new int[] {41});

  @Test
  void newBoardIsEmpty() {
    Board b = new Board(20, 20);
    assertEquals(400, b.numCells());
    for (int i = 0; i < b.numCells(); i++) assertTrue(b.isEmpty(i));
  }

  @Test
  void placeAndClear() {
    Board b = new Board(20, 20);
    b.place(DOMINO, Player.P3);
    assertEquals(3, b.get(0, 0));
    assertEquals(3, b.get(1, 0));
    assertEquals(2, b.count(Player.P3));
    assertEquals(0, b.count(Player.P1));

    b.clear(DOMINO);
    assertEquals(new Board(20, 20), b);
  }

  @Test
  void outOfBoundsCoordinatesAreRejected() {
    Board b = new Board(20, 20);
    assertThrows(IllegalArgumentException.class, () -> b.get(-1, 0));
    assertThrows(IllegalArgumentException.class, () -> b.get(0, 20));
    assertThrows(IllegalArgumentException.class, () -> b.get(20, 0));
    assertThrows(IllegalArgumentException.class, () -> new Board(0, 5));
  }

  @Test
  void copyIsDeep() {
    Board b = new Board(20, 20);
    Board c = b.copy();
    c.place(DOMINO, Player.P1);
    assertTrue(b.isEmpty(0));
    assertNotEquals(b, c);
  }

  @Test
  void markersUseOneBasedPlayerIds() {
    Board b = new Board(20, 20);
    b.place(DOMINO, Player.P4);
    float[] out = new float[400];
    b.markers(out);
    assertEquals(4f, out[0]);
    assertEquals(4f, out[20]);
    assertEquals(0f, out[1]);
    assertThrows(IllegalArgumentException.class, () -> b.markers(new float[10]));
  }
}
