package shogi.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class HandPoolTest {

  @Test
  void plusAndMinusAreCopies() {
    HandPool one = HandPool.EMPTY.plus(PieceType.PAWN);
    HandPool two = one.plus(PieceType.PAWN);
    assertEquals(0, HandPool.EMPTY.count(PieceType.PAWN));
    assertEquals(1, one.count(PieceType.PAWN));
    assertEquals(2, two.count(PieceType.PAWN));
    assertEquals(one, two.minus(PieceType.PAWN));
    assertTrue(one.minus(PieceType.PAWN).isEmpty());
  }

  @Test
  void minusOnEmptyCountIsADefect() {
    assertThrows(IllegalStateException.class, () -> HandPool.EMPTY.minus(PieceType.ROOK));
  }

  @Test
  void zeroCountEqualsAbsentEntry() {
    assertEquals(HandPool.EMPTY, HandPool.of(Map.of(PieceType.GOLD, 0)));
    assertEquals(HandPool.EMPTY.hashCode(), HandPool.of(Map.of(PieceType.GOLD, 0)).hashCode());
    assertEquals(Map.of(PieceType.BISHOP, 2),
        HandPool.of(Map.of(PieceType.BISHOP, 2, PieceType.GOLD, 0)).asMap());
  }

  @Test
  void negativeCountsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> HandPool.of(Map.of(PieceType.PAWN, -1)));
  }
}
