package shogi.impl;

import static org.junit.jupiter.api.Assertions.*;
import static shogi.Fixtures.sq;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import shogi.Fixtures;
import shogi.contracts.MoveGenerator;
import shogi.model.HandPool;
import shogi.model.Move;
import shogi.model.PieceFace;
import shogi.model.PieceType;
import shogi.model.Position;
import shogi.model.Side;
import shogi.model.Square;

class MoveGeneratorImplTest {

  private static final MoveGenerator GEN = new MoveGeneratorImpl();
  private static final Position START = new PositionFactoryImpl().startPosition();

  /* kings tucked into the corners so files 2..8 stay clear */
  private static Position.Builder cornerKings(Side toMove) {
    return Position.builder()
        .put(sq(19), Side.SENTE, PieceFace.KING)
        .put(sq(91), Side.GOTE, PieceFace.KING)
        .sideToMove(toMove);
  }

  private static List<Move.Normal> movesFrom(Position p, Square from) {
    List<Move.Normal> out = new ArrayList<>();
    for (Move m : GEN.generate(p)) {
      if (m instanceof Move.Normal n && n.from().equals(from)) out.add(n);
    }
    return out;
  }

  private static List<Move.Normal> movesBetween(Position p, Square from, Square to) {
    return movesFrom(p, from).stream().filter(m -> m.to().equals(to)).collect(Collectors.toList());
  }

  /* ────── start position ────── */

  @Test
  void startPositionHasThirtyQuietMoves() {
    List<Move> moves = GEN.generate(START);
    assertEquals(30, moves.size());
    for (Move m : moves) {
      assertSame(Move.Kind.NORMAL, m.kind());
      assertFalse(((Move.Normal) m).promote());
    }
  }

  @Test
  void destinationsOfAnEmptySquareAreEmpty() {
    assertTrue(GEN.destinations(START, sq(55), false).isEmpty());
  }

  /* ────── sliding ────── */

  @Test
  void slidesStopAtTheFirstOccupiedSquare() {
    Position p = Fixtures.kingsOnly(Side.SENTE)
        .put(sq(55), Side.SENTE, PieceFace.ROOK)
        .put(sq(53), Side.SENTE, PieceFace.PAWN)
        .put(sq(57), Side.GOTE, PieceFace.PAWN)
        .build();

    Set<Square> reach = Set.copyOf(GEN.destinations(p, sq(55), false));
    assertEquals(Set.of(sq(54), sq(56), sq(57),
        sq(65), sq(75), sq(85), sq(95), sq(45), sq(35), sq(25), sq(15)), reach);

    Set<Square> withOwn = Set.copyOf(GEN.destinations(p, sq(55), true));
    assertTrue(withOwn.contains(sq(53)));
    assertFalse(withOwn.contains(sq(52)), "nothing beyond the blocker");
    assertEquals(12, withOwn.size());
  }

  @Test
  void steppingPieceMayCaptureButNotLandOnItsOwn() {
    Position p = Fixtures.kingsOnly(Side.SENTE)
        .put(sq(55), Side.SENTE, PieceFace.GOLD)
        .put(sq(54), Side.SENTE, PieceFace.PAWN)
        .put(sq(44), Side.GOTE, PieceFace.PAWN)
        .build();
    Set<Square> reach = Set.copyOf(GEN.destinations(p, sq(55), false));
    assertFalse(reach.contains(sq(54)));
    assertTrue(reach.contains(sq(44)));
    assertEquals(5, reach.size());
  }

  /* ────── drops ────── */

  @Test
  void noSecondUnpromotedPawnOnAFile() {
    Position p = Fixtures.kingsOnly(Side.SENTE)
        .put(sq(57), Side.SENTE, PieceFace.PAWN)
        .put(sq(33), Side.GOTE, PieceFace.PAWN)
        .hand(Side.SENTE, HandPool.EMPTY.plus(PieceType.PAWN))
        .build();

    List<Move.Drop> drops = GEN.generate(p).stream()
        .filter(m -> m instanceof Move.Drop).map(m -> (Move.Drop) m).collect(Collectors.toList());
    assertEquals(63, drops.size());
    for (Move.Drop d : drops) {
      assertNotEquals(5, d.to().file(), "file 5 already holds a sente pawn");
      assertNotEquals(1, d.to().rank(), "a pawn on rank 1 could never move");
    }
  }

  @Test
  void tokinDoesNotBlockAPawnDrop() {
    Position p = Fixtures.kingsOnly(Side.SENTE)
        .put(sq(43), Side.SENTE, PieceFace.TOKIN)
        .hand(Side.SENTE, HandPool.EMPTY.plus(PieceType.PAWN))
        .build();
    assertTrue(GEN.generate(p).contains(new Move.Drop(Side.SENTE, sq(45), PieceType.PAWN)));
  }

  @Test
  void knightAndLanceDropsAvoidDeadRanks() {
    Position p = cornerKings(Side.GOTE)
        .hand(Side.GOTE, HandPool.EMPTY.plus(PieceType.KNIGHT).plus(PieceType.LANCE))
        .build();
    for (Move m : GEN.generate(p)) {
      if (!(m instanceof Move.Drop d)) continue;
      if (d.type() == PieceType.KNIGHT) assertTrue(d.to().rank() <= 7, d::toString);
      if (d.type() == PieceType.LANCE) assertTrue(d.to().rank() <= 8, d::toString);
    }
    assertTrue(GEN.generate(p).contains(new Move.Drop(Side.GOTE, sq(57), PieceType.KNIGHT)));
    assertFalse(GEN.generate(p).contains(new Move.Drop(Side.GOTE, sq(58), PieceType.KNIGHT)));
  }

  @Test
  void everyHeldTypeIsDroppedOnEveryEmptySquare() {
    Position p = cornerKings(Side.SENTE)
        .hand(Side.SENTE, HandPool.EMPTY.plus(PieceType.GOLD).plus(PieceType.GOLD).plus(PieceType.ROOK))
        .build();
    long drops = GEN.generate(p).stream().filter(m -> m.kind() == Move.Kind.DROP).count();
    assertEquals(2 * 79, drops, "one move per type and empty square, regardless of count");
  }

  /* ────── promotion ────── */

  @Test
  void pawnReachingTheLastRankMustPromote() {
    Position p = cornerKings(Side.SENTE).put(sq(52), Side.SENTE, PieceFace.PAWN).build();
    List<Move.Normal> moves = movesFrom(p, sq(52));
    assertEquals(1, moves.size());
    assertTrue(moves.get(0).promote());
  }

  @Test
  void goteMirrorsForcedPromotion() {
    Position p = cornerKings(Side.GOTE).put(sq(58), Side.GOTE, PieceFace.PAWN).build();
    List<Move.Normal> moves = movesFrom(p, sq(58));
    assertEquals(1, moves.size());
    assertEquals(sq(59), moves.get(0).to());
    assertTrue(moves.get(0).promote());
  }

  @Test
  void silverEnteringTheZoneMayChoose() {
    Position p = cornerKings(Side.SENTE).put(sq(54), Side.SENTE, PieceFace.SILVER).build();
    List<Move.Normal> moves = movesBetween(p, sq(54), sq(53));
    assertEquals(2, moves.size());
    assertNotEquals(moves.get(0).promote(), moves.get(1).promote());
  }

  @Test
  void knightToTheSecondRankMustPromote() {
    Position p = cornerKings(Side.SENTE).put(sq(44), Side.SENTE, PieceFace.KNIGHT).build();
    List<Move.Normal> moves = movesFrom(p, sq(44));
    assertEquals(2, moves.size(), "32 and 52, promoted only");
    for (Move.Normal m : moves) assertTrue(m.promote());
  }

  @Test
  void lanceChoicesDependOnTheRank() {
    Position p = cornerKings(Side.SENTE).put(sq(57), Side.SENTE, PieceFace.LANCE).build();
    assertEquals(1, movesBetween(p, sq(57), sq(56)).size());
    assertEquals(1, movesBetween(p, sq(57), sq(55)).size());
    assertEquals(2, movesBetween(p, sq(57), sq(53)).size());
    assertEquals(2, movesBetween(p, sq(57), sq(52)).size());
    List<Move.Normal> last = movesBetween(p, sq(57), sq(51));
    assertEquals(1, last.size());
    assertTrue(last.get(0).promote());
  }

  @Test
  void leavingTheZoneAlsoOffersPromotion() {
    Position p = cornerKings(Side.SENTE).put(sq(23), Side.SENTE, PieceFace.SILVER).build();
    assertEquals(2, movesBetween(p, sq(23), sq(34)).size());
  }

  @Test
  void promotedAndGoldPiecesNeverOfferPromotion() {
    Position p = cornerKings(Side.SENTE)
        .put(sq(53), Side.SENTE, PieceFace.GOLD)
        .put(sq(73), Side.SENTE, PieceFace.DRAGON)
        .build();
    for (Move m : GEN.generate(p)) {
      if (m instanceof Move.Normal n) assertFalse(n.promote(), n::toString);
    }
  }

  /* every face, side and square: no unpromoted piece is left where it could never move again */
  static Stream<Arguments> facesAndSides() {
    List<Arguments> out = new ArrayList<>();
    for (PieceFace f : PieceFace.values()) {
      if (f == PieceFace.KING) continue;
      for (Side s : Side.values()) out.add(Arguments.of(f, s));
    }
    return out.stream();
  }

  @ParameterizedTest(name = "{0} {1}")
  @MethodSource("facesAndSides")
  void forcedPromotionAgreesWithPlacementProhibition(PieceFace face, Side side) {
    for (Square from : Square.ALL) {
      Position p = Position.builder().put(from, side, face).sideToMove(side).build();
      List<Move> moves = GEN.generate(p);
      Set<Square> covered = moves.stream().map(m -> ((Move.Normal) m).to()).collect(Collectors.toSet());

      for (Move m : moves) {
        Move.Normal n = (Move.Normal) m;
        if (!n.promote()) {
          assertFalse(face.isPlacementProhibited(side, n.to().rank()), () -> "stranded " + n);
        } else {
          assertTrue(side.inPromotionZone(from.rank()) || side.inPromotionZone(n.to().rank()), n::toString);
        }
      }
      assertEquals(Set.copyOf(face.destinations(side, from)), covered, () -> face + " from " + from);
    }
  }

  /* ────── reach ────── */

  @Test
  void attackersOfAStartSquare() {
    assertEquals(List.of(sq(77)), GEN.attackersOf(START, Side.SENTE, sq(76)));
    assertEquals(Set.of(sq(79), sq(69), sq(59), sq(28)), Set.copyOf(GEN.attackersOf(START, Side.SENTE, sq(68))));
    assertTrue(GEN.attackersOf(START, Side.GOTE, sq(55)).isEmpty());
  }

  @Test
  void reachableSquaresUnionAllPieces() {
    Set<Square> reach = GEN.reachableSquares(START, Side.SENTE, false);
    assertTrue(reach.contains(sq(76)));
    assertTrue(reach.contains(sq(38)), "rook sideways");
    assertFalse(reach.contains(sq(77)), "own pawn");
    assertTrue(GEN.reachableSquares(START, Side.SENTE, true).contains(sq(77)), "defended by the bishop");
  }
}
