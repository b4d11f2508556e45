package shogi.impl;

import static shogi.constants.CoreConstants.SQUARES;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import shogi.contracts.MoveGenerator;
import shogi.model.HandPool;
import shogi.model.Move;
import shogi.model.Offset;
import shogi.model.PieceFace;
import shogi.model.PieceType;
import shogi.model.Position;
import shogi.model.Side;
import shogi.model.Square;
import shogi.model.SquareContent;

public final class MoveGeneratorImpl implements MoveGenerator {

  /* typical middle-game branching factor, sizes the result list */
  private static final int LIST_CAP = 128;

  @Override
  public List<Move> generate(Position position) {
    final Side us = position.sideToMove();
    final HandPool hand = position.hand(us);
    final List<Move> out = new ArrayList<>(LIST_CAP);

    for (int i = 0; i < SQUARES; i++) {
      Square sq = Square.of(i);
      SquareContent c = position.get(sq);
      if (c.isEmpty()) {
        if (!hand.isEmpty()) addDrops(position, us, hand, sq, out);
      } else if (c.side() == us) {
        addBoardMoves(position, us, sq, c.face(), out);
      }
    }
    return out;
  }

  /* -------- drops ------------------------------------------------ */
  private static void addDrops(Position position, Side us, HandPool hand, Square to, List<Move> out) {
    for (PieceType type : PieceType.values()) {
      if (hand.count(type) == 0) continue;
      if (type.baseFace().isPlacementProhibited(us, to.rank())) continue;
      if (type == PieceType.PAWN && position.pawnCount(us, to.file()) > 0) continue; // two pawns on a file
      out.add(new Move.Drop(us, to, type));
    }
  }

  /* -------- board moves ------------------------------------------ */
  private void addBoardMoves(Position position, Side us, Square from, PieceFace face, List<Move> out) {
    final boolean fromInZone = us.inPromotionZone(from.rank());
    for (Square to : destinations(position, from, false)) {
      if (face.isPromotable() && (fromInZone || us.inPromotionZone(to.rank()))) {
        out.add(new Move.Normal(us, from, to, face, true));
      }
      // no unpromoted variant where the face could never move again: promotion is forced
      if (!face.isPlacementProhibited(us, to.rank())) {
        out.add(new Move.Normal(us, from, to, face, false));
      }
    }
  }

  /* -------- reach ------------------------------------------------ */
  @Override
  public List<Square> destinations(Position position, Square from, boolean includeOwnOccupied) {
    SquareContent c = position.get(from);
    if (c.isEmpty()) return List.of();
    final Side side = c.side();
    final PieceFace face = c.face();
    final List<Square> out = new ArrayList<>();

    for (Offset o : face.steps()) {
      Square to = from.shift(o.dx(), o.dy(side));
      if (to == null) continue;
      if (includeOwnOccupied || !position.get(to).isOwnedBy(side)) out.add(to);
    }

    for (Offset v : face.slides()) {
      Square to = from.shift(v.dx(), v.dy(side));
      while (to != null) {
        SquareContent there = position.get(to);
        if (there.isEmpty()) {
          out.add(to);
        } else {
          if (there.side() != side || includeOwnOccupied) out.add(to);
          break; // blocked either way
        }
        to = to.shift(v.dx(), v.dy(side));
      }
    }
    return out;
  }

  @Override
  public Set<Square> reachableSquares(Position position, Side side, boolean includeOwnOccupied) {
    Set<Square> out = new LinkedHashSet<>();
    for (List<Square> squares : position.pieceLocations(side).values()) {
      for (Square from : squares) out.addAll(destinations(position, from, includeOwnOccupied));
    }
    return out;
  }

  @Override
  public List<Square> attackersOf(Position position, Side side, Square target) {
    List<Square> out = new ArrayList<>();
    for (int i = 0; i < SQUARES; i++) {
      Square from = Square.of(i);
      if (position.get(from).isOwnedBy(side) && destinations(position, from, false).contains(target)) {
        out.add(from);
      }
    }
    return out;
  }
}
