package shogi.contracts;

import java.util.List;
import java.util.Set;
import shogi.model.Move;
import shogi.model.Position;
import shogi.model.Side;
import shogi.model.Square;

public interface MoveGenerator {

  /**
   * Every pseudo-legal move of the side to move: board moves with their promotion choices and drops
   * from hand. King safety is not considered. Never fails; an empty list means no move exists.
   */
  List<Move> generate(Position position);

  /**
   * Squares the piece on {@code from} can reach. Slides stop at the first occupied square; an
   * enemy-occupied square is included, an own-occupied one only if {@code includeOwnOccupied}.
   * Empty when {@code from} is empty.
   */
  List<Square> destinations(Position position, Square from, boolean includeOwnOccupied);

  /** Union of {@link #destinations} over every piece of {@code side}. */
  Set<Square> reachableSquares(Position position, Side side, boolean includeOwnOccupied);

  /** Squares of {@code side}'s pieces that can move to {@code target}. */
  List<Square> attackersOf(Position position, Side side, Square target);
}
