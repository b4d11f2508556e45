package shogi.contracts;

import java.util.List;
import shogi.model.Move;
import shogi.model.Position;
import shogi.model.Side;

public interface CheckDetector {

  /**
   * A single {@code Terminal(KING_LEFT_EN_PRISE, attacker)} when some piece of {@code attacker} can
   * reach the opposing king, otherwise an empty list.
   */
  List<Move> kingCaptures(Position position, Side attacker);

  /** {@link MoveGenerator#generate} followed by {@link #kingCaptures} for the side to move. */
  List<Move> generateWithKingCapture(Position position);

  /** Generated moves that do not leave the mover's king capturable. */
  List<Move> legalMoves(Position position);

  /** Generated moves after which the mover attacks the opposing king. */
  List<Move> checkingMoves(Position position);

  /**
   * Whether the side to move has no king step that escapes every square the opponent reaches.
   * Only king mobility is considered: capturing the checking piece or interposing is not, so the
   * answer over-reports mate. False when the side to move has no king.
   */
  boolean isCheckmate(Position position);
}
