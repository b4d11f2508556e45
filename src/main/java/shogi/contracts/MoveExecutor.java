package shogi.contracts;

import java.util.Optional;
import shogi.model.Move;
import shogi.model.Position;

public interface MoveExecutor {
  /**
   * Applies {@code move} to {@code position} and returns the resulting position, or empty for a
   * terminal move. {@code position} is left untouched.
   *
   * @throws IllegalStateException if {@code move} could not have been generated for
   *     {@code position} (origin face mismatch, empty hand, occupied drop square)
   */
  Optional<Position> apply(Position position, Move move);
}
