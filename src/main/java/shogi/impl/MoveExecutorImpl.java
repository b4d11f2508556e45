package shogi.impl;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shogi.contracts.MoveExecutor;
import shogi.model.Move;
import shogi.model.PieceFace;
import shogi.model.Position;
import shogi.model.Side;
import shogi.model.SquareContent;

/**
 * Applies moves by copy-on-write: the prior {@link Position} is copied into a builder, edited, and
 * frozen into a new instance.
 *
 * <p>Preconditions are internal-consistency contracts between the generator and this class, not
 * input validation. A violation means the move was not generated for this position and is reported
 * with an {@link IllegalStateException}.
 */
public final class MoveExecutorImpl implements MoveExecutor {

  private static final Logger log = LoggerFactory.getLogger(MoveExecutorImpl.class);

  @Override
  public Optional<Position> apply(Position position, Move move) {
    return switch (move.kind()) {
      case NORMAL -> Optional.of(applyNormal(position, (Move.Normal) move));
      case DROP -> Optional.of(applyDrop(position, (Move.Drop) move));
      case TERMINAL -> {
        Move.Terminal t = (Move.Terminal) move;
        log.debug("Game over: reason={} winner={}", t.reason(), t.winner());
        yield Optional.empty();
      }
    };
  }

  private static Position applyNormal(Position position, Move.Normal m) {
    final Side us = m.side();
    final SquareContent origin = position.get(m.from());
    if (origin.isEmpty() || origin.side() != us || origin.face().type() != m.face().type()) {
      throw new IllegalStateException(
          "Origin " + m.from() + " holds " + origin + ", move expects " + us + " " + m.face());
    }

    Position.Builder next = position.toBuilder();
    SquareContent target = position.get(m.to());
    if (!target.isEmpty()) {
      if (target.side() == us) {
        throw new IllegalStateException("Destination " + m.to() + " holds own piece " + target);
      }
      // a captured piece changes hands unpromoted
      next.hand(us, next.hand(us).plus(target.face().type()));
    }

    PieceFace arriving = m.promote() ? m.face().promoted() : m.face();
    next.clear(m.from())
        .put(m.to(), us, arriving)
        .sideToMove(position.sideToMove().opponent());
    return next.build();
  }

  private static Position applyDrop(Position position, Move.Drop m) {
    final Side us = m.side();
    if (!position.get(m.to()).isEmpty()) {
      throw new IllegalStateException("Drop square " + m.to() + " is occupied by " + position.get(m.to()));
    }
    Position.Builder next = position.toBuilder();
    next.hand(us, next.hand(us).minus(m.type())) // throws IllegalStateException on an empty count
        .put(m.to(), us, m.type().baseFace())
        .sideToMove(position.sideToMove().opponent());
    return next.build();
  }
}
