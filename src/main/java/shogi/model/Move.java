package shogi.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A move: a board move, a drop from hand, or the end of the game. The variant set is closed;
 * callers dispatch on {@link #kind()}. Each variant's equality and hash cover only its own fields.
 */
public sealed interface Move permits Move.Normal, Move.Drop, Move.Terminal {

  /** Discriminant of the variant. */
  enum Kind {
    NORMAL,
    DROP,
    TERMINAL
  }

  Kind kind();

  /**
   * A piece moving on the board.
   *
   * @param side    mover
   * @param from    origin square
   * @param to      destination square, empty or holding an opposing piece
   * @param face    face shown at the origin
   * @param promote whether the piece promotes on arrival
   */
  record Normal(Side side, Square from, Square to, PieceFace face, boolean promote) implements Move {
    public Normal {
      Objects.requireNonNull(side, "side");
      Objects.requireNonNull(from, "from");
      Objects.requireNonNull(to, "to");
      Objects.requireNonNull(face, "face");
      if (promote && !face.isPromotable()) {
        throw new IllegalArgumentException(face + " cannot promote");
      }
    }

    @Override
    public Kind kind() {
      return Kind.NORMAL;
    }

    /** Face shown at the destination. */
    public PieceFace resultingFace() {
      return promote ? face.promoted() : face;
    }

    @Override
    public String toString() {
      return side + ": " + from + " -> " + to + " " + face.glyph() + (promote ? " 成" : "");
    }
  }

  /**
   * A piece placed from hand onto an empty square, always unpromoted.
   */
  record Drop(Side side, Square to, PieceType type) implements Move {
    public Drop {
      Objects.requireNonNull(side, "side");
      Objects.requireNonNull(to, "to");
      Objects.requireNonNull(type, "type");
    }

    @Override
    public Kind kind() {
      return Kind.DROP;
    }

    @Override
    public String toString() {
      return side + ": " + to + " " + type.glyph() + " 打";
    }
  }

  /**
   * End of game.
   *
   * @param winner winning side, {@code null} when the game ended without one
   */
  record Terminal(TerminalReason reason, Side winner) implements Move {
    public Terminal {
      Objects.requireNonNull(reason, "reason");
    }

    @Override
    public Kind kind() {
      return Kind.TERMINAL;
    }

    public Optional<Side> winnerIfAny() {
      return Optional.ofNullable(winner);
    }

    @Override
    public String toString() {
      return winner == null ? "end, no winner [" + reason + "]" : "end, " + winner + " wins [" + reason + "]";
    }
  }
}
