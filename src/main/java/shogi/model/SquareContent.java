package shogi.model;

import java.util.Objects;

/** What stands on a square: nothing, or one piece of one side showing one face. Interned. */
public final class SquareContent {

  public static final SquareContent EMPTY = new SquareContent(null, null);

  /** Diagram symbol for an empty square; the leading ideographic space keeps cells aligned. */
  public static final String EMPTY_SYMBOL = "　・";

  private static final SquareContent[][] PIECES =
      new SquareContent[Side.values().length][PieceFace.values().length];

  static {
    for (Side side : Side.values()) {
      for (PieceFace face : PieceFace.values()) {
        PIECES[side.ordinal()][face.ordinal()] = new SquareContent(side, face);
      }
    }
  }

  private final Side side;
  private final PieceFace face;

  private SquareContent(Side side, PieceFace face) {
    this.side = side;
    this.face = face;
  }

  public static SquareContent of(Side side, PieceFace face) {
    Objects.requireNonNull(side, "side");
    Objects.requireNonNull(face, "face");
    return PIECES[side.ordinal()][face.ordinal()];
  }

  public boolean isEmpty() {
    return side == null;
  }

  /** Owner of the piece, {@code null} when empty. */
  public Side side() {
    return side;
  }

  /** Face of the piece, {@code null} when empty. */
  public PieceFace face() {
    return face;
  }

  public boolean isOwnedBy(Side s) {
    return side == s && side != null;
  }

  public String symbol() {
    return isEmpty() ? EMPTY_SYMBOL : side.marker() + face.glyph();
  }

  @Override
  public String toString() {
    return symbol();
  }
}
