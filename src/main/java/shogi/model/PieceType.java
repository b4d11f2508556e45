package shogi.model;

import java.util.Optional;

/**
 * The eight kinds of piece. A captured piece always enters the hand as its {@code PieceType}; the
 * promotion state of the face it showed on the board is discarded.
 */
public enum PieceType {
  PAWN,
  LANCE,
  KNIGHT,
  SILVER,
  GOLD,
  BISHOP,
  ROOK,
  KING;

  /** The unpromoted face; the face a dropped piece always shows. */
  public PieceFace baseFace() {
    return switch (this) {
      case PAWN -> PieceFace.PAWN;
      case LANCE -> PieceFace.LANCE;
      case KNIGHT -> PieceFace.KNIGHT;
      case SILVER -> PieceFace.SILVER;
      case GOLD -> PieceFace.GOLD;
      case BISHOP -> PieceFace.BISHOP;
      case ROOK -> PieceFace.ROOK;
      case KING -> PieceFace.KING;
    };
  }

  /** The promoted face, empty for gold and king. */
  public Optional<PieceFace> promotedFace() {
    return baseFace().isPromotable()
        ? Optional.of(baseFace().promoted())
        : Optional.empty();
  }

  /** Glyph used in hand listings, identical to the base face's glyph. */
  public String glyph() {
    return baseFace().glyph();
  }
}
