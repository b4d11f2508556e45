package shogi.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The fourteen faces a piece can show on the board. Movement is purely table driven: each face
 * carries its single-step offsets and its slide vectors in canonical forward orientation, and the
 * generator mirrors them per side.
 */
public enum PieceFace {
  PAWN(PieceType.PAWN, "歩", "FU", 1, steps(o(0, -1)), none()),
  LANCE(PieceType.LANCE, "香", "KY", 1, none(), steps(o(0, -1))),
  KNIGHT(PieceType.KNIGHT, "桂", "KE", 2, steps(o(-1, -2), o(1, -2)), none()),
  SILVER(PieceType.SILVER, "銀", "GI", 0,
      steps(o(-1, -1), o(0, -1), o(1, -1), o(-1, 1), o(1, 1)), none()),
  GOLD(PieceType.GOLD, "金", "KI", 0, Tables.GOLD_STEPS, none()),
  BISHOP(PieceType.BISHOP, "角", "KA", 0, none(), Tables.DIAGONALS),
  ROOK(PieceType.ROOK, "飛", "HI", 0, none(), Tables.ORTHOGONALS),
  KING(PieceType.KING, "玉", "OU", 0, Tables.KING_STEPS, none()),
  TOKIN(PieceType.PAWN, "と", "TO", 0, Tables.GOLD_STEPS, none()),
  PROMOTED_LANCE(PieceType.LANCE, "杏", "NY", 0, Tables.GOLD_STEPS, none()),
  PROMOTED_KNIGHT(PieceType.KNIGHT, "圭", "NK", 0, Tables.GOLD_STEPS, none()),
  PROMOTED_SILVER(PieceType.SILVER, "全", "NG", 0, Tables.GOLD_STEPS, none()),
  HORSE(PieceType.BISHOP, "馬", "UM", 0, Tables.ORTHOGONALS, Tables.DIAGONALS),
  DRAGON(PieceType.ROOK, "竜", "RY", 0, Tables.DIAGONALS, Tables.ORTHOGONALS);

  private static final Map<String, PieceFace> BY_GLYPH =
      Stream.of(values()).collect(Collectors.toUnmodifiableMap(PieceFace::glyph, Function.identity()));
  private static final Map<String, PieceFace> BY_CODE =
      Stream.of(values()).collect(Collectors.toUnmodifiableMap(PieceFace::code, Function.identity()));

  private final PieceType type;
  private final String glyph;
  private final String code;
  private final int deadRanks;
  private final List<Offset> steps;
  private final List<Offset> slides;

  PieceFace(PieceType type, String glyph, String code, int deadRanks,
            List<Offset> steps, List<Offset> slides) {
    this.type = type;
    this.glyph = glyph;
    this.code = code;
    this.deadRanks = deadRanks;
    this.steps = steps;
    this.slides = slides;
  }

  /* ────── table accessors ────── */

  public PieceType type() {
    return type;
  }

  /** Single-step offsets, each applied once. */
  public List<Offset> steps() {
    return steps;
  }

  /** Slide directions, each applied repeatedly until blocked. */
  public List<Offset> slides() {
    return slides;
  }

  public String glyph() {
    return glyph;
  }

  /** Two-letter move-record code, e.g. {@code FU} or {@code RY}. */
  public String code() {
    return code;
  }

  /* ────── promotion ────── */

  public boolean isPromotable() {
    return switch (this) {
      case PAWN, LANCE, KNIGHT, SILVER, BISHOP, ROOK -> true;
      default -> false;
    };
  }

  public boolean isPromoted() {
    return switch (this) {
      case TOKIN, PROMOTED_LANCE, PROMOTED_KNIGHT, PROMOTED_SILVER, HORSE, DRAGON -> true;
      default -> false;
    };
  }

  /**
   * The face after promotion. Already-promoted faces return themselves.
   *
   * @throws IllegalStateException for gold and king, which have no promoted face
   */
  public PieceFace promoted() {
    return switch (this) {
      case PAWN -> TOKIN;
      case LANCE -> PROMOTED_LANCE;
      case KNIGHT -> PROMOTED_KNIGHT;
      case SILVER -> PROMOTED_SILVER;
      case BISHOP -> HORSE;
      case ROOK -> DRAGON;
      case GOLD, KING -> throw new IllegalStateException(this + " cannot promote");
      default -> this;
    };
  }

  /* ────── placement ────── */

  /**
   * Whether a piece showing this face may not stand on {@code rank} for {@code side}: pawn and
   * lance on the farthest rank, knight on the two farthest ranks. Drops consult this to reject a
   * placement; moves consult it to withhold the non-promoting variant.
   */
  public boolean isPlacementProhibited(Side side, int rank) {
    return side.ranksFromFarEdge(rank) < deadRanks;
  }

  /** Destinations of this face from {@code from} on an otherwise empty board. */
  public List<Square> destinations(Side side, Square from) {
    List<Square> out = new ArrayList<>();
    for (Offset o : steps) {
      Square to = from.shift(o.dx(), o.dy(side));
      if (to != null) out.add(to);
    }
    for (Offset v : slides) {
      Square to = from.shift(v.dx(), v.dy(side));
      while (to != null) {
        out.add(to);
        to = to.shift(v.dx(), v.dy(side));
      }
    }
    return out;
  }

  /* ────── lookup ────── */

  public static Optional<PieceFace> fromGlyph(String glyph) {
    return Optional.ofNullable(BY_GLYPH.get(glyph));
  }

  public static Optional<PieceFace> fromCode(String code) {
    return Optional.ofNullable(BY_CODE.get(code));
  }

  /* ────── table construction helpers ────── */

  private static Offset o(int dx, int dy) {
    return new Offset(dx, dy);
  }

  private static List<Offset> steps(Offset... offsets) {
    return List.of(offsets);
  }

  private static List<Offset> none() {
    return List.of();
  }

  /** Shared tables; a nested holder so the enum constants may reference them. */
  private static final class Tables {
    static final List<Offset> GOLD_STEPS = List.of(
        new Offset(-1, -1), new Offset(0, -1), new Offset(1, -1),
        new Offset(-1, 0), new Offset(1, 0),
        new Offset(0, 1));
    static final List<Offset> KING_STEPS = List.of(
        new Offset(-1, -1), new Offset(0, -1), new Offset(1, -1),
        new Offset(-1, 0), new Offset(1, 0),
        new Offset(-1, 1), new Offset(0, 1), new Offset(1, 1));
    static final List<Offset> ORTHOGONALS = List.of(
        new Offset(0, -1), new Offset(-1, 0), new Offset(1, 0), new Offset(0, 1));
    static final List<Offset> DIAGONALS = List.of(
        new Offset(-1, -1), new Offset(1, -1), new Offset(-1, 1), new Offset(1, 1));
  }
}
