package shogi.model;

import static shogi.constants.CoreConstants.RANKS;
import static shogi.constants.CoreConstants.SQUARES;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of a shogi game: the 81 squares, both hands and the side to move. Sufficient
 * for move generation, execution and check detection, and free of any notation concerns.
 *
 * <p>Every change produces a new instance through {@link #toBuilder()}. Instances are
 * <strong>thread-safe</strong> and may be shared freely; equality is value based.
 */
public final class Position {

  /* ────── immutable state ────── */
  private final SquareContent[] squares; // index order, see Square#index()
  private final HandPool senteHand;
  private final HandPool goteHand;
  private final Side sideToMove;

  /* derived on first use; concurrent readers may each build it, all results are equal */
  private volatile Map<Side, Map<PieceFace, List<Square>>> locations;

  private Position(SquareContent[] squares, HandPool senteHand, HandPool goteHand, Side sideToMove) {
    this.squares = squares;
    this.senteHand = senteHand;
    this.goteHand = goteHand;
    this.sideToMove = sideToMove;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** A builder pre-loaded with this position's state. */
  public Builder toBuilder() {
    Builder b = new Builder();
    System.arraycopy(squares, 0, b.squares, 0, SQUARES);
    b.senteHand = senteHand;
    b.goteHand = goteHand;
    b.sideToMove = sideToMove;
    return b;
  }

  /* ────── board access ────── */

  public SquareContent get(Square square) {
    return squares[square.index()];
  }

  public Side sideToMove() {
    return sideToMove;
  }

  public HandPool hand(Side side) {
    return side == Side.SENTE ? senteHand : goteHand;
  }

  /** Squares, in index order, whose content is one of {@code contents}. */
  public List<Square> search(Set<SquareContent> contents) {
    List<Square> out = new ArrayList<>();
    for (int i = 0; i < SQUARES; i++) {
      if (contents.contains(squares[i])) out.add(Square.of(i));
    }
    return out;
  }

  /** The nine contents of {@code file}, rank 1 first. */
  public List<SquareContent> fileContents(int file) {
    List<SquareContent> out = new ArrayList<>(RANKS);
    for (int rank = 1; rank <= RANKS; rank++) out.add(get(Square.of(file, rank)));
    return out;
  }

  /** Unpromoted pawns of {@code side} standing on {@code file}. */
  public int pawnCount(Side side, int file) {
    SquareContent pawn = SquareContent.of(side, PieceFace.PAWN);
    int n = 0;
    for (int rank = 1; rank <= RANKS; rank++) {
      if (get(Square.of(file, rank)) == pawn) n++;
    }
    return n;
  }

  /* ────── piece-location index ────── */

  /** Where each face of {@code side} stands, squares in index order. Faces not on the board are absent. */
  public Map<PieceFace, List<Square>> pieceLocations(Side side) {
    return locations().get(side);
  }

  /** Square of {@code side}'s king, empty once it has been captured. */
  public Optional<Square> kingSquare(Side side) {
    List<Square> kings = pieceLocations(side).get(PieceFace.KING);
    return kings == null || kings.isEmpty() ? Optional.empty() : Optional.of(kings.get(0));
  }

  private Map<Side, Map<PieceFace, List<Square>>> locations() {
    Map<Side, Map<PieceFace, List<Square>>> l = locations;
    if (l == null) {
      l = buildLocations();
      locations = l;
    }
    return l;
  }

  private Map<Side, Map<PieceFace, List<Square>>> buildLocations() {
    Map<Side, Map<PieceFace, List<Square>>> bySide = new EnumMap<>(Side.class);
    for (Side s : Side.values()) bySide.put(s, new EnumMap<>(PieceFace.class));
    for (int i = 0; i < SQUARES; i++) {
      SquareContent c = squares[i];
      if (c.isEmpty()) continue;
      bySide.get(c.side()).computeIfAbsent(c.face(), f -> new ArrayList<>()).add(Square.of(i));
    }
    Map<Side, Map<PieceFace, List<Square>>> frozen = new EnumMap<>(Side.class);
    bySide.forEach((side, faces) -> {
      Map<PieceFace, List<Square>> m = new EnumMap<>(PieceFace.class);
      faces.forEach((face, list) -> m.put(face, List.copyOf(list)));
      frozen.put(side, Collections.unmodifiableMap(m));
    });
    return Collections.unmodifiableMap(frozen);
  }

  /* ────── equality & hashing ────── */

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Position p)) return false;
    return sideToMove == p.sideToMove
        && Arrays.equals(squares, p.squares)
        && senteHand.equals(p.senteHand)
        && goteHand.equals(p.goteHand);
  }

  @Override
  public int hashCode() {
    return Objects.hash(Arrays.hashCode(squares), senteHand, goteHand, sideToMove);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(256);
    sb.append("gote hand ").append(goteHand).append('\n');
    for (int rank = 0; rank < RANKS; rank++) {
      sb.append('|');
      for (int i = 0; i < 9; i++) sb.append(squares[rank * 9 + i].symbol()).append('|');
      sb.append('\n');
    }
    sb.append("sente hand ").append(senteHand).append('\n');
    sb.append("to move ").append(sideToMove);
    return sb.toString();
  }

  /**
   * Mutable staging area for a {@link Position}. Not thread-safe; {@link #build()} copies the
   * board so the builder may be reused afterwards.
   */
  public static final class Builder {
    private final SquareContent[] squares = new SquareContent[SQUARES];
    private HandPool senteHand = HandPool.EMPTY;
    private HandPool goteHand = HandPool.EMPTY;
    private Side sideToMove = Side.SENTE;

    private Builder() {
      Arrays.fill(squares, SquareContent.EMPTY);
    }

    public SquareContent get(Square square) {
      return squares[square.index()];
    }

    public Builder set(Square square, SquareContent content) {
      squares[square.index()] = Objects.requireNonNull(content, "content");
      return this;
    }

    public Builder put(Square square, Side side, PieceFace face) {
      return set(square, SquareContent.of(side, face));
    }

    public Builder clear(Square square) {
      return set(square, SquareContent.EMPTY);
    }

    public HandPool hand(Side side) {
      return side == Side.SENTE ? senteHand : goteHand;
    }

    public Builder hand(Side side, HandPool hand) {
      Objects.requireNonNull(hand, "hand");
      if (side == Side.SENTE) senteHand = hand;
      else goteHand = hand;
      return this;
    }

    public Builder sideToMove(Side side) {
      this.sideToMove = Objects.requireNonNull(side, "side");
      return this;
    }

    public Position build() {
      return new Position(squares.clone(), senteHand, goteHand, sideToMove);
    }
  }
}
