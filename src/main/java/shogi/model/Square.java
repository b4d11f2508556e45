package shogi.model;

import static shogi.constants.CoreConstants.FILES;
import static shogi.constants.CoreConstants.RANKS;
import static shogi.constants.CoreConstants.SQUARES;

import java.util.List;

/**
 * One of the 81 board squares. Files run 9..1 from left to right as printed, ranks 1..9 from top to
 * bottom, so {@link #index()} follows diagram reading order:
 *
 * <pre>
 * index = (rank - 1) * 9 + (9 - file)      9一 = 0, 1一 = 8, 1九 = 80
 * </pre>
 *
 * Instances are interned; compare with {@code ==} or {@link #equals}.
 */
public final class Square implements Comparable<Square> {

  private static final Square[] BY_INDEX = new Square[SQUARES];

  static {
    for (int i = 0; i < SQUARES; i++) {
      BY_INDEX[i] = new Square(FILES - i % FILES, i / FILES + 1, i);
    }
  }

  /** All squares in index order. */
  public static final List<Square> ALL = List.of(BY_INDEX);

  private final int file;
  private final int rank;
  private final int index;

  private Square(int file, int rank, int index) {
    this.file = file;
    this.rank = rank;
    this.index = index;
  }

  public static Square of(int file, int rank) {
    if (file < 1 || file > FILES || rank < 1 || rank > RANKS) {
      throw new IllegalArgumentException("No such square: file=" + file + " rank=" + rank);
    }
    return BY_INDEX[(rank - 1) * FILES + (FILES - file)];
  }

  public static Square of(int index) {
    if (index < 0 || index >= SQUARES) {
      throw new IllegalArgumentException("Square index out of range: " + index);
    }
    return BY_INDEX[index];
  }

  public static boolean isOnBoard(int file, int rank) {
    return file >= 1 && file <= FILES && rank >= 1 && rank <= RANKS;
  }

  public int file() {
    return file;
  }

  public int rank() {
    return rank;
  }

  public int index() {
    return index;
  }

  /**
   * The square {@code dx} columns to the right (in diagram order) and {@code dy} ranks down, or
   * {@code null} when that falls off the board.
   */
  public Square shift(int dx, int dy) {
    int f = file - dx;
    int r = rank + dy;
    return isOnBoard(f, r) ? BY_INDEX[(r - 1) * FILES + (FILES - f)] : null;
  }

  @Override
  public int compareTo(Square o) {
    return Integer.compare(index, o.index);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Square s && s.index == index);
  }

  @Override
  public int hashCode() {
    return index;
  }

  /** File digit followed by rank digit, e.g. {@code 76}. */
  @Override
  public String toString() {
    return "" + file + rank;
  }
}
