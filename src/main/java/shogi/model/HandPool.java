package shogi.model;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable multiset of captured pieces available for dropping. Counts are kept per
 * {@link PieceType}; a zero count and an absent entry are the same thing.
 */
public final class HandPool {

  public static final HandPool EMPTY = new HandPool(new int[PieceType.values().length]);

  private final int[] counts;

  private HandPool(int[] counts) {
    this.counts = counts;
  }

  /** Builds a pool from explicit counts; every count must be non-negative. */
  public static HandPool of(Map<PieceType, Integer> counts) {
    int[] c = new int[PieceType.values().length];
    counts.forEach((type, n) -> {
      if (n < 0) throw new IllegalArgumentException("Negative hand count for " + type + ": " + n);
      c[type.ordinal()] = n;
    });
    return new HandPool(c);
  }

  public int count(PieceType type) {
    return counts[type.ordinal()];
  }

  public boolean isEmpty() {
    for (int c : counts) if (c != 0) return false;
    return true;
  }

  /** A copy with one more {@code type}. */
  public HandPool plus(PieceType type) {
    int[] c = counts.clone();
    c[type.ordinal()]++;
    return new HandPool(c);
  }

  /**
   * A copy with one fewer {@code type}.
   *
   * @throws IllegalStateException if none is held; callers only drop pieces they hold
   */
  public HandPool minus(PieceType type) {
    if (counts[type.ordinal()] == 0) {
      throw new IllegalStateException("No " + type + " in hand");
    }
    int[] c = counts.clone();
    c[type.ordinal()]--;
    return new HandPool(c);
  }

  /** Non-zero counts in {@link PieceType} order. */
  public Map<PieceType, Integer> asMap() {
    Map<PieceType, Integer> m = new EnumMap<>(PieceType.class);
    for (PieceType t : PieceType.values()) {
      if (counts[t.ordinal()] > 0) m.put(t, counts[t.ordinal()]);
    }
    return m;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof HandPool h && Arrays.equals(counts, h.counts));
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(counts);
  }

  @Override
  public String toString() {
    return asMap().toString();
  }
}
