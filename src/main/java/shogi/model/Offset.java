package shogi.model;

/**
 * A board displacement in canonical orientation: {@code dx} counts file columns in diagram order
 * (toward file 1 is positive), {@code dy} counts ranks with "forward" being negative.
 */
public record Offset(int dx, int dy) {

  /** Rank component as seen by {@code side}. */
  public int dy(Side side) {
    return dy * side.forward();
  }
}
