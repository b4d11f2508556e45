package shogi.notation;

/**
 * Malformed board-diagram, move-token or game-record text. Carries what the parser expected, where
 * it stopped, and the input it could not consume, so callers can report or retry.
 */
public class NotationException extends IllegalArgumentException {

  private static final int MAX_REMAINDER_IN_MESSAGE = 40;

  private final String expected;
  private final int offset;
  private final String remainder;

  public NotationException(String expected, int offset, String remainder) {
    super(format(expected, offset, remainder));
    this.expected = expected;
    this.offset = offset;
    this.remainder = remainder;
  }

  /** Convenience for a failure at {@code offset} into {@code input}. */
  public static NotationException at(String expected, String input, int offset) {
    int clamped = Math.max(0, Math.min(offset, input.length()));
    return new NotationException(expected, clamped, input.substring(clamped));
  }

  /** Human-readable description of what the parser was looking for. */
  public String expected() {
    return expected;
  }

  /** Character offset of the failure within the parsed text. */
  public int offset() {
    return offset;
  }

  /** Unconsumed input starting at {@link #offset()}. */
  public String remainder() {
    return remainder;
  }

  private static String format(String expected, int offset, String remainder) {
    String shown = remainder.length() > MAX_REMAINDER_IN_MESSAGE
        ? remainder.substring(0, MAX_REMAINDER_IN_MESSAGE) + "…"
        : remainder;
    return "expected " + expected + " at offset " + offset + ": ^" + shown;
  }
}
