package shogi;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import shogi.model.PieceFace;
import shogi.model.Position;
import shogi.model.Side;
import shogi.model.Square;

/** Classpath fixtures and small board-building helpers shared by the tests. */
public final class Fixtures {

  private Fixtures() {}

  public static String resource(String path) {
    try (InputStream is = Objects.requireNonNull(Fixtures.class.getResourceAsStream(path), path)) {
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Shorthand for {@link Square#of(int, int)} written as a two-digit number, e.g. {@code sq(76)}. */
  public static Square sq(int fileRank) {
    return Square.of(fileRank / 10, fileRank % 10);
  }

  /** An otherwise empty board with both kings in their home squares. */
  public static Position.Builder kingsOnly(Side toMove) {
    return Position.builder()
        .put(sq(59), Side.SENTE, PieceFace.KING)
        .put(sq(51), Side.GOTE, PieceFace.KING)
        .sideToMove(toMove);
  }
}
