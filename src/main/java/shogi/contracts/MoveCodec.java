package shogi.contracts;

import shogi.model.Move;
import shogi.model.Position;

/** Single-move tokens of the game record, e.g. {@code +7776FU}, {@code -0055KA}, {@code %TORYO}. */
public interface MoveCodec {

  /**
   * Decodes {@code token} played in {@code before}. Promotion is inferred by comparing the token's
   * face with the face on the origin square.
   *
   * @throws shogi.notation.NotationException if the token is malformed or does not fit
   *     {@code before}
   */
  Move decode(String token, Position before);

  String encode(Move move);
}
