package shogi.contracts;

import shogi.model.Position;

public interface PositionFactory {

  /** The standard even-game starting layout, SENTE to move. */
  Position startPosition();

  /**
   * Parses a board diagram.
   *
   * @throws shogi.notation.NotationException with the unconsumed remainder on malformed input
   */
  Position fromDiagram(String diagram);

  /** Renders {@code position} so that {@code fromDiagram(toDiagram(p)).equals(p)}. */
  String toDiagram(Position position);
}
