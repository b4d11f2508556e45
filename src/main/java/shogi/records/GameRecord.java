package shogi.records;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import shogi.model.Move;
import shogi.model.Position;

/**
 * A replayed game record.
 *
 * @param version   format version without the leading {@code V}, e.g. {@code 2.2}, or {@code null}
 * @param senteName first player's name, or {@code null}
 * @param goteName  second player's name, or {@code null}
 * @param headers   {@code $KEY:VALUE} lines in file order
 * @param initial   position before the first move
 * @param moves     board moves and drops, in order
 * @param positions {@code positions.get(i)} is the position after {@code moves.get(i)}
 * @param result    how the game ended, or {@code null} if the record stops mid-game
 */
public record GameRecord(
    String version,
    String senteName,
    String goteName,
    Map<String, String> headers,
    Position initial,
    List<Move> moves,
    List<Position> positions,
    Move.Terminal result) {

  public GameRecord {
    Objects.requireNonNull(initial, "initial");
    headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    moves = List.copyOf(moves);
    positions = List.copyOf(positions);
    if (moves.size() != positions.size()) {
      throw new IllegalArgumentException(
          "Expected one position per move: " + moves.size() + " moves, " + positions.size() + " positions");
    }
  }

  /** Position after the last move. */
  public Position finalPosition() {
    return positions.isEmpty() ? initial : positions.get(positions.size() - 1);
  }

  public Optional<Move.Terminal> resultIfAny() {
    return Optional.ofNullable(result);
  }
}
