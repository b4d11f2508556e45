package shogi.records;

import java.util.List;
import shogi.model.Position;

/**
 * Outcome of an exploration.
 *
 * @param nodesPerPly number of positions reached at ply 1, 2, … (index 0 is ply 1)
 * @param positions   reached positions when collection was requested, otherwise empty
 * @param truncated   {@code true} if the node budget or a stop request cut the exploration short
 * @param timeMs      wall-clock duration
 */
public record ExplorationResult(
    List<Long> nodesPerPly,
    List<Position> positions,
    boolean truncated,
    long timeMs) {

  public ExplorationResult {
    nodesPerPly = List.copyOf(nodesPerPly);
    positions = List.copyOf(positions);
  }

  /** Sum over all plies. */
  public long totalNodes() {
    long n = 0;
    for (long c : nodesPerPly) n += c;
    return n;
  }

  /** Positions at the deepest ply, the classic perft figure. */
  public long leafNodes() {
    return nodesPerPly.isEmpty() ? 0 : nodesPerPly.get(nodesPerPly.size() - 1);
  }
}
