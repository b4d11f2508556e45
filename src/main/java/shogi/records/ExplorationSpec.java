package shogi.records;

import static shogi.constants.CoreConstants.DEFAULT_MAX_NODES;
import static shogi.constants.CoreConstants.MAX_EXPLORATION_DEPTH;

/**
 * Immutable set of <em>exploration limits</em>.
 *
 * Use the nested {@link Builder} to construct an instance of this record.
 *
 * @param depth            Number of plies to expand below the root (≥ 1).
 * @param maxNodes         Hard node budget (0 = unlimited).
 * @param collectPositions Keep every reached position in the result, not just the counts.
 */
public record ExplorationSpec(int depth, long maxNodes, boolean collectPositions) {

  public ExplorationSpec {
    if (depth < 1 || depth > MAX_EXPLORATION_DEPTH) {
      throw new IllegalArgumentException(
          "Exploration depth must be in 1.." + MAX_EXPLORATION_DEPTH + ", got " + depth);
    }
    if (maxNodes < 0) {
      throw new IllegalArgumentException("Node budget cannot be negative: " + maxNodes);
    }
  }

  public boolean unlimitedNodes() {
    return maxNodes == 0;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Fluent construction of {@link ExplorationSpec}; unset fields keep their defaults. */
  public static class Builder {
    private int depth = 1;
    private long maxNodes = DEFAULT_MAX_NODES;
    private boolean collectPositions = false;

    public Builder depth(int depth) { this.depth = depth; return this; }
    public Builder maxNodes(long maxNodes) { this.maxNodes = maxNodes; return this; }
    public Builder collectPositions(boolean collect) { this.collectPositions = collect; return this; }

    public ExplorationSpec build() {
      return new ExplorationSpec(depth, maxNodes, collectPositions);
    }
  }
}
