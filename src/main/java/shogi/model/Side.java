package shogi.model;

import static shogi.constants.CoreConstants.PROMOTION_ZONE_DEPTH;
import static shogi.constants.CoreConstants.RANKS;

/**
 * The two players. {@link #SENTE} moves first and advances toward rank 1; {@link #GOTE} advances
 * toward rank 9.
 */
public enum Side {
  SENTE(+1, "▲", "先手", '+'),
  GOTE(-1, "▽", "後手", '-');

  private final int forward;
  private final String marker;
  private final String label;
  private final char recordMarker;

  Side(int forward, String marker, String label, char recordMarker) {
    this.forward = forward;
    this.marker = marker;
    this.label = label;
    this.recordMarker = recordMarker;
  }

  public Side opponent() {
    return this == SENTE ? GOTE : SENTE;
  }

  /**
   * Sign applied to the rank component of a canonical (forward = rank − 1) offset. Multiplying by
   * this mirrors movement geometry for the second player.
   */
  public int forward() {
    return forward;
  }

  /** The rank farthest from this side's own camp (1 for SENTE, 9 for GOTE). */
  public int farthestRank() {
    return this == SENTE ? 1 : RANKS;
  }

  /** Distance of {@code rank} from this side's farthest rank, 0 on the farthest rank itself. */
  public int ranksFromFarEdge(int rank) {
    return this == SENTE ? rank - 1 : RANKS - rank;
  }

  /** Ranks 1–3 for SENTE, 7–9 for GOTE. */
  public boolean inPromotionZone(int rank) {
    return ranksFromFarEdge(rank) < PROMOTION_ZONE_DEPTH;
  }

  /** Diagram marker placed in front of a piece glyph ("▲" or "▽"). */
  public String marker() {
    return marker;
  }

  /** Name used on the diagram's turn line ("先手" or "後手"). */
  public String label() {
    return label;
  }

  /** Leading character of a move token ('+' or '-'). */
  public char recordMarker() {
    return recordMarker;
  }
}
