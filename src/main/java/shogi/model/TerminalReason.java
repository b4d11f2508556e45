package shogi.model;

/** Why a game ended. */
public enum TerminalReason {
  /** A player resigned. */
  RESIGNATION,
  /** The side to move had no safe king step. */
  CHECKMATE,
  /** The side to move left its king where the opponent can take it. */
  KING_LEFT_EN_PRISE
}
