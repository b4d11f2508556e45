package shogi.constants;

/**
 * Central place for the rules engine's compile-time constants.
 */
public final class CoreConstants {

  private CoreConstants() {}

  /* ────────────── Board geometry ────────────── */
  public static final int FILES = 9;
  public static final int RANKS = 9;
  public static final int SQUARES = FILES * RANKS;

  /** Number of ranks, counted from a side's far edge, that form its promotion zone. */
  public static final int PROMOTION_ZONE_DEPTH = 3;

  /** Largest number of one piece type a hand can hold (all eighteen pawns). */
  public static final int MAX_HAND_COUNT = 18;

  /* ────────────── Exploration limits ────────────── */

  /** Hard cap on exploration depth; the tree grows roughly 80-fold per ply in the middle game. */
  public static final int MAX_EXPLORATION_DEPTH = 8;

  /** Default node budget of a single exploration (0 = unlimited). */
  public static final long DEFAULT_MAX_NODES = 5_000_000L;

  /** How often (in expanded nodes) a worker polls the stop flag. */
  public static final int STOP_POLL_INTERVAL = 1024;

  /** Maximum number of positions an exploration keeps when asked to collect them. */
  public static final int MAX_COLLECTED_POSITIONS = 1_000_000;
}
