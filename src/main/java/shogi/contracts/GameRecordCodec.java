package shogi.contracts;

import shogi.records.GameRecord;

/** Whole game records: headers, the starting layout and the move list. */
public interface GameRecordCodec {

  /**
   * Parses a record and replays its moves.
   *
   * @throws shogi.notation.NotationException on malformed lines or moves that do not fit
   */
  GameRecord decode(String text);

  String encode(GameRecord record);
}
