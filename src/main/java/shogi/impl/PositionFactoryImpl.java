package shogi.impl;

import static shogi.constants.CoreConstants.FILES;
import static shogi.constants.CoreConstants.RANKS;

import java.util.Objects;
import shogi.contracts.PositionFactory;
import shogi.model.HandPool;
import shogi.model.PieceType;
import shogi.model.Position;
import shogi.model.Side;
import shogi.model.Square;
import shogi.notation.DiagramParser;

public final class PositionFactoryImpl implements PositionFactory {

  static final String START_DIAGRAM = String.join("\n",
      "持駒: なし",
      "|▽香|▽桂|▽銀|▽金|▽玉|▽金|▽銀|▽桂|▽香|",
      "|　・|▽飛|　・|　・|　・|　・|　・|▽角|　・|",
      "|▽歩|▽歩|▽歩|▽歩|▽歩|▽歩|▽歩|▽歩|▽歩|",
      "|　・|　・|　・|　・|　・|　・|　・|　・|　・|",
      "|　・|　・|　・|　・|　・|　・|　・|　・|　・|",
      "|　・|　・|　・|　・|　・|　・|　・|　・|　・|",
      "|▲歩|▲歩|▲歩|▲歩|▲歩|▲歩|▲歩|▲歩|▲歩|",
      "|　・|▲角|　・|　・|　・|　・|　・|▲飛|　・|",
      "|▲香|▲桂|▲銀|▲金|▲玉|▲金|▲銀|▲桂|▲香|",
      "持駒: なし",
      "手番: 先手");

  private static final Position START = DiagramParser.parse(START_DIAGRAM);

  @Override
  public Position startPosition() {
    return START;
  }

  @Override
  public Position fromDiagram(String diagram) {
    Objects.requireNonNull(diagram, "diagram");
    return DiagramParser.parse(diagram);
  }

  @Override
  public String toDiagram(Position position) {
    StringBuilder sb = new StringBuilder(512);
    appendHand(sb, position.hand(Side.GOTE));
    for (int rank = 1; rank <= RANKS; rank++) {
      sb.append('|');
      for (int file = FILES; file >= 1; file--) {
        sb.append(position.get(Square.of(file, rank)).symbol()).append('|');
      }
      sb.append('\n');
    }
    appendHand(sb, position.hand(Side.SENTE));
    sb.append(DiagramParser.TURN_LABEL).append(": ").append(position.sideToMove().label());
    return sb.toString();
  }

  /* king first, pawn last, count only when above one */
  private static void appendHand(StringBuilder sb, HandPool hand) {
    sb.append(DiagramParser.HAND_LABEL).append(": ");
    if (hand.isEmpty()) {
      sb.append(DiagramParser.NO_PIECES);
    } else {
      PieceType[] types = PieceType.values();
      for (int i = types.length - 1; i >= 0; i--) {
        int n = hand.count(types[i]);
        if (n == 0) continue;
        sb.append(types[i].glyph());
        if (n > 1) sb.append(n);
      }
    }
    sb.append('\n');
  }
}
