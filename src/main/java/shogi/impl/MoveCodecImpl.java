package shogi.impl;

import java.util.Objects;
import shogi.contracts.MoveCodec;
import shogi.contracts.MoveGenerator;
import shogi.model.Move;
import shogi.model.PieceFace;
import shogi.model.Position;
import shogi.model.Side;
import shogi.model.Square;
import shogi.model.SquareContent;
import shogi.model.TerminalReason;
import shogi.notation.NotationException;

/**
 * Move tokens of the form {@code +7776FU}: side marker, origin file and rank ({@code 00} for a
 * drop), destination file and rank, and the two-letter code of the face shown after the move.
 */
public final class MoveCodecImpl implements MoveCodec {

  public static final String RESIGN = "%TORYO";

  private static final int TOKEN_LENGTH = 7;

  private final MoveGenerator generator;

  public MoveCodecImpl(MoveGenerator generator) {
    this.generator = Objects.requireNonNull(generator, "generator");
  }

  public MoveCodecImpl() {
    this(new MoveGeneratorImpl());
  }

  @Override
  public Move decode(String token, Position before) {
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(before, "before");
    final String t = token.strip();
    final Side us = before.sideToMove();

    if (t.startsWith("%")) {
      if (t.equals(RESIGN)) return new Move.Terminal(TerminalReason.RESIGNATION, us.opponent());
      throw NotationException.at("'" + RESIGN + "'", t, 0);
    }
    if (t.length() != TOKEN_LENGTH) {
      throw NotationException.at("token of " + TOKEN_LENGTH + " characters like +7776FU", t, 0);
    }

    char marker = t.charAt(0);
    if (marker != Side.SENTE.recordMarker() && marker != Side.GOTE.recordMarker()) {
      throw NotationException.at("'+' or '-'", t, 0);
    }
    if (marker != us.recordMarker()) {
      throw NotationException.at("'" + us.recordMarker() + "' (" + us + " to move)", t, 0);
    }

    int fromFile = digit(t, 1);
    int fromRank = digit(t, 2);
    int toFile = digit(t, 3);
    int toRank = digit(t, 4);
    if (!Square.isOnBoard(toFile, toRank)) throw NotationException.at("destination square", t, 3);
    Square to = Square.of(toFile, toRank);

    PieceFace face = PieceFace.fromCode(t.substring(5))
        .orElseThrow(() -> NotationException.at("piece code (FU KY KE GI KI KA HI OU TO NY NK NG UM RY)", t, 5));

    Move move;
    if (fromFile == 0 && fromRank == 0) {
      if (face.isPromoted()) throw NotationException.at("unpromoted piece code for a drop", t, 5);
      if (before.hand(us).count(face.type()) == 0) {
        throw NotationException.at(face.type() + " in " + us + "'s hand", t, 5);
      }
      move = new Move.Drop(us, to, face.type());
    } else {
      if (!Square.isOnBoard(fromFile, fromRank)) throw NotationException.at("origin square", t, 1);
      Square from = Square.of(fromFile, fromRank);
      SquareContent origin = before.get(from);
      if (!origin.isOwnedBy(us) || origin.face().type() != face.type()) {
        throw NotationException.at(us + " " + face.type() + " on " + from + " (found " + origin + ")", t, 1);
      }
      boolean promote = origin.face() != face;
      if (promote && (!origin.face().isPromotable() || origin.face().promoted() != face)) {
        throw NotationException.at("code " + origin.face().code() + " or its promotion", t, 5);
      }
      move = new Move.Normal(us, from, to, origin.face(), promote);
    }

    if (!generator.generate(before).contains(move)) {
      throw NotationException.at("move playable in this position", t, 0);
    }
    return move;
  }

  @Override
  public String encode(Move move) {
    return switch (move.kind()) {
      case NORMAL -> {
        Move.Normal m = (Move.Normal) move;
        yield "" + m.side().recordMarker() + m.from() + m.to() + m.resultingFace().code();
      }
      case DROP -> {
        Move.Drop m = (Move.Drop) move;
        yield "" + m.side().recordMarker() + "00" + m.to() + m.type().baseFace().code();
      }
      case TERMINAL -> {
        Move.Terminal m = (Move.Terminal) move;
        if (m.reason() != TerminalReason.RESIGNATION) {
          throw new IllegalArgumentException("No record token for " + m.reason());
        }
        yield RESIGN;
      }
    };
  }

  private static int digit(String t, int at) {
    char c = t.charAt(at);
    if (c < '0' || c > '9') throw NotationException.at("digit", t, at);
    return c - '0';
  }
}
