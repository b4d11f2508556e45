package shogi.impl;

import static shogi.constants.CoreConstants.FILES;
import static shogi.constants.CoreConstants.RANKS;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shogi.contracts.GameRecordCodec;
import shogi.contracts.MoveCodec;
import shogi.contracts.MoveExecutor;
import shogi.model.HandPool;
import shogi.model.Move;
import shogi.model.PieceFace;
import shogi.model.PieceType;
import shogi.model.Position;
import shogi.model.Side;
import shogi.model.Square;
import shogi.model.SquareContent;
import shogi.notation.NotationException;
import shogi.records.GameRecord;

/**
 * Line-oriented game records in the CSA style:
 *
 * <pre>
 * 'comment
 * V2.2
 * N+first player
 * N-second player
 * $EVENT:club match
 * PI                  standard layout, optionally followed by removals such as 82HI
 * P1-KY-KE ...        or explicit ranks P1..P9 and hand lines P+00KA00FU
 * +                   first side to move
 * +7776FU,T12
 * -3334FU
 * %TORYO
 * </pre>
 *
 * Move and time statements may share a line separated by commas; other lines are read whole.
 * Time statements are ignored.
 */
public final class GameRecordCodecImpl implements GameRecordCodec {

  private static final Logger log = LoggerFactory.getLogger(GameRecordCodecImpl.class);

  private static final String EMPTY_CELL = " * ";
  private static final String HAND_SQUARE = "00";
  private static final int CELL_WIDTH = 3;
  private static final int PLACEMENT_WIDTH = 4;

  private final MoveCodec moveCodec;
  private final MoveExecutor executor;
  private final Position standardStart;

  public GameRecordCodecImpl(MoveCodec moveCodec, MoveExecutor executor) {
    this.moveCodec = Objects.requireNonNull(moveCodec, "moveCodec");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.standardStart = new PositionFactoryImpl().startPosition();
  }

  public GameRecordCodecImpl() {
    this(new MoveCodecImpl(), new MoveExecutorImpl());
  }

  /* ────── decoding ────── */

  @Override
  public GameRecord decode(String text) {
    Objects.requireNonNull(text, "text");
    GameRecord record = new Reader(text).read();
    log.debug("decoded record with {} moves, result {}", record.moves().size(), record.result());
    return record;
  }

  private final class Reader {
    private final String text;

    private String version;
    private String senteName;
    private String goteName;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private Position.Builder layout;
    private Side firstToMove;

    private Position initial;
    private Position current;
    private final List<Move> moves = new ArrayList<>();
    private final List<Position> positions = new ArrayList<>();
    private Move.Terminal result;

    Reader(String text) {
      this.text = text;
    }

    GameRecord read() {
      int lineStart = 0;
      while (lineStart <= text.length()) {
        int nl = text.indexOf('\n', lineStart);
        int lineEnd = nl < 0 ? text.length() : nl;
        line(lineStart, lineEnd);
        if (nl < 0) break;
        lineStart = nl + 1;
      }
      if (initial == null) beginMoves(text.length());
      return new GameRecord(version, senteName, goteName, headers, initial, moves, positions, result);
    }

    private void line(int start, int end) {
      if (end > start && text.charAt(end - 1) == '\r') end--;
      if (start < end && text.charAt(start) == '\'') return;

      String raw = text.substring(start, end);
      String whole = raw.strip();
      if (!whole.isEmpty() && !splitsOnCommas(whole.charAt(0))) {
        statement(whole, start + raw.indexOf(whole));
        return;
      }

      int at = start;
      while (at <= end) {
        int comma = text.indexOf(',', at);
        int stmtEnd = comma < 0 || comma > end ? end : comma;
        String piece = text.substring(at, stmtEnd);
        String s = piece.strip();
        statement(s, at + (s.isEmpty() ? 0 : piece.indexOf(s)));
        at = stmtEnd + 1;
      }
    }

    /* names, headers, version and layout lines may contain commas */
    private boolean splitsOnCommas(char first) {
      return first == '+' || first == '-' || first == '%' || first == 'T';
    }

    private void statement(String s, int at) {
      if (s.isEmpty()) return;
      switch (s.charAt(0)) {
        case 'V' -> {
          header(at);
          version = s.substring(1);
        }
        case 'N' -> {
          header(at);
          if (s.startsWith("N+")) senteName = s.substring(2);
          else if (s.startsWith("N-")) goteName = s.substring(2);
          else throw NotationException.at("'N+' or 'N-'", text, at);
        }
        case '$' -> {
          header(at);
          int colon = s.indexOf(':');
          if (colon < 0) throw NotationException.at("':' in header", text, at);
          headers.put(s.substring(1, colon), s.substring(colon + 1));
        }
        case 'P' -> {
          header(at);
          layoutLine(s, at);
        }
        case 'T' -> log.trace("ignoring time statement {}", s);
        case '+', '-' -> {
          if (s.length() == 1) {
            header(at);
            firstToMove = s.charAt(0) == Side.SENTE.recordMarker() ? Side.SENTE : Side.GOTE;
          } else {
            play(s, at);
          }
        }
        case '%' -> play(s, at);
        default -> throw NotationException.at("record statement", text, at);
      }
    }

    /* setup statements are only allowed before the first move */
    private void header(int at) {
      if (initial != null) throw NotationException.at("move or time statement", text, at);
    }

    private void play(String token, int at) {
      if (initial == null) beginMoves(at);
      if (result != null) throw NotationException.at("end of record after " + result.reason(), text, at);

      Move move = decodeMove(token, at);
      if (move instanceof Move.Terminal t) {
        result = t;
        return;
      }
      current = executor.apply(current, move)
          .orElseThrow(() -> new IllegalStateException("No successor for " + move));
      moves.add(move);
      positions.add(current);
    }

    private Move decodeMove(String token, int at) {
      try {
        return moveCodec.decode(token, current);
      } catch (NotationException e) {
        throw NotationException.at(e.expected(), text, at + e.offset());
      }
    }

    private void beginMoves(int at) {
      Position.Builder b;
      if (layout != null) {
        b = layout;
      } else {
        log.debug("record has no layout statement at offset {}, assuming the standard start", at);
        b = standardStart.toBuilder();
      }
      b.sideToMove(firstToMove == null ? Side.SENTE : firstToMove);
      initial = b.build();
      current = initial;
    }

    /* ────── P statements ────── */

    private void layoutLine(String s, int at) {
      if (s.length() < 2) throw NotationException.at("'PI', 'P1'..'P9', 'P+' or 'P-'", text, at);
      char kind = s.charAt(1);
      if (kind == 'I') {
        if (layout != null) throw NotationException.at("a single layout", text, at);
        layout = standardStart.toBuilder();
        removals(s, at);
      } else if (kind >= '1' && kind <= '9') {
        rankLine(s, kind - '0', at);
      } else if (kind == '+' || kind == '-') {
        placements(s, kind == '+' ? Side.SENTE : Side.GOTE, at);
      } else {
        throw NotationException.at("'PI', 'P1'..'P9', 'P+' or 'P-'", text, at + 1);
      }
    }

    /* PI82HI22KA: pieces taken off the standard layout */
    private void removals(String s, int at) {
      for (int i = 2; i < s.length(); i += PLACEMENT_WIDTH) {
        if (i + PLACEMENT_WIDTH > s.length()) throw NotationException.at("square and piece code", text, at + i);
        Square sq = square(s, i, at);
        PieceFace face = face(s, i + 2, at);
        if (layout.get(sq).isEmpty() || layout.get(sq).face() != face) {
          throw NotationException.at(face.code() + " on " + sq, text, at + i);
        }
        layout.clear(sq);
      }
    }

    private void rankLine(String statement, int rank, int at) {
      if (layout == null) layout = Position.builder();
      final int width = 2 + FILES * CELL_WIDTH;
      // a trailing empty cell loses its last blank to strip()
      String s = statement.length() < width ? statement + " ".repeat(width - statement.length()) : statement;
      if (s.length() != width) {
        throw NotationException.at(FILES + " cells of " + CELL_WIDTH + " characters", text, at + 2);
      }
      for (int f = 0; f < FILES; f++) {
        int i = 2 + f * CELL_WIDTH;
        Square sq = Square.of(FILES - f, rank);
        String cell = s.substring(i, i + CELL_WIDTH);
        if (cell.equals(EMPTY_CELL)) {
          layout.clear(sq);
          continue;
        }
        Side side = marker(s.charAt(i), at + i);
        layout.put(sq, side, face(s, i + 1, at));
      }
    }

    /* P+00KA00FU55GI: hand pieces (square 00) or extra board pieces */
    private void placements(String s, Side side, int at) {
      if (layout == null) layout = Position.builder();
      for (int i = 2; i < s.length(); i += PLACEMENT_WIDTH) {
        if (i + PLACEMENT_WIDTH > s.length()) throw NotationException.at("square and piece code", text, at + i);
        PieceFace face = face(s, i + 2, at);
        if (s.startsWith(HAND_SQUARE, i)) {
          if (face.isPromoted()) throw NotationException.at("unpromoted piece code in hand", text, at + i + 2);
          layout.hand(side, layout.hand(side).plus(face.type()));
        } else {
          layout.put(square(s, i, at), side, face);
        }
      }
    }

    private Square square(String s, int i, int at) {
      int file = s.charAt(i) - '0';
      int rank = s.charAt(i + 1) - '0';
      if (!Square.isOnBoard(file, rank)) throw NotationException.at("square 11..99", text, at + i);
      return Square.of(file, rank);
    }

    private PieceFace face(String s, int i, int at) {
      return PieceFace.fromCode(s.substring(i, Math.min(i + 2, s.length())))
          .orElseThrow(() -> NotationException.at("piece code", text, at + i));
    }

    private Side marker(char c, int offset) {
      if (c == Side.SENTE.recordMarker()) return Side.SENTE;
      if (c == Side.GOTE.recordMarker()) return Side.GOTE;
      throw NotationException.at("'+', '-' or empty cell", text, offset);
    }
  }

  /* ────── encoding ────── */

  @Override
  public String encode(GameRecord record) {
    StringBuilder sb = new StringBuilder(1024);
    if (record.version() != null) sb.append('V').append(record.version()).append('\n');
    if (record.senteName() != null) sb.append("N+").append(record.senteName()).append('\n');
    if (record.goteName() != null) sb.append("N-").append(record.goteName()).append('\n');
    record.headers().forEach((k, v) -> sb.append('$').append(k).append(':').append(v).append('\n'));

    Position initial = record.initial();
    if (initial.toBuilder().sideToMove(standardStart.sideToMove()).build().equals(standardStart)) {
      sb.append("PI\n");
    } else {
      appendLayout(sb, initial);
    }
    sb.append(initial.sideToMove().recordMarker()).append('\n');

    for (Move m : record.moves()) sb.append(moveCodec.encode(m)).append('\n');
    record.resultIfAny().ifPresent(r -> sb.append(moveCodec.encode(r)).append('\n'));
    return sb.toString();
  }

  private static void appendLayout(StringBuilder sb, Position p) {
    for (int rank = 1; rank <= RANKS; rank++) {
      sb.append('P').append(rank);
      for (int file = FILES; file >= 1; file--) {
        SquareContent c = p.get(Square.of(file, rank));
        if (c.isEmpty()) sb.append(EMPTY_CELL);
        else sb.append(c.side().recordMarker()).append(c.face().code());
      }
      sb.append('\n');
    }
    for (Side side : Side.values()) {
      HandPool hand = p.hand(side);
      if (hand.isEmpty()) continue;
      sb.append('P').append(side.recordMarker());
      for (Map.Entry<PieceType, Integer> e : hand.asMap().entrySet()) {
        for (int n = 0; n < e.getValue(); n++) sb.append(HAND_SQUARE).append(e.getKey().baseFace().code());
      }
      sb.append('\n');
    }
  }
}
