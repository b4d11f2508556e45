package shogi.notation;

import static shogi.constants.CoreConstants.FILES;
import static shogi.constants.CoreConstants.MAX_HAND_COUNT;
import static shogi.constants.CoreConstants.RANKS;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import shogi.model.HandPool;
import shogi.model.PieceFace;
import shogi.model.PieceType;
import shogi.model.Position;
import shogi.model.Side;
import shogi.model.Square;

/**
 * Recursive-descent parser for board diagrams:
 *
 * <pre>
 * diagram := hand NEWLINE row{9} hand NEWLINE turn [NEWLINE] END
 * hand    := "持駒" ":" ( "なし" | ( piece [NUMBER] )+ )
 * row     := ( "|" cell ){9} "|" NEWLINE
 * cell    := "・" | side-marker piece
 * turn    := "手番" ":" ( "先手" | "後手" )
 * </pre>
 *
 * The first hand line belongs to GOTE, the second to SENTE. A failure raises
 * {@link NotationException} pointing at the first token that did not fit.
 */
public final class DiagramParser {

  public static final String HAND_LABEL = "持駒";
  public static final String NO_PIECES = "なし";
  public static final String TURN_LABEL = "手番";
  public static final String EMPTY_CELL = "・";

  private final String input;
  private final List<Token> tokens;
  private int pos;

  private DiagramParser(String input) {
    this.input = input;
    this.tokens = Tokenizer.tokenize(input);
  }

  public static Position parse(String input) {
    return new DiagramParser(input).diagram();
  }

  /* ────── grammar rules ────── */

  private Position diagram() {
    Position.Builder b = Position.builder();
    optional(Token.Type.NEWLINE);

    b.hand(Side.GOTE, hand());
    expect(Token.Type.NEWLINE, "line break after hand");

    for (int rank = 1; rank <= RANKS; rank++) row(b, rank);

    b.hand(Side.SENTE, hand());
    expect(Token.Type.NEWLINE, "line break after hand");

    b.sideToMove(turn());
    optional(Token.Type.NEWLINE);
    expect(Token.Type.END, "end of diagram");
    return b.build();
  }

  private HandPool hand() {
    keyword(HAND_LABEL);
    expect(Token.Type.COLON, "':' after " + HAND_LABEL);
    if (peek().isGlyph(NO_PIECES.substring(0, 1))) {
      keyword(NO_PIECES);
      return HandPool.EMPTY;
    }

    Map<PieceType, Integer> counts = new EnumMap<>(PieceType.class);
    do {
      Token t = peek();
      PieceType type = handPiece(t)
          .orElseThrow(() -> error("hand piece or " + NO_PIECES, t));
      pos++;
      int count = 1;
      if (peek().is(Token.Type.NUMBER)) count = handCount(next());
      int total = counts.merge(type, count, Integer::sum);
      if (total > MAX_HAND_COUNT) throw error("at most " + MAX_HAND_COUNT + " of " + type + " in hand", t);
    } while (handPiece(peek()).isPresent());
    return HandPool.of(counts);
  }

  private int handCount(Token t) {
    String digits = t.text();
    if (digits.length() > 2 || Integer.parseInt(digits) > MAX_HAND_COUNT) {
      throw error("hand count of at most " + MAX_HAND_COUNT, t);
    }
    return Integer.parseInt(digits);
  }

  private void row(Position.Builder b, int rank) {
    for (int file = FILES; file >= 1; file--) {
      expect(Token.Type.PIPE, "'|' before cell " + file + rank);
      cell(b, Square.of(file, rank));
    }
    expect(Token.Type.PIPE, "'|' closing rank " + rank);
    expect(Token.Type.NEWLINE, "line break after rank " + rank);
  }

  private void cell(Position.Builder b, Square sq) {
    Token t = peek();
    if (t.isGlyph(EMPTY_CELL)) {
      pos++;
      return;
    }
    Side side = null;
    for (Side s : Side.values()) if (t.isGlyph(s.marker())) side = s;
    if (side == null) throw error("'" + EMPTY_CELL + "' or side marker at " + sq, t);
    pos++;

    Token f = peek();
    PieceFace face = (f.is(Token.Type.GLYPH) ? PieceFace.fromGlyph(f.text()) : Optional.<PieceFace>empty())
        .orElseThrow(() -> error("piece glyph at " + sq, f));
    pos++;
    b.put(sq, side, face);
  }

  private Side turn() {
    keyword(TURN_LABEL);
    expect(Token.Type.COLON, "':' after " + TURN_LABEL);
    for (Side s : Side.values()) {
      if (peek().isGlyph(s.label().substring(0, 1))) {
        keyword(s.label());
        return s;
      }
    }
    throw error(Side.SENTE.label() + " or " + Side.GOTE.label(), peek());
  }

  /* ────── token helpers ────── */

  private static Optional<PieceType> handPiece(Token t) {
    if (!t.is(Token.Type.GLYPH)) return Optional.empty();
    return PieceFace.fromGlyph(t.text()).filter(f -> !f.isPromoted()).map(PieceFace::type);
  }

  /** Matches {@code word} as consecutive single-glyph tokens. */
  private void keyword(String word) {
    int i = 0;
    while (i < word.length()) {
      int cp = word.codePointAt(i);
      String glyph = new String(Character.toChars(cp));
      Token t = peek();
      if (!t.isGlyph(glyph)) throw error("'" + word + "'", t);
      pos++;
      i += Character.charCount(cp);
    }
  }

  private Token expect(Token.Type type, String what) {
    Token t = peek();
    if (!t.is(type)) throw error(what, t);
    pos++;
    return t;
  }

  private void optional(Token.Type type) {
    if (peek().is(type)) pos++;
  }

  private Token peek() {
    return tokens.get(pos);
  }

  private Token next() {
    return tokens.get(pos++);
  }

  private NotationException error(String expected, Token at) {
    return NotationException.at(expected, input, at.offset());
  }
}
