package shogi.notation;

/**
 * One lexical unit of a board diagram.
 *
 * @param type   token category
 * @param text   source text; a single code point for {@link Type#GLYPH}
 * @param offset position of the first character in the source
 */
public record Token(Type type, String text, int offset) {

  public enum Type {
    /** Any single non-space character that is not otherwise classified. */
    GLYPH,
    /** A run of ASCII digits. */
    NUMBER,
    PIPE,
    COLON,
    /** One or more consecutive line breaks. */
    NEWLINE,
    END
  }

  public boolean is(Type t) {
    return type == t;
  }

  public boolean isGlyph(String glyph) {
    return type == Type.GLYPH && text.equals(glyph);
  }

  @Override
  public String toString() {
    return type == Type.END ? "end of input" : type + "'" + text + "'";
  }
}
