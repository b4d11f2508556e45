package shogi.notation;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits diagram text into {@link Token}s. Spaces (including the ideographic space used to pad
 * empty cells) separate tokens and are dropped; runs of line breaks collapse into one
 * {@link Token.Type#NEWLINE}. The list always ends with {@link Token.Type#END}.
 */
public final class Tokenizer {

  private Tokenizer() {}

  public static List<Token> tokenize(String input) {
    List<Token> out = new ArrayList<>();
    int i = 0;
    final int n = input.length();
    while (i < n) {
      int cp = input.codePointAt(i);
      int width = Character.charCount(cp);
      if (cp == '\n' || cp == '\r') {
        int start = i;
        while (i < n && (input.charAt(i) == '\n' || input.charAt(i) == '\r' || isBlank(input.charAt(i)))) i++;
        out.add(new Token(Token.Type.NEWLINE, input.substring(start, i), start));
      } else if (isBlank(cp)) {
        i += width;
      } else if (cp >= '0' && cp <= '9') {
        int start = i;
        while (i < n && input.charAt(i) >= '0' && input.charAt(i) <= '9') i++;
        out.add(new Token(Token.Type.NUMBER, input.substring(start, i), start));
      } else if (cp == '|') {
        out.add(new Token(Token.Type.PIPE, "|", i));
        i += width;
      } else if (cp == ':') {
        out.add(new Token(Token.Type.COLON, ":", i));
        i += width;
      } else {
        out.add(new Token(Token.Type.GLYPH, input.substring(i, i + width), i));
        i += width;
      }
    }
    out.add(new Token(Token.Type.END, "", n));
    return out;
  }

  private static boolean isBlank(int cp) {
    return cp != '\n' && cp != '\r' && Character.isWhitespace(cp);
  }
}
