package shogi.notation;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class TokenizerTest {

  private static List<Token.Type> types(String s) {
    return Tokenizer.tokenize(s).stream().map(Token::type).collect(Collectors.toList());
  }

  @Test
  void handLine() {
    List<Token> t = Tokenizer.tokenize("持駒: 飛角2");
    assertEquals(List.of(Token.Type.GLYPH, Token.Type.GLYPH, Token.Type.COLON,
        Token.Type.GLYPH, Token.Type.GLYPH, Token.Type.NUMBER, Token.Type.END), types("持駒: 飛角2"));
    assertEquals("2", t.get(5).text());
    assertEquals(6, t.get(5).offset());
  }

  @Test
  void ideographicSpaceIsSkipped() {
    assertEquals(List.of(Token.Type.PIPE, Token.Type.GLYPH, Token.Type.PIPE, Token.Type.END),
        types("|　・|"));
  }

  @Test
  void lineBreakRunsCollapse() {
    List<Token> t = Tokenizer.tokenize("|\r\n\n  \n|");
    assertEquals(List.of(Token.Type.PIPE, Token.Type.NEWLINE, Token.Type.PIPE, Token.Type.END),
        t.stream().map(Token::type).collect(Collectors.toList()));
    assertEquals(1, t.get(1).offset());
  }

  @Test
  void endTokenSitsAtInputLength() {
    List<Token> t = Tokenizer.tokenize("");
    assertEquals(1, t.size());
    assertTrue(t.get(0).is(Token.Type.END));
    assertEquals(0, t.get(0).offset());
    assertEquals(3, Tokenizer.tokenize("歩12").get(2).offset());
  }
}
