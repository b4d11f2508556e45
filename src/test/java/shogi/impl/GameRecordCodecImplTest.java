package shogi.impl;

import static org.junit.jupiter.api.Assertions.*;
import static shogi.Fixtures.sq;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import shogi.Fixtures;
import shogi.contracts.GameRecordCodec;
import shogi.contracts.PositionFactory;
import shogi.model.Move;
import shogi.model.PieceFace;
import shogi.model.PieceType;
import shogi.model.Position;
import shogi.model.Side;
import shogi.model.TerminalReason;
import shogi.notation.NotationException;
import shogi.records.GameRecord;

class GameRecordCodecImplTest {

  private static final GameRecordCodec CODEC = new GameRecordCodecImpl();
  private static final PositionFactory PF = new PositionFactoryImpl();
  private static final String SAMPLE = Fixtures.resource("/records/bishop-exchange.csa");

  @Test
  void decodesTheSampleGame() {
    GameRecord r = CODEC.decode(SAMPLE);
    assertEquals("2.2", r.version());
    assertEquals("Sente Player", r.senteName());
    assertEquals("Gote Player", r.goteName());
    assertEquals(List.of("EVENT", "START_TIME"), List.copyOf(r.headers().keySet()));
    assertEquals("2024/05/01 10:00:00", r.headers().get("START_TIME"));
    assertEquals(PF.startPosition(), r.initial());

    assertEquals(6, r.moves().size());
    assertEquals(6, r.positions().size());
    assertEquals(new Move.Normal(Side.SENTE, sq(88), sq(22), PieceFace.BISHOP, true), r.moves().get(2));
    assertEquals(new Move.Drop(Side.SENTE, sq(45), PieceType.BISHOP), r.moves().get(4));
    assertEquals(new Move.Terminal(TerminalReason.RESIGNATION, Side.GOTE), r.resultIfAny().orElseThrow());

    assertEquals(PF.fromDiagram(Fixtures.resource("/positions/bishop-exchange-final.txt")), r.finalPosition());
  }

  @Test
  void encodesTheSampleGameCanonically() {
    String expected = String.join("\n",
        "V2.2",
        "N+Sente Player",
        "N-Gote Player",
        "$EVENT:Club match",
        "$START_TIME:2024/05/01 10:00:00",
        "PI",
        "+",
        "+7776FU",
        "-3334FU",
        "+8822UM",
        "-3122GI",
        "+0045KA",
        "-8232HI",
        "%TORYO",
        "");
    GameRecord r = CODEC.decode(SAMPLE);
    assertEquals(expected, CODEC.encode(r));
    assertEquals(r, CODEC.decode(CODEC.encode(r)));
  }

  @Test
  void explicitLayoutRoundTrips() {
    Position initial = PF.fromDiagram(Fixtures.resource("/positions/promoted-pieces.txt"));
    GameRecord r = new GameRecord(null, null, null, Map.of(), initial, List.of(), List.of(), null);
    String text = CODEC.encode(r);
    assertTrue(text.startsWith("P1"), text);
    assertTrue(text.contains("\nP+00KY00KY00KE00KA\n"), text);
    assertTrue(text.contains("\nP-00FU00FU00FU00GI00KI00KI00HI\n"), text);
    assertTrue(text.endsWith("\n-\n"), text);

    GameRecord back = CODEC.decode(text);
    assertEquals(initial, back.initial());
    assertNull(back.version());
    assertTrue(back.resultIfAny().isEmpty());
  }

  @Test
  void commaSeparatedStatementsAndCrlf() {
    GameRecord r = CODEC.decode("PI\r\n+\r\n+7776FU,T1,-3334FU,T2\r\n+2726FU\r\n");
    assertEquals(3, r.moves().size());
    assertSame(Side.GOTE, r.finalPosition().sideToMove());
  }

  @Test
  void commasInNamesAndHeadersSurviveARoundTrip() {
    GameRecord played = CODEC.decode("PI\n+\n+7776FU\n-3334FU\n");
    GameRecord r = new GameRecord("2.2", "Habu, Yoshiharu", "Fujii, Sota",
        Map.of("EVENT", "Meijin, game 1"), played.initial(), played.moves(), played.positions(), null);

    GameRecord back = CODEC.decode(CODEC.encode(r));
    assertEquals(r, back);
    assertEquals("Habu, Yoshiharu", back.senteName());
    assertEquals("Meijin, game 1", back.headers().get("EVENT"));
  }

  @Test
  void missingLayoutMeansTheStandardStart() {
    GameRecord r = CODEC.decode("+7776FU\n");
    assertEquals(PF.startPosition(), r.initial());
    assertEquals(1, r.moves().size());
  }

  @Test
  void handicapRemovesPiecesFromTheStandardLayout() {
    GameRecord r = CODEC.decode("PI82HI22KA\n-\n-5142OU\n");
    assertTrue(r.initial().get(sq(82)).isEmpty());
    assertTrue(r.initial().get(sq(22)).isEmpty());
    assertSame(Side.GOTE, r.initial().sideToMove());
    assertEquals(sq(42), r.finalPosition().kingSquare(Side.GOTE).orElseThrow());
  }

  @Test
  void emptyRecordIsTheStartPosition() {
    GameRecord r = CODEC.decode("");
    assertEquals(PF.startPosition(), r.initial());
    assertEquals(r.initial(), r.finalPosition());
  }

  @Test
  void illegalMoveIsReportedAtItsOffset() {
    String text = "PI\n+\n+7776FU\n-3335FU\n";
    NotationException e = assertThrows(NotationException.class, () -> CODEC.decode(text));
    assertEquals(text.indexOf("-3335FU"), e.offset());
    assertTrue(e.remainder().startsWith("-3335FU"));
  }

  @Test
  void codeErrorsAreShiftedIntoTheRecord() {
    String text = "PI\n+\n+7776ZZ\n";
    NotationException e = assertThrows(NotationException.class, () -> CODEC.decode(text));
    assertEquals(text.indexOf("ZZ"), e.offset());
  }

  @Test
  void nothingMayFollowTheResult() {
    assertThrows(NotationException.class, () -> CODEC.decode("PI\n+\n%TORYO\n-3334FU\n"));
  }

  @Test
  void setupAfterTheFirstMoveIsRejected() {
    assertThrows(NotationException.class, () -> CODEC.decode("PI\n+\n+7776FU\n$EVENT:late\n"));
  }

  @Test
  void unknownStatementIsRejected() {
    NotationException e = assertThrows(NotationException.class, () -> CODEC.decode("PI\n?what\n"));
    assertEquals(3, e.offset());
  }

  @Test
  void removalMustMatchTheLayout() {
    assertThrows(NotationException.class, () -> CODEC.decode("PI55HI\n"));
  }
}
