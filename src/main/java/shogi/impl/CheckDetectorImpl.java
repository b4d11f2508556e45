package shogi.impl;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import shogi.contracts.CheckDetector;
import shogi.contracts.MoveExecutor;
import shogi.contracts.MoveGenerator;
import shogi.model.Move;
import shogi.model.Position;
import shogi.model.Side;
import shogi.model.Square;
import shogi.model.TerminalReason;

/**
 * King safety on top of the pseudo-legal generator.
 *
 * <p>{@link #isCheckmate} tests king mobility only. It does not try to capture the checking piece
 * or to interpose a piece or a drop, and it does not ask whether the king currently stands in
 * check, so a boxed-in king is reported mated even when another move would save it.
 */
public final class CheckDetectorImpl implements CheckDetector {

  private final MoveGenerator generator;
  private final MoveExecutor executor;

  public CheckDetectorImpl(MoveGenerator generator, MoveExecutor executor) {
    this.generator = Objects.requireNonNull(generator, "generator");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public CheckDetectorImpl() {
    this(new MoveGeneratorImpl(), new MoveExecutorImpl());
  }

  @Override
  public List<Move> kingCaptures(Position position, Side attacker) {
    Optional<Square> king = position.kingSquare(attacker.opponent());
    if (king.isPresent() && !generator.attackersOf(position, attacker, king.get()).isEmpty()) {
      return List.of(new Move.Terminal(TerminalReason.KING_LEFT_EN_PRISE, attacker));
    }
    return List.of();
  }

  @Override
  public List<Move> generateWithKingCapture(Position position) {
    List<Move> moves = new ArrayList<>(generator.generate(position));
    moves.addAll(kingCaptures(position, position.sideToMove()));
    return moves;
  }

  @Override
  public List<Move> legalMoves(Position position) {
    final Side us = position.sideToMove();
    List<Move> out = new ArrayList<>();
    for (Move m : generator.generate(position)) {
      Optional<Position> next = executor.apply(position, m);
      if (next.isPresent() && kingCaptures(next.get(), us.opponent()).isEmpty()) out.add(m);
    }
    return out;
  }

  @Override
  public List<Move> checkingMoves(Position position) {
    final Side us = position.sideToMove();
    List<Move> out = new ArrayList<>();
    for (Move m : generator.generate(position)) {
      Optional<Position> next = executor.apply(position, m);
      if (next.isPresent() && !kingCaptures(next.get(), us).isEmpty()) out.add(m);
    }
    return out;
  }

  @Override
  public boolean isCheckmate(Position position) {
    final Side us = position.sideToMove();
    Optional<Square> king = position.kingSquare(us);
    if (king.isEmpty()) return false;

    Set<Square> escapes = new HashSet<>(generator.destinations(position, king.get(), false));
    // squares the opponent merely defends are as unsafe as the ones it can capture on
    Set<Square> covered = generator.reachableSquares(position, us.opponent(), true);
    escapes.removeAll(covered);
    return escapes.isEmpty();
  }
}
