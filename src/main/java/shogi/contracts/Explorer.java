package shogi.contracts;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import shogi.model.Position;
import shogi.records.ExplorationResult;
import shogi.records.ExplorationSpec;

/** Enumerates future positions reachable from a root. */
public interface Explorer extends AutoCloseable {

  /** Every position one generated move away from {@code position}. */
  List<Position> successors(Position position);

  /** Starts a depth-bounded exploration of {@code root}. */
  CompletableFuture<ExplorationResult> explore(Position root, ExplorationSpec spec);

  /** Asks the running exploration to finish early; its result is marked truncated. */
  void stop();

  @Override
  void close();
}
