package shogi.contracts;

import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import shogi.model.Position;

/**
 * Worker pool that walks the branches of an exploration tree in parallel.
 *
 * <p>One call to {@link #walkBranches} is one exploration: every branch root is handed to the
 * walker on some worker, and the call returns when all branches are finished or skipped. The
 * shared stop flag is how the caller and the pool cancel each other.
 */
public interface BranchPool extends AutoCloseable {

  /**
   * Runs {@code walker} once per branch root and blocks until every branch is done.
   *
   * <p>Branches not yet started when {@code stop} is raised are skipped. The first branch that
   * throws raises {@code stop} for the others, and its exception (the original instance) is
   * rethrown as the cause of a {@link CompletionException} once the remaining branches have
   * returned.
   */
  void walkBranches(List<Position> branchRoots, Consumer<Position> walker, AtomicBoolean stop);

  /** Number of branches that can be walked at once. */
  int parallelism();

  /** Changes the worker count for later explorations; values below one are ignored. */
  void setParallelism(int threads);

  /** Stops the workers; running branches are interrupted and later calls fail. */
  @Override
  void close();
}
