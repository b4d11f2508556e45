package shogi.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shogi.contracts.BranchPool;
import shogi.model.Position;

/**
 * {@link BranchPool} on a work-stealing {@link ForkJoinPool} in FIFO mode, so branch roots start
 * in generation order. Each branch is one task; failures are captured inside the task so the
 * caller sees the exception that the walker threw rather than a copy rebuilt by the pool.
 */
public final class BranchPoolImpl implements BranchPool {

  private static final Logger log = LoggerFactory.getLogger(BranchPoolImpl.class);

  private final Object lifecycleLock = new Object();

  /** {@code null} once closed. */
  private volatile ForkJoinPool workers;

  public BranchPoolImpl(int parallelism) {
    if (parallelism < 1) {
      throw new IllegalArgumentException("Parallelism must be at least 1, got " + parallelism);
    }
    this.workers = newWorkers(parallelism);
  }

  /** One worker per available processor. */
  public BranchPoolImpl() {
    this(Runtime.getRuntime().availableProcessors());
  }

  @Override
  public void walkBranches(List<Position> branchRoots, Consumer<Position> walker, AtomicBoolean stop) {
    Objects.requireNonNull(branchRoots, "branchRoots");
    Objects.requireNonNull(walker, "walker");
    Objects.requireNonNull(stop, "stop");

    ForkJoinPool pool = live();
    AtomicReference<Throwable> failure = new AtomicReference<>();
    AtomicInteger skipped = new AtomicInteger();

    List<ForkJoinTask<?>> tasks = new ArrayList<>(branchRoots.size());
    for (Position root : branchRoots) {
      tasks.add(pool.submit(() -> walkOne(root, walker, stop, failure, skipped)));
    }
    for (ForkJoinTask<?> task : tasks) {
      try {
        task.join();
      } catch (CancellationException e) {
        stop.set(true);
        failure.compareAndSet(null, e);
      }
    }

    if (skipped.get() > 0) log.debug("{} of {} branches skipped after stop", skipped.get(), tasks.size());
    Throwable first = failure.get();
    if (first != null) throw new CompletionException(first);
  }

  private static void walkOne(Position root, Consumer<Position> walker, AtomicBoolean stop,
                              AtomicReference<Throwable> failure, AtomicInteger skipped) {
    if (stop.get()) {
      skipped.incrementAndGet();
      return;
    }
    try {
      walker.accept(root);
    } catch (RuntimeException | Error e) {
      stop.set(true);
      if (failure.compareAndSet(null, e)) {
        log.warn("exploration branch failed, stopping the others", e);
      }
    }
  }

  @Override
  public int parallelism() {
    return live().getParallelism();
  }

  @Override
  public void setParallelism(int threads) {
    if (threads < 1) return;
    synchronized (lifecycleLock) {
      ForkJoinPool current = workers;
      if (current == null || current.getParallelism() == threads) return;
      workers = newWorkers(threads);
      current.shutdown();
    }
  }

  @Override
  public void close() {
    synchronized (lifecycleLock) {
      ForkJoinPool current = workers;
      workers = null;
      if (current != null) current.shutdownNow();
    }
  }

  private ForkJoinPool live() {
    ForkJoinPool p = workers;
    if (p == null) throw new IllegalStateException("Branch pool is closed");
    return p;
  }

  private static ForkJoinPool newWorkers(int parallelism) {
    return new ForkJoinPool(parallelism, ForkJoinPool.defaultForkJoinWorkerThreadFactory, null, true);
  }
}
