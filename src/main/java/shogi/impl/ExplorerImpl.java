package shogi.impl;

import static shogi.constants.CoreConstants.MAX_COLLECTED_POSITIONS;
import static shogi.constants.CoreConstants.STOP_POLL_INTERVAL;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import shogi.contracts.BranchPool;
import shogi.contracts.Explorer;
import shogi.contracts.MoveExecutor;
import shogi.contracts.MoveGenerator;
import shogi.model.Move;
import shogi.model.Position;
import shogi.records.ExplorationResult;
import shogi.records.ExplorationSpec;

/**
 * Depth-bounded enumeration of future positions. Each root successor is a branch on the
 * {@link BranchPool}; a branch walks its subtree with an explicit stack rather than recursion.
 *
 * <p>Counts are exact regardless of scheduling. The order of collected positions is not.
 * One exploration at a time per instance: {@link #stop()} targets the latest one.
 */
public final class ExplorerImpl implements Explorer {

  private static final Logger log = LoggerFactory.getLogger(ExplorerImpl.class);

  private final MoveGenerator generator;
  private final MoveExecutor executor;
  private final BranchPool pool;
  private final boolean ownsPool;

  private volatile AtomicBoolean stopFlag = new AtomicBoolean(false);

  public ExplorerImpl(MoveGenerator generator, MoveExecutor executor, BranchPool pool) {
    this(generator, executor, pool, false);
  }

  /** Default generator and executor on a private pool sized to the machine. */
  public ExplorerImpl() {
    this(new MoveGeneratorImpl(), new MoveExecutorImpl(), new BranchPoolImpl(), true);
  }

  private ExplorerImpl(MoveGenerator generator, MoveExecutor executor, BranchPool pool, boolean ownsPool) {
    this.generator = Objects.requireNonNull(generator, "generator");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.pool = Objects.requireNonNull(pool, "pool");
    this.ownsPool = ownsPool;
  }

  @Override
  public List<Position> successors(Position position) {
    List<Move> moves = generator.generate(position);
    List<Position> out = new ArrayList<>(moves.size());
    for (Move m : moves) executor.apply(position, m).ifPresent(out::add);
    return out;
  }

  @Override
  public CompletableFuture<ExplorationResult> explore(Position root, ExplorationSpec spec) {
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(spec, "spec");
    AtomicBoolean stop = new AtomicBoolean(false);
    stopFlag = stop;
    return CompletableFuture.supplyAsync(() -> new Run(spec, stop).execute(root));
  }

  @Override
  public void stop() {
    stopFlag.set(true);
  }

  @Override
  public void close() {
    stop();
    if (ownsPool) pool.close();
  }

  /* ────── one exploration ────── */

  private record Node(Position position, int ply) {}

  private final class Run {
    private final ExplorationSpec spec;
    private final AtomicBoolean stop;
    private final AtomicLongArray perPly;
    private final AtomicLong nodes = new AtomicLong();
    private final AtomicBoolean truncated = new AtomicBoolean(false);
    private final Queue<Position> collected = new ConcurrentLinkedQueue<>();
    private final AtomicInteger collectedCount = new AtomicInteger();

    Run(ExplorationSpec spec, AtomicBoolean stop) {
      this.spec = spec;
      this.stop = stop;
      this.perPly = new AtomicLongArray(spec.depth());
    }

    ExplorationResult execute(Position root) {
      final long start = System.currentTimeMillis();
      List<Position> children = successors(root);
      log.debug("exploring {} root branches to depth {}", children.size(), spec.depth());

      pool.walkBranches(children, this::walk, stop);

      List<Long> counts = new ArrayList<>(spec.depth());
      for (int i = 0; i < spec.depth(); i++) counts.add(perPly.get(i));
      long elapsed = System.currentTimeMillis() - start;
      boolean cut = truncated.get() || stop.get();
      log.debug("explored {} nodes in {} ms{}", counts, elapsed, cut ? " (truncated)" : "");
      return new ExplorationResult(counts, new ArrayList<>(collected), cut, elapsed);
    }

    private void walk(Position branchRoot) {
      Deque<Node> stack = new ArrayDeque<>();
      stack.push(new Node(branchRoot, 1));
      long visited = 0;

      while (!stack.isEmpty()) {
        if (++visited % STOP_POLL_INTERVAL == 0 && stop.get()) return;
        if (!admit()) return;

        Node node = stack.pop();
        perPly.incrementAndGet(node.ply() - 1);
        if (spec.collectPositions()) collect(node.position());

        if (node.ply() < spec.depth()) {
          for (Position next : successors(node.position())) stack.push(new Node(next, node.ply() + 1));
        }
      }
    }

    /* takes one node from the budget; false once it is spent */
    private boolean admit() {
      if (truncated.get()) return false;
      long n = nodes.incrementAndGet();
      if (!spec.unlimitedNodes() && n > spec.maxNodes()) {
        truncated.set(true);
        return false;
      }
      return true;
    }

    private void collect(Position p) {
      int k = collectedCount.incrementAndGet();
      if (k <= MAX_COLLECTED_POSITIONS) {
        collected.add(p);
      } else if (k == MAX_COLLECTED_POSITIONS + 1) {
        log.debug("position cap {} reached, counting only", MAX_COLLECTED_POSITIONS);
      }
    }
  }
}
