package shogi.impl;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.*;
import shogi.contracts.MoveExecutor;
import shogi.contracts.MoveGenerator;
import shogi.contracts.PositionFactory;
import shogi.model.Move;
import shogi.model.Position;

/**
 * Throughput benchmark that performs exactly the same perft
 * as {@code MoveGeneratorPerftTest}, but under the JMH harness.
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Thread)
public class MoveGeneratorBenchmark {

  /* ── engine wiring ─────────────────────────────────────────── */
  private static final PositionFactory FACT = new PositionFactoryImpl();
  private static final MoveGenerator GEN = new MoveGeneratorImpl();
  private static final MoveExecutor EXEC = new MoveExecutorImpl();

  /* perft cases loaded once per fork --------------------------- */
  private record Case(Position root, int depth) {}
  private List<Case> cases;

  /* simple node counter so JMH can report throughput ----------- */
  @AuxCounters(AuxCounters.Type.EVENTS)
  @State(Scope.Thread)
  public static class Metrics { public long nodes; }

  /* ── load /perft/shogi.txt at trial start ──────────────────── */
  @Setup(Level.Trial)
  public void init() throws Exception {
    cases = new ArrayList<>();

    try (var is = getClass().getResourceAsStream("/perft/shogi.txt");
         var br = new BufferedReader(new InputStreamReader(Objects.requireNonNull(is), StandardCharsets.UTF_8))) {

      br.lines()
              .map(String::trim)
              .filter(l -> !(l.isEmpty() || l.startsWith("#")))
              .forEach(l -> {
                String[] p = l.split(";");
                int depth = Integer.parseInt(p[1].replaceAll("[^0-9]", ""));
                cases.add(new Case(FACT.fromDiagram(diagram(p[0].trim())), depth));
              });
    }
    if (cases.isEmpty())
      throw new IllegalStateException("no perft vectors found");
  }

  private String diagram(String name) {
    try (var is = getClass().getResourceAsStream("/positions/" + name + ".txt")) {
      return new String(Objects.requireNonNull(is, name).readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /* ── benchmark body ------------------------------------------ */
  @Benchmark
  public void perftNodes(Metrics m) {
    long total = 0;
    for (Case c : cases)
      total += perft(c.root, c.depth);
    m.nodes += total;
  }

  /* generation alone, no successor construction */
  @Benchmark
  public int generateStart() {
    return GEN.generate(FACT.startPosition()).size();
  }

  private static long perft(Position p, int depth) {
    if (depth == 0) return 1;
    long nodes = 0;
    for (Move m : GEN.generate(p)) {
      Optional<Position> next = EXEC.apply(p, m);
      if (next.isPresent()) nodes += perft(next.get(), depth - 1);
    }
    return nodes;
  }
}
