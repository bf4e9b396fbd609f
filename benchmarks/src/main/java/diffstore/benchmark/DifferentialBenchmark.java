package diffstore.benchmark;

import diffstore.DiffDatabase;
import diffstore.Differential;
import diffstore.benchmark.BenchmarkDataSourceFactory.DatabaseSetup;
import diffstore.jdbc.DataSourceConnectionProvider;
import org.openjdk.jmh.annotations.*;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Measures {@link Differential#add} throughput (ops/sec) for values that changed and for
 * values that did not, and the cost of draining staged changes.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar DifferentialBenchmark}
 * <p>MySQL: {@code java -jar benchmarks/target/benchmarks.jar -p database=mysql DifferentialBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class DifferentialBenchmark {

  record Item(String id, String body, long version) {}

  private static final int KEY_SPACE = 10_000;

  @Param({"h2"})
  private String database;

  @Param({"100", "1000"})
  private int payloadSize;

  private DataSource dataSource;
  private DiffDatabase db;
  private Differential differential;
  private String body;
  private long version;
  private int next;

  @Setup(Level.Trial)
  public void setup() {
    DatabaseSetup setup = BenchmarkDataSourceFactory.create(database, "bench_diff");
    dataSource = setup.dataSource();
    db = DiffDatabase.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .regionStore(setup.store())
        .build();
    BenchmarkDataSourceFactory.truncate(dataSource);
    differential = db.open("bench");
    body = "x".repeat(payloadSize);

    // Commit a baseline so addUnchanged hits the committed fingerprint
    for (int i = 0; i < KEY_SPACE; i++) {
      differential.add(key(i), new Item(Integer.toString(i), body, 0L));
    }
    differential.each((id, decoder) -> { });
  }

  @Benchmark
  public boolean addChanged() {
    int i = next++ % KEY_SPACE;
    return differential.add(key(i), new Item(Integer.toString(i), body, ++version));
  }

  @Benchmark
  public boolean addUnchanged() {
    int i = next++ % KEY_SPACE;
    return differential.add(key(i), new Item(Integer.toString(i), body, 0L));
  }

  @TearDown(Level.Trial)
  public void tearDown() throws Exception {
    db.close();
    if (dataSource instanceof AutoCloseable ac) ac.close();
  }

  private static byte[] key(int i) {
    return String.format("item-%05d", i).getBytes(StandardCharsets.UTF_8);
  }
}
