package diffstore.benchmark;

import diffstore.fingerprint.Fingerprint;
import diffstore.fingerprint.Fingerprinter;
import org.openjdk.jmh.annotations.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Measures {@link Fingerprinter#fingerprint} throughput on records of growing width.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar FingerprintBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class FingerprintBenchmark {

  record Customer(long id, String name, String email, BigDecimal balance, Instant updatedAt,
      List<String> tags, Map<String, String> attributes) {}

  @Param({"0", "10", "100"})
  private int attributeCount;

  private Fingerprinter fingerprinter;
  private Customer customer;

  @Setup(Level.Trial)
  public void setup() {
    fingerprinter = Fingerprinter.getDefault();
    Map<String, String> attributes = new LinkedHashMap<>();
    List<String> tags = new ArrayList<>();
    for (int i = 0; i < attributeCount; i++) {
      attributes.put("attr-" + i, "value-" + i);
      tags.add("tag-" + i);
    }
    customer = new Customer(42L, "Ada Lovelace", "ada@example.com", new BigDecimal("1234.50"),
        Instant.parse("2024-05-01T10:15:30Z"), tags, attributes);
  }

  @Benchmark
  public Fingerprint fingerprintRecord() {
    return fingerprinter.fingerprint(customer);
  }
}
