package diffstore.apply;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class CancellationSourceTest {

  /** Clock that only moves when told to. */
  private static final class MutableClock extends Clock {
    private Instant now = Instant.parse("2024-01-01T00:00:00Z");

    void advance(Duration d) {
      now = now.plus(d);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }

  @Test
  void noneIsNeverCancelled() {
    assertFalse(CancellationToken.NONE.isCancellationRequested());
  }

  @Test
  void freshSourceIsNotCancelled() {
    assertFalse(new CancellationSource().isCancellationRequested());
  }

  @Test
  void cancelIsObserved() {
    CancellationSource source = new CancellationSource();
    source.cancel();
    assertTrue(source.isCancellationRequested());
    assertEquals("Scan cancelled", source.reason());
  }

  @Test
  void firstReasonWins() {
    CancellationSource source = new CancellationSource();
    source.cancel("shutdown");
    source.cancel("later");
    assertEquals("shutdown", source.reason());
  }

  @Test
  void deadlineCancelsOncePassed() {
    MutableClock clock = new MutableClock();
    CancellationSource source = new CancellationSource(clock).cancelAfter(Duration.ofSeconds(5));

    clock.advance(Duration.ofSeconds(4));
    assertFalse(source.isCancellationRequested());

    clock.advance(Duration.ofSeconds(1));
    assertTrue(source.isCancellationRequested());
    assertTrue(source.reason().startsWith("Deadline exceeded"));
  }

  @Test
  void zeroTimeoutCancelsImmediately() {
    CancellationSource source = new CancellationSource(new MutableClock()).cancelAfter(Duration.ZERO);
    assertTrue(source.isCancellationRequested());
  }

  @Test
  void negativeTimeoutIsRejected() {
    CancellationSource source = new CancellationSource();
    assertThrows(IllegalArgumentException.class, () -> source.cancelAfter(Duration.ofMillis(-1)));
  }
}
