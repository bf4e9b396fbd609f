package diffstore.apply;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Mutable {@link CancellationToken} that can be cancelled explicitly or by a deadline.
 *
 * <p>Deadlines are evaluated against the clock each time the token is polled, so no
 * timer thread is involved.
 *
 * <p>This class is thread-safe.
 */
public final class CancellationSource implements CancellationToken {
  private final Clock clock;
  private volatile String reason;
  private volatile Instant deadline;

  public CancellationSource() {
    this(Clock.systemUTC());
  }

  public CancellationSource(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Requests cancellation. Subsequent calls keep the first reason.
   */
  public void cancel() {
    cancel("Scan cancelled");
  }

  /**
   * Requests cancellation with a reason. Subsequent calls keep the first reason.
   *
   * @param reason message of the recorded cancellation
   */
  public synchronized void cancel(String reason) {
    Objects.requireNonNull(reason, "reason");
    if (this.reason == null) {
      this.reason = reason;
    }
  }

  /**
   * Requests cancellation once {@code timeout} has elapsed from now.
   *
   * @param timeout time left before the token reports cancellation; must be &ge; 0
   * @return this source
   */
  public CancellationSource cancelAfter(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be >= 0");
    }
    this.deadline = clock.instant().plus(timeout);
    return this;
  }

  @Override
  public boolean isCancellationRequested() {
    if (reason != null) {
      return true;
    }
    Instant currentDeadline = deadline;
    if (currentDeadline != null && !clock.instant().isBefore(currentDeadline)) {
      cancel("Deadline exceeded at " + currentDeadline);
      return true;
    }
    return false;
  }

  @Override
  public String reason() {
    String current = reason;
    return current != null ? current : CancellationToken.super.reason();
  }
}
