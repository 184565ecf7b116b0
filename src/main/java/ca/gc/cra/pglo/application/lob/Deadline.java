package ca.gc.cra.pglo.application.lob;

import ca.gc.cra.pglo.application.port.ClockPort;
import ca.gc.cra.pglo.domain.error.ScopeTimeoutException;
import java.time.Duration;
import java.util.Objects;

/**
 * Absolute point in time after which a scope must not issue further backend calls.
 *
 * <p>Immutable and thread-safe.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class Deadline {
  private static final Deadline NONE = new Deadline(ClockPort.SYSTEM, Long.MAX_VALUE);

  private final ClockPort clock;
  private final long expiresAtMillis;

  private Deadline(ClockPort clock, long expiresAtMillis) {
    this.clock = clock;
    this.expiresAtMillis = expiresAtMillis;
  }

  /**
   * Deadline that never expires.
   *
   * @return unbounded deadline
   */
  public static Deadline none() {
    return NONE;
  }

  /**
   * Deadline {@code timeout} from now.
   *
   * @param timeout time budget; {@code null} yields {@link #none()}
   * @param clock time source
   * @return deadline
   * @throws IllegalArgumentException if {@code timeout} is negative
   */
  public static Deadline after(Duration timeout, ClockPort clock) {
    Objects.requireNonNull(clock, "clock");
    if (timeout == null) {
      return NONE;
    }
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must not be negative");
    }
    long now = clock.nowMillis();
    long budget = timeout.toMillis();
    long expires = budget > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + budget;
    return new Deadline(clock, expires);
  }

  /**
   * Indicates whether this deadline is bounded.
   *
   * @return {@code false} for {@link #none()}
   */
  public boolean bounded() {
    return expiresAtMillis != Long.MAX_VALUE;
  }

  /**
   * Milliseconds left before expiry, never negative.
   *
   * @return remaining budget; {@link Long#MAX_VALUE} when unbounded
   */
  public long remainingMillis() {
    if (!bounded()) {
      return Long.MAX_VALUE;
    }
    return Math.max(0L, expiresAtMillis - clock.nowMillis());
  }

  /**
   * Fails when the deadline has passed.
   *
   * @param operation primitive about to run, for diagnostics
   * @throws ScopeTimeoutException if no time is left
   */
  public void check(String operation) throws ScopeTimeoutException {
    if (bounded() && remainingMillis() == 0L) {
      throw new ScopeTimeoutException("scope deadline exceeded before " + operation, null, null);
    }
  }
}
