package ca.gc.cra.pglo.testutil;

import ca.gc.cra.pglo.application.port.ClockPort;
import java.util.concurrent.atomic.AtomicLong;

/** Clock advanced by hand. */
public final class ManualClock implements ClockPort {
  private final AtomicLong now;

  public ManualClock(long startMillis) {
    this.now = new AtomicLong(startMillis);
  }

  @Override
  public long nowMillis() {
    return now.get();
  }

  public void advance(long millis) {
    now.addAndGet(millis);
  }
}
