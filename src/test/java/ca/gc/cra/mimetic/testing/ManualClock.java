package ca.gc.cra.mimetic.testing;

import ca.gc.cra.mimetic.application.port.ClockPort;
import java.util.concurrent.atomic.AtomicLong;

/** Clock that only moves when a test tells it to. */
public final class ManualClock implements ClockPort {
  private final AtomicLong now;

  public ManualClock(long startMillis) {
    this.now = new AtomicLong(startMillis);
  }

  @Override
  public long nowMillis() {
    return now.get();
  }

  public void set(long millis) {
    now.set(millis);
  }

  public long advance(long millis) {
    return now.addAndGet(millis);
  }
}
