package ca.gc.cra.guardrails.support;

import ca.gc.cra.guardrails.application.port.ClockPort;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Test clock advanced by hand.
 */
public final class MutableClock implements ClockPort {
  private final AtomicLong now;

  public MutableClock(long startMillis) {
    this.now = new AtomicLong(startMillis);
  }

  public MutableClock() {
    this(1_700_000_000_000L);
  }

  @Override
  public long nowMillis() {
    return now.get();
  }

  public void advance(long millis) {
    now.addAndGet(millis);
  }
}
