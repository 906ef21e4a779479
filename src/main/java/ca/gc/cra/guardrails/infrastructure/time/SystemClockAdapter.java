package ca.gc.cra.guardrails.infrastructure.time;

import ca.gc.cra.guardrails.application.port.ClockPort;

/**
 * {@link ClockPort} backed by {@link System#currentTimeMillis()}; the engine's default clock.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  public SystemClockAdapter() {}

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
