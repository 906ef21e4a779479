package ca.gc.cra.guardrails.application.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.guardrails.support.MutableClock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class CircuitBreakerTest {
  private final MutableClock clock = new MutableClock();
  private final CircuitBreaker breaker =
      new CircuitBreaker("test", new CircuitBreaker.Settings(3, 2, Duration.ofSeconds(10)), clock);

  @Test
  void opensAfterFailureThreshold() {
    fail(2);
    assertEquals(CircuitState.CLOSED, breaker.state());
    assertEquals(2, breaker.failureCount());

    fail(1);
    assertEquals(CircuitState.OPEN, breaker.state());
  }

  @Test
  void openCircuitRejectsWithoutRunningCall() {
    fail(3);
    AtomicInteger calls = new AtomicInteger();
    clock.advance(4_000L);

    CircuitBreakerOpenException ex = assertThrows(CircuitBreakerOpenException.class,
        () -> breaker.execute(calls::incrementAndGet));

    assertEquals(0, calls.get());
    assertEquals("test", ex.breakerName());
    assertEquals(6_000L, ex.retryAfterMillis());
  }

  @Test
  void halfOpenClosesAfterSuccessThreshold() {
    fail(3);
    clock.advance(10_000L);

    assertEquals("ok", breaker.execute(() -> "ok"));
    assertEquals(CircuitState.HALF_OPEN, breaker.state());
    breaker.execute(() -> "ok");
    assertEquals(CircuitState.CLOSED, breaker.state());
    assertEquals(0, breaker.failureCount());
  }

  @Test
  void failureWhileHalfOpenReopens() {
    fail(3);
    clock.advance(10_000L);
    breaker.execute(() -> "ok");

    fail(1);

    assertEquals(CircuitState.OPEN, breaker.state());
    assertThrows(CircuitBreakerOpenException.class, () -> breaker.execute(() -> "ok"));
  }

  @Test
  void successWhileClosedResetsFailureCount() {
    fail(2);
    breaker.execute(() -> "ok");
    fail(2);

    assertEquals(CircuitState.CLOSED, breaker.state());
    assertEquals(2, breaker.failureCount());
  }

  @Test
  void callExceptionsPropagateUnchanged() {
    IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> breaker.execute(() -> {
      throw new IllegalStateException("boom");
    }));
    assertEquals("boom", thrown.getMessage());
    assertEquals(1, breaker.failureCount());
  }

  @Test
  void resetForcesClosed() {
    fail(3);
    breaker.reset();

    assertEquals(CircuitState.CLOSED, breaker.state());
    assertEquals("ok", breaker.execute(() -> "ok"));
  }

  @Test
  void settingsRejectInvalidThresholds() {
    assertThrows(IllegalArgumentException.class, () -> new CircuitBreaker.Settings(0, 1, Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> new CircuitBreaker.Settings(1, 0, Duration.ZERO));
    assertThrows(IllegalArgumentException.class,
        () -> new CircuitBreaker.Settings(1, 1, Duration.ofSeconds(-1)));
  }

  private void fail(int times) {
    for (int i = 0; i < times; i++) {
      assertThrows(IllegalStateException.class, () -> breaker.execute(() -> {
        throw new IllegalStateException("failure");
      }));
    }
  }
}
