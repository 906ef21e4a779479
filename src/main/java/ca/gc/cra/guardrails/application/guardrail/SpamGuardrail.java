package ca.gc.cra.guardrails.application.guardrail;

import ca.gc.cra.guardrails.application.port.CachePort;
import ca.gc.cra.guardrails.application.port.ClockPort;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailCategory;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailConfig;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailContext;
import ca.gc.cra.guardrails.domain.guardrail.GuardrailResult;
import ca.gc.cra.guardrails.domain.guardrail.Severity;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Blocks short, visually repetitive, or repeatedly submitted queries.
 * <p><strong>Why:</strong> Cheap first line of defence against abuse before retrieval and generation run.</p>
 * <p><strong>Algorithm:</strong> Repeats are counted per session and per normalized query. The primary store is
 * an integer counter in the shared {@link CachePort} under {@code spam:<session>:<hash>} with a TTL equal to the
 * time window. When the cache is missing or failing, an in-process map of recent queries per session is used
 * instead.</p>
 * <p><strong>Resources:</strong> The fallback map is pruned on a fixed-rate schedule and capped by session count.
 * {@link #close()} cancels the schedule and clears the map.</p>
 * <p><strong>Thread-safety:</strong> Per-session updates run inside {@link ConcurrentMap#compute}, so checks and
 * cleanup never observe a half-updated history.</p>
 *
 * <p>Persona keys: {@code maxRepeats} (3), {@code timeWindowMs} (60000), {@code minLength} (10),
 * {@code spamMessage}.</p>
 *
 * @since 0.1.0
 */
public final class SpamGuardrail extends AbstractGuardrail implements AutoCloseable {
  public static final String NAME = "spam";

  private static final Logger log = LoggerFactory.getLogger(SpamGuardrail.class);

  static final int DEFAULT_MAX_REPEATS = 3;
  static final long DEFAULT_TIME_WINDOW_MS = 60_000L;
  static final int DEFAULT_MIN_LENGTH = 10;
  private static final int MIN_WORDS = 3;
  private static final int MAX_ENTRIES_PER_SESSION = 100;
  private static final String ANONYMOUS_SESSION = "anonymous";

  private static final Pattern REPEATED_CHARACTER = Pattern.compile("(.)\\1{4,}");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private static final String REPEATED_MESSAGE =
      "You've asked this question multiple times. Please wait a moment before trying again.";

  private final CachePort cache;
  private final ClockPort clock;
  private final ScheduledExecutorService scheduler;
  private final Settings settings;
  private final ConcurrentMap<String, SessionHistory> recentQueries = new ConcurrentHashMap<>();
  private final AtomicBoolean evictionPending = new AtomicBoolean();
  private volatile ScheduledFuture<?> cleanupTask;

  /**
   * Creates the guardrail and schedules fallback-map cleanup.
   *
   * @param cache shared cache; {@link CachePort#UNAVAILABLE} to always use the in-process store
   * @param clock time source for the fallback store
   * @param scheduler scheduler that runs cleanup; owned by the caller
   * @param settings cleanup and capacity settings
   */
  public SpamGuardrail(CachePort cache, ClockPort clock, ScheduledExecutorService scheduler, Settings settings) {
    super(NAME, GuardrailCategory.SPAM, "Detects repetitive or spam-like queries");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.settings = Objects.requireNonNull(settings, "settings");
    long interval = settings.cleanupInterval().toMillis();
    this.cleanupTask = scheduler.scheduleAtFixedRate(
        this::runCleanup, interval, interval, TimeUnit.MILLISECONDS);
  }

  @Override
  public GuardrailResult check(GuardrailContext context, GuardrailConfig config) {
    String query = context.query().trim();
    int maxRepeats = config.integer("maxRepeats", DEFAULT_MAX_REPEATS);
    long timeWindowMs = config.longValue("timeWindowMs", DEFAULT_TIME_WINDOW_MS);
    int minLength = config.integer("minLength", DEFAULT_MIN_LENGTH);

    if (query.length() < minLength && WHITESPACE.split(query).length < MIN_WORDS) {
      return block(Severity.LOW, config, "spamMessage", "Please provide a more detailed question.");
    }
    if (REPEATED_CHARACTER.matcher(query).find()) {
      return block(Severity.LOW, config, "spamMessage", "Please provide a meaningful question.");
    }

    String normalized = query.toLowerCase(Locale.ROOT);
    String sessionId = context.sessionId() == null || context.sessionId().isBlank()
        ? ANONYMOUS_SESSION
        : context.sessionId();

    boolean repeated;
    if (cache.isAvailable()) {
      try {
        repeated = countInCache(sessionId, normalized, maxRepeats, timeWindowMs);
      } catch (RuntimeException ex) {
        log.warn("Spam guardrail cache failed, using in-memory fallback session={}", sessionId, ex);
        repeated = countInMemory(sessionId, normalized, maxRepeats, timeWindowMs);
      }
    } else {
      repeated = countInMemory(sessionId, normalized, maxRepeats, timeWindowMs);
    }

    if (repeated) {
      return block(Severity.MEDIUM, config, "spamMessage", REPEATED_MESSAGE);
    }
    return allow();
  }

  private boolean countInCache(String sessionId, String normalized, int maxRepeats, long timeWindowMs) {
    String key = "spam:" + sessionId + ":" + hash(normalized);
    int seen = cache.get(key, Integer.class).orElse(0);
    if (seen >= maxRepeats) {
      return true;
    }
    long ttlSeconds = Math.max(1L, (timeWindowMs + 999L) / 1000L);
    cache.put(key, seen + 1, Duration.ofSeconds(ttlSeconds));
    return false;
  }

  private boolean countInMemory(String sessionId, String normalized, int maxRepeats, long timeWindowMs) {
    long now = clock.nowMillis();
    AtomicBoolean repeated = new AtomicBoolean();
    recentQueries.compute(sessionId, (key, existing) -> {
      SessionHistory history = existing == null ? new SessionHistory() : existing;
      history.retainNewerThan(now - timeWindowMs);
      if (history.count(normalized) >= maxRepeats) {
        repeated.set(true);
      } else {
        history.add(normalized, now);
      }
      return history.isEmpty() ? null : history;
    });
    if (recentQueries.size() > settings.maxSessions()) {
      requestEviction();
    }
    return repeated.get();
  }

  /**
   * Drops fallback entries older than the maximum age, then evicts the least recently active sessions when the
   * session count exceeds the cap.
   */
  void cleanupStaleSessions() {
    long cutoff = clock.nowMillis() - settings.maxAge().toMillis();
    for (String sessionId : List.copyOf(recentQueries.keySet())) {
      recentQueries.computeIfPresent(sessionId, (key, history) -> {
        history.retainNewerThan(cutoff);
        return history.isEmpty() ? null : history;
      });
    }

    int size = recentQueries.size();
    if (size > settings.maxSessions()) {
      // Sort a frozen copy; lastActive keeps moving under concurrent checks.
      List<SessionActivity> snapshot = new ArrayList<>(size);
      recentQueries.forEach((sessionId, history) ->
          snapshot.add(new SessionActivity(sessionId, history.lastActive())));
      snapshot.sort(Comparator.comparingLong(SessionActivity::lastActive));
      int toRemove = snapshot.size() - settings.retainSessions();
      AtomicInteger evicted = new AtomicInteger();
      for (int i = 0; i < toRemove; i++) {
        SessionActivity candidate = snapshot.get(i);
        recentQueries.computeIfPresent(candidate.sessionId(), (key, history) -> {
          if (history.lastActive() > candidate.lastActive()) {
            return history;
          }
          evicted.incrementAndGet();
          return null;
        });
      }
      log.warn("Spam guardrail evicted {} stale sessions to bound memory (kept {})",
          evicted.get(), recentQueries.size());
    }
  }

  int fallbackSessionCount() {
    return recentQueries.size();
  }

  private void runCleanup() {
    try {
      cleanupStaleSessions();
    } catch (RuntimeException ex) {
      log.error("Spam guardrail cleanup failed", ex);
    }
  }

  private void requestEviction() {
    if (!evictionPending.compareAndSet(false, true)) {
      return;
    }
    try {
      scheduler.execute(() -> {
        try {
          runCleanup();
        } finally {
          evictionPending.set(false);
        }
      });
    } catch (RejectedExecutionException ex) {
      evictionPending.set(false);
      log.debug("Spam guardrail eviction not scheduled; scheduler is shut down", ex);
    }
  }

  static String hash(String normalized) {
    return Integer.toUnsignedString(normalized.hashCode(), 36);
  }

  /**
   * Cancels the cleanup schedule and clears the fallback store. Idempotent.
   */
  @Override
  public void close() {
    ScheduledFuture<?> task = cleanupTask;
    if (task != null) {
      task.cancel(false);
      cleanupTask = null;
    }
    recentQueries.clear();
  }

  /**
   * Cleanup and capacity settings for the in-process fallback store.
   *
   * @param cleanupInterval period between cleanup runs
   * @param maxAge entries older than this are dropped on cleanup
   * @param maxSessions session count above which eviction runs
   * @param retainSessions number of most recently active sessions kept by eviction
   */
  public record Settings(Duration cleanupInterval, Duration maxAge, int maxSessions, int retainSessions) {
    /** Five-minute cleanup, one-hour age, 10,000 session cap evicting down to 5,000. */
    public static final Settings DEFAULTS =
        new Settings(Duration.ofMinutes(5), Duration.ofHours(1), 10_000, 5_000);

    public Settings {
      Objects.requireNonNull(cleanupInterval, "cleanupInterval");
      Objects.requireNonNull(maxAge, "maxAge");
      if (cleanupInterval.isZero() || cleanupInterval.isNegative()) {
        throw new IllegalArgumentException("cleanupInterval must be positive");
      }
      if (retainSessions <= 0 || retainSessions > maxSessions) {
        throw new IllegalArgumentException("retainSessions must be between 1 and maxSessions");
      }
    }
  }

  private static final class SessionHistory {
    private final Deque<Entry> entries = new ArrayDeque<>();
    private volatile long lastActive;

    void retainNewerThan(long cutoffMillis) {
      entries.removeIf(entry -> entry.timestamp() <= cutoffMillis);
    }

    int count(String normalized) {
      int count = 0;
      for (Entry entry : entries) {
        if (entry.query().equals(normalized)) {
          count++;
        }
      }
      return count;
    }

    void add(String normalized, long timestamp) {
      entries.addLast(new Entry(normalized, timestamp));
      if (entries.size() > MAX_ENTRIES_PER_SESSION) {
        entries.removeFirst();
      }
      lastActive = timestamp;
    }

    boolean isEmpty() {
      return entries.isEmpty();
    }

    long lastActive() {
      return lastActive;
    }
  }

  private record Entry(String query, long timestamp) {}

  private record SessionActivity(String sessionId, long lastActive) {}
}
