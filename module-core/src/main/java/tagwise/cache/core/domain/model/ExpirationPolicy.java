package tagwise.cache.core.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Absolute + sliding expiration rules of one cache entry.
 *
 * <p>Pure domain model - no external dependencies.
 *
 * <ul>
 *   <li>{@code absoluteExpiration == null}: never expires absolutely
 *   <li>{@code slidingExpiration == null}: no idle timeout
 * </ul>
 *
 * <p>Values beyond what the store can represent in epoch milliseconds are normalized: an absolute
 * expiration past {@link #MAX_REPRESENTABLE} becomes "never", a sliding window of
 * {@link #MAX_REPRESENTABLE_SLIDING} or more becomes "none", an absolute expiration before the
 * epoch is clamped to the epoch (already expired either way).
 *
 * <p>Comparisons run at millisecond precision, the precision the store persists: the absolute
 * expiration is truncated on construction and {@code now} is truncated on every evaluation.
 *
 * @param absoluteExpiration hard ceiling, inclusive
 * @param slidingExpiration idle window measured from the stored last access
 */
public record ExpirationPolicy(Instant absoluteExpiration, Duration slidingExpiration) {

  static final Instant MAX_REPRESENTABLE = Instant.ofEpochMilli(Long.MAX_VALUE);
  static final Duration MAX_REPRESENTABLE_SLIDING = Duration.ofMillis(Long.MAX_VALUE);
  static final Duration MIN_REPRESENTABLE_SLIDING = Duration.ofMillis(Long.MIN_VALUE);

  private static final ExpirationPolicy NEVER = new ExpirationPolicy(null, null);

  public ExpirationPolicy {
    if (absoluteExpiration != null) {
      if (absoluteExpiration.isAfter(MAX_REPRESENTABLE)) {
        absoluteExpiration = null;
      } else if (absoluteExpiration.isBefore(Instant.EPOCH)) {
        absoluteExpiration = Instant.EPOCH;
      } else {
        absoluteExpiration = absoluteExpiration.truncatedTo(ChronoUnit.MILLIS);
      }
    }
    if (slidingExpiration != null) {
      if (slidingExpiration.compareTo(MAX_REPRESENTABLE_SLIDING) >= 0) {
        slidingExpiration = null;
      } else if (slidingExpiration.compareTo(MIN_REPRESENTABLE_SLIDING) < 0) {
        slidingExpiration = MIN_REPRESENTABLE_SLIDING;
      }
    }
  }

  public static ExpirationPolicy never() {
    return NEVER;
  }

  public static ExpirationPolicy of(Duration slidingExpiration, Instant absoluteExpiration) {
    return new ExpirationPolicy(absoluteExpiration, slidingExpiration);
  }

  public boolean hasAbsoluteExpiration() {
    return absoluteExpiration != null;
  }

  public boolean hasSlidingExpiration() {
    return slidingExpiration != null;
  }

  /**
   * Evaluates absolute expiration first, then sliding expiration against {@code lastAccess}.
   *
   * @param lastAccess last access time as persisted in the shared store
   * @param now current time
   */
  public ExpirationVerdict evaluate(Instant lastAccess, Instant now) {
    if (isAbsolutelyExpired(now)) {
      return ExpirationVerdict.ABSOLUTE_EXPIRED;
    }
    if (slidingExpiration != null
        && Duration.between(lastAccess, toMillis(now)).compareTo(slidingExpiration) > 0) {
      return ExpirationVerdict.SLIDING_EXPIRED;
    }
    return ExpirationVerdict.VALID;
  }

  /** Absolute expiration only; used by purge, which ignores idle time. */
  public boolean isAbsolutelyExpired(Instant now) {
    return absoluteExpiration != null && !toMillis(now).isBefore(absoluteExpiration);
  }

  private static Instant toMillis(Instant instant) {
    return instant.truncatedTo(ChronoUnit.MILLIS);
  }
}
