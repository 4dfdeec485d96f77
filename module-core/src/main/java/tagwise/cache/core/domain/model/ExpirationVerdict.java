package tagwise.cache.core.domain.model;

/** Outcome of evaluating a {@link CacheEntry} against the current time. */
public enum ExpirationVerdict {

  /** Entry is readable. */
  VALID,

  /** {@code now >= absoluteExpiration}; checked first, independent of access pattern. */
  ABSOLUTE_EXPIRED,

  /** Entry sat idle longer than its sliding window. */
  SLIDING_EXPIRED;

  public boolean isExpired() {
    return this != VALID;
  }
}
