package tagwise.cache.core.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for one held per-key lock.
 *
 * <p>Scoped to exactly one key and one owning thread for the duration of one critical section.
 * {@link #markReleased()} flips only once, which makes release idempotent.
 */
public final class LockToken {

  private final String key;
  private final String lockName;
  private final long ownerThreadId;
  private final Instant acquiredAt;
  private final AtomicBoolean released = new AtomicBoolean(false);

  public LockToken(String key, String lockName, long ownerThreadId, Instant acquiredAt) {
    this.key = Objects.requireNonNull(key, "key");
    this.lockName = Objects.requireNonNull(lockName, "lockName");
    this.ownerThreadId = ownerThreadId;
    this.acquiredAt = Objects.requireNonNull(acquiredAt, "acquiredAt");
  }

  public String key() {
    return key;
  }

  public String lockName() {
    return lockName;
  }

  public long ownerThreadId() {
    return ownerThreadId;
  }

  public Instant acquiredAt() {
    return acquiredAt;
  }

  public boolean isReleased() {
    return released.get();
  }

  /**
   * @return {@code true} only for the first caller
   */
  public boolean markReleased() {
    return released.compareAndSet(false, true);
  }

  @Override
  public String toString() {
    return "LockToken[" + lockName + ", thread=" + ownerThreadId + "]";
  }
}
