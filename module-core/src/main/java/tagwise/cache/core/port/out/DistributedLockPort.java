package tagwise.cache.core.port.out;

import java.time.Duration;
import tagwise.cache.common.function.ThrowingSupplier;
import tagwise.cache.core.domain.model.LockToken;

/**
 * Port for the per-key mutex living in the shared store.
 *
 * <p>An in-process mutex cannot serialize access across processes, so implementations must keep
 * the lock in the same store as the entries.
 */
public interface DistributedLockPort {

  /**
   * Acquire the exclusive lock of one key.
   *
   * @param key cache key the lock protects
   * @param waitTimeout how long to wait for the lock
   * @return token to hand back to {@link #release(LockToken)}
   * @throws tagwise.cache.error.exception.LockTimeoutException if not granted within the window
   */
  LockToken acquire(String key, Duration waitTimeout);

  /** Release the lock. Calling it again for the same token is a no-op. */
  void release(LockToken token);

  /**
   * Scoped acquisition: run {@code task} under the key's lock and release on every exit path.
   *
   * @throws Throwable whatever the task throws, after the lock was released
   */
  default <T> T executeWithLock(String key, Duration waitTimeout, ThrowingSupplier<T> task)
      throws Throwable {
    LockToken token = acquire(key, waitTimeout);
    try {
      return task.get();
    } finally {
      release(token);
    }
  }
}
