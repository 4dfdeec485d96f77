package tagwise.cache.application.port;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import tagwise.cache.core.domain.model.CacheLookup;
import tagwise.cache.core.failure.CachingFailureListener;
import tagwise.cache.core.failure.Subscription;

/**
 * Write-through cache with dependency-tag invalidation.
 *
 * <p>Store, connectivity and lock failures never escape these methods: they are published to the
 * listeners registered with {@link #onCachingFailed} and the call returns its benign result
 * (not-found, zero, no-op). Invalid arguments are the only exception and always throw {@code
 * InvalidCacheArgumentException} before the store is touched.
 */
public interface TaggedCache {

  /**
   * Cache {@code value} under {@code key}.
   *
   * @param key non-empty cache key
   * @param value value to cache
   * @param dependentTags tags whose invalidation removes this entry, must not be null
   * @param slidingExpiration idle window, {@code null} for none
   * @param absoluteExpiration hard expiry, {@code null} for never
   */
  void putItem(
      String key,
      Object value,
      Collection<String> dependentTags,
      Duration slidingExpiration,
      Instant absoluteExpiration);

  /** Read a value; a hit refreshes the entry's last access time. */
  CacheLookup getItem(String key);

  /** Typed variant of {@link #getItem(String)}; a value of another type is treated as a miss. */
  <T> Optional<T> getItem(String key, Class<T> type);

  void invalidateItem(String key);

  /** Remove every entry that declared any of {@code tags}, then the tag records themselves. */
  void invalidateSets(Collection<String> tags);

  /** Remove absolutely-expired entries and tag records left empty. */
  void purge();

  /** Live entries plus live tag records; diagnostic only. */
  long count();

  /** Remove everything in the namespace. Requires admin rights on the connection. */
  void clear();

  Duration getLockWaitTimeout();

  void setLockWaitTimeout(Duration lockWaitTimeout);

  Subscription onCachingFailed(CachingFailureListener listener);
}
