package tagwise.cache.core.failure;

import tagwise.cache.error.exception.CachingFailedException;

/**
 * Receives failures the cache absorbed instead of throwing.
 *
 * <p>Invoked synchronously on the thread of the failing call, once per absorbed failure.
 */
@FunctionalInterface
public interface CachingFailureListener {

  void onCachingFailed(CachingFailedException failure);
}
