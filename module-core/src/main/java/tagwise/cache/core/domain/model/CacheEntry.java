package tagwise.cache.core.domain.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One cached value, its expiration policy, last access time and declared dependency tags.
 *
 * <p>The tag set is stored on the entry itself so that invalidating a single key can clean up its
 * tag memberships without scanning every tag record.
 *
 * <p>Times are kept at millisecond precision, matching what the store persists.
 */
public record CacheEntry(
    String key,
    String payload,
    ExpirationPolicy expiration,
    Instant lastAccess,
    Set<String> dependentTags) {

  public CacheEntry {
    Objects.requireNonNull(key, "key cannot be null");
    Objects.requireNonNull(expiration, "expiration cannot be null");
    Objects.requireNonNull(lastAccess, "lastAccess cannot be null");
    dependentTags = dependentTags == null ? Set.of() : Set.copyOf(dependentTags);
  }

  /** New entry at put time; {@code lastAccess} starts at {@code now}. */
  public static CacheEntry create(
      String key,
      String payload,
      Collection<String> dependentTags,
      ExpirationPolicy expiration,
      Instant now) {
    return new CacheEntry(
        key, payload, expiration, now.truncatedTo(ChronoUnit.MILLIS), distinct(dependentTags));
  }

  /** Rebuild an entry from the fields read back from the store. */
  public static CacheEntry restore(
      String key,
      String payload,
      ExpirationPolicy expiration,
      Instant lastAccess,
      Set<String> dependentTags) {
    return new CacheEntry(key, payload, expiration, lastAccess, dependentTags);
  }

  public ExpirationVerdict evaluate(Instant now) {
    return expiration.evaluate(lastAccess, now);
  }

  /** Copy with only {@code lastAccess} moved to {@code now}. */
  public CacheEntry touch(Instant now) {
    return new CacheEntry(
        key, payload, expiration, now.truncatedTo(ChronoUnit.MILLIS), dependentTags);
  }

  private static Set<String> distinct(Collection<String> tags) {
    Set<String> result = new LinkedHashSet<>();
    if (tags != null) {
      for (String tag : tags) {
        if (tag != null) {
          result.add(tag);
        }
      }
    }
    return result;
  }
}
