package tagwise.cache.core.domain.model;

/**
 * Result of a cache read.
 *
 * @param found whether a valid entry was found
 * @param value the cached value, {@code null} when not found
 */
public record CacheLookup(boolean found, Object value) {

  private static final CacheLookup MISS = new CacheLookup(false, null);

  public static CacheLookup miss() {
    return MISS;
  }

  public static CacheLookup hit(Object value) {
    return new CacheLookup(true, value);
  }
}
