package tagwise.cache.core.port.out;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import tagwise.cache.core.domain.model.CacheEntry;

/**
 * Port for the shared backing store holding cache entries and tag records.
 *
 * <p>Implemented by module-infra adapters (Redisson). All relations live in the store, never in
 * process-local collections, so that every invariant holds across processes sharing one store.
 *
 * <p>Implementations translate client failures into {@code CacheConnectivityException} (store
 * unreachable, transport timeout) or {@code CacheStoreException} (anything else).
 */
public interface CacheEntryStore {

  /**
   * Load an entry.
   *
   * @param key cache key
   * @return the stored entry, or empty if absent
   */
  Optional<CacheEntry> findEntry(String key);

  /** Write (or overwrite) an entry with every field. */
  void saveEntry(CacheEntry entry);

  /** Persist only the last access time of an existing entry. */
  void touchEntry(String key, Instant lastAccess);

  /**
   * Delete an entry.
   *
   * @return true if an entry was removed
   */
  boolean deleteEntry(String key);

  boolean entryExists(String key);

  /** Atomically add {@code key} to the tag record, creating the record if absent. */
  void addTagMember(String tag, String key);

  /** Atomically remove {@code key} from the tag record; an emptied record disappears. */
  void removeTagMember(String tag, String key);

  Set<String> tagMembers(String tag);

  /** Keys of every entry in the namespace. */
  Set<String> entryKeys();

  /** Names of every tag record in the namespace. */
  Set<String> tagNames();

  /** Number of entries plus number of tag records in the namespace. */
  long countRecords();

  /**
   * Remove every entry and tag record in the namespace.
   *
   * <p>Privileged: adapters may refuse with {@code CacheStoreException} when the connection was
   * not opened with admin rights.
   */
  void clearNamespace();
}
