package tagwise.cache.core.index;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import tagwise.cache.core.port.out.CacheEntryStore;

/**
 * Inverse index: tag → keys of the entries that declared it at write time.
 *
 * <p>Each tag record occupies its own slot in the store. Membership changes are single atomic set
 * operations, so concurrent writers on different keys never overwrite each other's memberships
 * and removing an absent member is a no-op.
 */
public class TagIndex {

  private final CacheEntryStore store;

  public TagIndex(CacheEntryStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  public void register(String key, Collection<String> tags) {
    for (String tag : tags) {
      store.addTagMember(tag, key);
    }
  }

  public void unregister(String key, Collection<String> tags) {
    for (String tag : tags) {
      store.removeTagMember(tag, key);
    }
  }

  /** Drop memberships the previous version of an entry held and the new one no longer declares. */
  public void retainOnly(String key, Collection<String> previousTags, Set<String> currentTags) {
    for (String tag : previousTags) {
      if (!currentTags.contains(tag)) {
        store.removeTagMember(tag, key);
      }
    }
  }

  public Set<String> members(String tag) {
    return store.tagMembers(tag);
  }

  public Set<String> tags() {
    return store.tagNames();
  }

  /**
   * Remove {@code key} from the tag record if its entry no longer exists. The caller must hold the
   * key's lock, otherwise a put that registered the tag but has not saved the entry yet loses its
   * membership. Records emptied this way disappear with their last member.
   *
   * @return true if the membership was dangling and has been removed
   */
  public boolean pruneIfDangling(String tag, String key) {
    if (store.entryExists(key)) {
      return false;
    }
    store.removeTagMember(tag, key);
    return true;
  }
}
