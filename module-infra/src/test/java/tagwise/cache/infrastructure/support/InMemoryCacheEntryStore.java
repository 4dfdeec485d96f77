package tagwise.cache.infrastructure.support;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import tagwise.cache.core.domain.model.CacheEntry;
import tagwise.cache.core.port.out.CacheEntryStore;
import tagwise.cache.error.exception.CacheStoreException;

/**
 * 단위 테스트용 {@link CacheEntryStore}
 *
 * <p>{@link #failWith(RuntimeException)}로 저장소 장애를 흉내 낼 수 있으며, 장애 중에는 모든 메서드가 같은 예외를 던집니다.
 */
public class InMemoryCacheEntryStore implements CacheEntryStore {

  private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
  private final Map<String, Set<String>> tags = new ConcurrentHashMap<>();
  private final AtomicReference<RuntimeException> failure = new AtomicReference<>();
  private final AtomicInteger accessCount = new AtomicInteger();
  private final AtomicReference<Runnable> afterTagMemberAdded = new AtomicReference<>();
  private final boolean adminAllowed;

  public InMemoryCacheEntryStore() {
    this(true);
  }

  public InMemoryCacheEntryStore(boolean adminAllowed) {
    this.adminAllowed = adminAllowed;
  }

  public void failWith(RuntimeException exception) {
    failure.set(exception);
  }

  public void recover() {
    failure.set(null);
  }

  /** 다음 addTagMember 직후 한 번만 실행할 작업 (호출 스레드에서 실행) */
  public void afterNextTagMemberAdded(Runnable action) {
    afterTagMemberAdded.set(action);
  }

  /** 지금까지 호출된 저장소 메서드 수 */
  public int accessCount() {
    return accessCount.get();
  }

  public Optional<CacheEntry> peek(String key) {
    return Optional.ofNullable(entries.get(key));
  }

  public Set<String> peekTag(String tag) {
    return Set.copyOf(tags.getOrDefault(tag, Set.of()));
  }

  @Override
  public Optional<CacheEntry> findEntry(String key) {
    checkAvailable();
    return Optional.ofNullable(entries.get(key));
  }

  @Override
  public void saveEntry(CacheEntry entry) {
    checkAvailable();
    entries.put(entry.key(), entry);
  }

  @Override
  public void touchEntry(String key, Instant lastAccess) {
    checkAvailable();
    entries.computeIfPresent(key, (k, entry) -> entry.touch(lastAccess));
  }

  @Override
  public boolean deleteEntry(String key) {
    checkAvailable();
    return entries.remove(key) != null;
  }

  @Override
  public boolean entryExists(String key) {
    checkAvailable();
    return entries.containsKey(key);
  }

  @Override
  public void addTagMember(String tag, String key) {
    checkAvailable();
    tags.compute(
        tag,
        (t, members) -> {
          Set<String> updated = members == null ? new LinkedHashSet<>() : members;
          updated.add(key);
          return updated;
        });
    Runnable action = afterTagMemberAdded.getAndSet(null);
    if (action != null) {
      action.run();
    }
  }

  @Override
  public void removeTagMember(String tag, String key) {
    checkAvailable();
    tags.computeIfPresent(
        tag,
        (t, members) -> {
          members.remove(key);
          return members.isEmpty() ? null : members;
        });
  }

  @Override
  public Set<String> tagMembers(String tag) {
    checkAvailable();
    return peekTag(tag);
  }

  @Override
  public Set<String> entryKeys() {
    checkAvailable();
    return Set.copyOf(entries.keySet());
  }

  @Override
  public Set<String> tagNames() {
    checkAvailable();
    return Set.copyOf(tags.keySet());
  }

  @Override
  public long countRecords() {
    checkAvailable();
    return entries.size() + tags.size();
  }

  @Override
  public void clearNamespace() {
    checkAvailable();
    if (!adminAllowed) {
      throw CacheStoreException.privilegedOperation("clear");
    }
    entries.clear();
    tags.clear();
  }

  private void checkAvailable() {
    accessCount.incrementAndGet();
    RuntimeException current = failure.get();
    if (current != null) {
      throw current;
    }
  }
}
