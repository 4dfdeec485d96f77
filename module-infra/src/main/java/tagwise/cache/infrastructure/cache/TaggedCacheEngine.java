package tagwise.cache.infrastructure.cache;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import tagwise.cache.application.port.TaggedCache;
import tagwise.cache.common.function.ThrowingSupplier;
import tagwise.cache.core.domain.model.CacheEntry;
import tagwise.cache.core.domain.model.CacheLookup;
import tagwise.cache.core.domain.model.ExpirationPolicy;
import tagwise.cache.core.domain.model.ExpirationVerdict;
import tagwise.cache.core.failure.CachingFailureListener;
import tagwise.cache.core.failure.Subscription;
import tagwise.cache.core.index.TagIndex;
import tagwise.cache.core.port.out.CacheEntryStore;
import tagwise.cache.core.port.out.DistributedLockPort;
import tagwise.cache.core.port.out.PayloadSerializer;
import tagwise.cache.error.exception.CachingFailedException;
import tagwise.cache.error.exception.InvalidCacheArgumentException;
import tagwise.cache.infrastructure.cache.failure.CachingFailureChannel;
import tagwise.cache.infrastructure.executor.LogicExecutor;
import tagwise.cache.infrastructure.executor.TaskContext;

/**
 * 의존 태그 기반 무효화를 지원하는 write-through 캐시 엔진
 *
 * <h3>실패 처리</h3>
 *
 * <p>저장소 접근은 모두 {@link LogicExecutor#executeWithRecovery}로 감싼 보호 구간에서 실행됩니다. 연결 장애, 락 타임아웃,
 * 저장소/직렬화 오류는 {@link CachingFailedException}("Caching failed for {operation}")으로 감싸 실패 채널에 동기
 * 발행하고, 호출은 무해한 결과(not-found, 0, no-op)를 반환합니다. 인자 오류({@link InvalidCacheArgumentException})만 저장소
 * 접근 전에 검사되어 그대로 throw 됩니다.
 *
 * <h3>동시성</h3>
 *
 * <p>한 키에 대한 read-modify-write는 그 키의 분산 락 안에서만 실행됩니다. 락은 키 하나의 작업 동안만 보유하며, fan-out(
 * invalidateSets, purge) 전체에 걸쳐 보유하지 않습니다.
 *
 * <h3>메트릭</h3>
 *
 * <ul>
 *   <li>{@code tagcache.hit}, {@code tagcache.miss}: getItem 결과
 *   <li>{@code tagcache.failure{operation}}: 흡수된 장애
 *   <li>{@code tagcache.invalidated}: 무효화/만료로 삭제된 엔트리
 * </ul>
 */
@Slf4j
public class TaggedCacheEngine implements TaggedCache, AutoCloseable {

  public static final Duration DEFAULT_LOCK_WAIT_TIMEOUT = Duration.ofSeconds(5);

  private static final String COMPONENT = "TaggedCache";

  private final CacheEntryStore store;
  private final TagIndex tagIndex;
  private final DistributedLockPort lockManager;
  private final PayloadSerializer serializer;
  private final LogicExecutor executor;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final Runnable onClose;
  private final CachingFailureChannel failureChannel = new CachingFailureChannel();

  private volatile Duration lockWaitTimeout = DEFAULT_LOCK_WAIT_TIMEOUT;

  public TaggedCacheEngine(
      CacheEntryStore store,
      DistributedLockPort lockManager,
      PayloadSerializer serializer,
      LogicExecutor executor,
      MeterRegistry meterRegistry,
      Clock clock) {
    this(store, lockManager, serializer, executor, meterRegistry, clock, () -> {});
  }

  /**
   * @param onClose {@link #close()} 시 실행할 정리 작업 (소유한 연결 종료 등)
   */
  public TaggedCacheEngine(
      CacheEntryStore store,
      DistributedLockPort lockManager,
      PayloadSerializer serializer,
      LogicExecutor executor,
      MeterRegistry meterRegistry,
      Clock clock,
      Runnable onClose) {
    this.store = Objects.requireNonNull(store, "store");
    this.tagIndex = new TagIndex(store);
    this.lockManager = Objects.requireNonNull(lockManager, "lockManager");
    this.serializer = Objects.requireNonNull(serializer, "serializer");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.onClose = Objects.requireNonNull(onClose, "onClose");
  }

  // ===== 쓰기 =====

  @Override
  public void putItem(
      String key,
      Object value,
      Collection<String> dependentTags,
      Duration slidingExpiration,
      Instant absoluteExpiration) {
    requireKey(key);
    if (dependentTags == null) {
      throw InvalidCacheArgumentException.missingTags("dependentTags");
    }

    guarded(
        "putItem",
        key,
        () -> {
          String payload = serializer.serialize(value);
          CacheEntry entry =
              CacheEntry.create(
                  key,
                  payload,
                  dependentTags,
                  ExpirationPolicy.of(slidingExpiration, absoluteExpiration),
                  clock.instant());
          return withLock(key, () -> writeLocked(entry));
        },
        null);
  }

  /** 태그 등록 → 엔트리 기록 → 이전 버전에만 있던 태그 정리 (키 락 보유 상태) */
  private Void writeLocked(CacheEntry entry) {
    Set<String> previousTags =
        store.findEntry(entry.key()).map(CacheEntry::dependentTags).orElse(Set.of());

    tagIndex.register(entry.key(), entry.dependentTags());
    store.saveEntry(entry);
    tagIndex.retainOnly(entry.key(), previousTags, entry.dependentTags());

    log.debug("[TaggedCache] Put: key={}, tags={}", entry.key(), entry.dependentTags());
    return null;
  }

  // ===== 읽기 =====

  @Override
  public CacheLookup getItem(String key) {
    requireKey(key);
    return guarded(
        "getItem", key, () -> withLock(key, () -> readLocked(key)), CacheLookup.miss());
  }

  @Override
  public <T> Optional<T> getItem(String key, Class<T> type) {
    Objects.requireNonNull(type, "type");
    CacheLookup lookup = getItem(key);
    if (!lookup.found() || !type.isInstance(lookup.value())) {
      return Optional.empty();
    }
    return Optional.of(type.cast(lookup.value()));
  }

  /**
   * 만료 판정 순서: absolute → sliding. 만료된 엔트리는 즉시 삭제(lazy expiration), 유효하면 lastAccess만 갱신
   */
  private CacheLookup readLocked(String key) {
    Optional<CacheEntry> found = store.findEntry(key);
    if (found.isEmpty()) {
      return recordMiss(key);
    }

    CacheEntry entry = found.get();
    Instant now = clock.instant();
    ExpirationVerdict verdict = entry.evaluate(now);
    if (verdict.isExpired()) {
      log.debug("[TaggedCache] Expired on read: key={}, verdict={}", key, verdict);
      removeLocked(entry);
      return recordMiss(key);
    }

    Object value = serializer.deserialize(entry.payload());
    store.touchEntry(key, entry.touch(now).lastAccess());

    meterRegistry.counter("tagcache.hit").increment();
    log.debug("[TaggedCache] Hit: key={}", key);
    return CacheLookup.hit(value);
  }

  private CacheLookup recordMiss(String key) {
    meterRegistry.counter("tagcache.miss").increment();
    log.debug("[TaggedCache] Miss: key={}", key);
    return CacheLookup.miss();
  }

  // ===== 무효화 =====

  @Override
  public void invalidateItem(String key) {
    requireKey(key);
    guarded(
        "invalidateItem",
        key,
        () -> withLock(key, () -> store.findEntry(key).map(this::removeLocked).orElse(false)),
        false);
  }

  /**
   * 태그별 순차 fan-out
   *
   * <p>멤버 키마다 그 키의 락을 따로 잡고 해제합니다. 한 키의 실패는 보고 후 나머지 키를 계속 처리합니다. 처리한 멤버는 태그 레코드에서
   * 제거되므로 마지막 멤버와 함께 레코드도 사라집니다.
   */
  @Override
  public void invalidateSets(Collection<String> tags) {
    if (tags == null) {
      throw InvalidCacheArgumentException.missingTags("tags");
    }

    for (String tag : tags) {
      if (tag == null) {
        continue;
      }
      Set<String> members = guarded("invalidateSets", tag, () -> tagIndex.members(tag), Set.of());
      for (String key : members) {
        guarded(
            "invalidateSets", key, () -> withLock(key, () -> invalidateMember(tag, key)), false);
      }
    }
  }

  /** 엔트리가 여전히 이 태그를 선언하고 있을 때만 삭제. 아니면 남은 멤버십만 정리 */
  private boolean invalidateMember(String tag, String key) {
    Optional<CacheEntry> entry = store.findEntry(key);
    if (entry.isPresent() && entry.get().dependentTags().contains(tag)) {
      return removeLocked(entry.get());
    }
    tagIndex.unregister(key, List.of(tag));
    return false;
  }

  /** 엔트리와 그 엔트리의 태그 멤버십 삭제 (키 락 보유 상태) */
  private boolean removeLocked(CacheEntry entry) {
    store.deleteEntry(entry.key());
    tagIndex.unregister(entry.key(), entry.dependentTags());
    meterRegistry.counter("tagcache.invalidated").increment();
    log.debug("[TaggedCache] Removed: key={}, tags={}", entry.key(), entry.dependentTags());
    return true;
  }

  // ===== 유지보수 =====

  /**
   * absolute 만료된 엔트리 삭제 후 존재하지 않는 엔트리를 가리키는 태그 멤버 정리
   *
   * <p>태그 멤버 정리도 멤버 키의 락 안에서 판정합니다. put은 같은 락 안에서 태그를 먼저 등록하고 엔트리를 나중에 기록합니다.
   * sliding 만료는 조회 시점에만 판정합니다. 자동으로 호출되지 않습니다.
   */
  @Override
  public void purge() {
    guarded(
        "purge",
        "",
        () -> {
          int purged = 0;
          for (String key : store.entryKeys()) {
            if (guarded("purge", key, () -> withLock(key, () -> purgeLocked(key)), false)) {
              purged++;
            }
          }
          int pruned = 0;
          for (String tag : tagIndex.tags()) {
            for (String key : tagIndex.members(tag)) {
              if (pruneMember(tag, key)) {
                pruned++;
              }
            }
          }
          log.info("[TaggedCache] Purge complete: entries={}, danglingMembers={}", purged, pruned);
          return null;
        },
        null);
  }

  private boolean pruneMember(String tag, String key) {
    return guarded(
        "purge", key, () -> withLock(key, () -> tagIndex.pruneIfDangling(tag, key)), false);
  }

  private boolean purgeLocked(String key) {
    Optional<CacheEntry> entry = store.findEntry(key);
    if (entry.isPresent() && entry.get().expiration().isAbsolutelyExpired(clock.instant())) {
      return removeLocked(entry.get());
    }
    return false;
  }

  @Override
  public long count() {
    return guarded("count", "", store::countRecords, 0L);
  }

  @Override
  public void clear() {
    guarded(
        "clear",
        "",
        () -> {
          store.clearNamespace();
          return null;
        },
        null);
  }

  // ===== 설정 / 실패 채널 =====

  @Override
  public Duration getLockWaitTimeout() {
    return lockWaitTimeout;
  }

  @Override
  public void setLockWaitTimeout(Duration lockWaitTimeout) {
    if (lockWaitTimeout == null || lockWaitTimeout.isNegative()) {
      throw InvalidCacheArgumentException.invalidSetting(
          "lockWaitTimeout must be non-negative: " + lockWaitTimeout);
    }
    this.lockWaitTimeout = lockWaitTimeout;
  }

  @Override
  public Subscription onCachingFailed(CachingFailureListener listener) {
    return failureChannel.subscribe(listener);
  }

  @Override
  public void close() {
    onClose.run();
  }

  // ===== 내부 =====

  private <T> T withLock(String key, ThrowingSupplier<T> body) throws Throwable {
    return lockManager.executeWithLock(key, lockWaitTimeout, body);
  }

  /**
   * 보호 구간: 실패를 흡수하여 실패 채널로 발행하고 fallback 반환
   *
   * <p>{@link Error}는 LogicExecutor가 흡수하지 않고 그대로 전파합니다.
   */
  private <T> T guarded(String operation, String target, ThrowingSupplier<T> body, T fallback) {
    return executor.executeWithRecovery(
        body,
        cause -> {
          meterRegistry.counter("tagcache.failure", "operation", operation).increment();
          failureChannel.publish(new CachingFailedException(operation, cause));
          return fallback;
        },
        TaskContext.of(COMPONENT, operation, target));
  }

  private static void requireKey(String key) {
    if (key == null || key.isEmpty()) {
      throw InvalidCacheArgumentException.emptyKey("key");
    }
  }
}
