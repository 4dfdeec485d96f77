package tagwise.cache.infrastructure.redis;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.BatchOptions;
import org.redisson.api.RBatch;
import org.redisson.api.RKeys;
import org.redisson.api.RMap;
import org.redisson.api.RMapAsync;
import org.redisson.api.RSet;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import tagwise.cache.common.function.ThrowingSupplier;
import tagwise.cache.core.domain.model.CacheEntry;
import tagwise.cache.core.domain.model.ExpirationPolicy;
import tagwise.cache.core.port.out.CacheEntryStore;
import tagwise.cache.error.exception.CacheStoreException;
import tagwise.cache.infrastructure.executor.LogicExecutor;
import tagwise.cache.infrastructure.executor.TaskContext;
import tagwise.cache.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * Redisson 기반 {@link CacheEntryStore} 구현
 *
 * <h3>Redis 구조</h3>
 *
 * <pre>
 * {ns}:entry:{key} (HASH)
 * ├── payload            → 직렬화된 값
 * ├── absoluteExpiration → epoch millis (없으면 만료 없음)
 * ├── slidingExpiration  → millis (없으면 sliding 없음)
 * ├── lastAccess         → epoch millis
 * └── tags               → JSON 배열
 *
 * {ns}:tag:{tag} (SET) → 엔트리 키
 * </pre>
 *
 * <p>엔트리에 Redis TTL을 걸지 않습니다. 만료 판정은 엔진이 하고, 만료된 엔트리도 purge 전까지는 count에 포함됩니다.
 *
 * <p>모든 Redisson 예외는 {@link ExceptionTranslator#forRedis(String)}로 번역됩니다.
 */
@Slf4j
@RequiredArgsConstructor
public class RedissonCacheEntryStore implements CacheEntryStore {

  static final String FIELD_PAYLOAD = "payload";
  static final String FIELD_ABSOLUTE_EXPIRATION = "absoluteExpiration";
  static final String FIELD_SLIDING_EXPIRATION = "slidingExpiration";
  static final String FIELD_LAST_ACCESS = "lastAccess";
  static final String FIELD_TAGS = "tags";

  private static final String COMPONENT = "RedisStore";
  private static final TypeReference<List<String>> TAG_LIST = new TypeReference<>() {};

  private final RedissonConnectionProvider connection;
  private final RedisKeyspace keyspace;
  private final LogicExecutor executor;
  private final ObjectMapper objectMapper;

  @Override
  public Optional<CacheEntry> findEntry(String key) {
    return run(
        "findEntry",
        key,
        () -> {
          Map<String, String> fields = entryMap(key).readAllMap();
          if (fields.isEmpty()) {
            return Optional.empty();
          }
          return Optional.of(toEntry(key, fields));
        });
  }

  @Override
  public void saveEntry(CacheEntry entry) {
    run(
        "saveEntry",
        entry.key(),
        () -> {
          Map<String, String> fields = toFields(entry);
          // 이전 버전의 필드(예: 사라진 absoluteExpiration)가 남지 않도록 delete + putAll을 원자적으로 실행
          RBatch batch =
              client()
                  .createBatch(
                      BatchOptions.defaults()
                          .executionMode(BatchOptions.ExecutionMode.IN_MEMORY_ATOMIC));
          RMapAsync<String, String> map =
              batch.getMap(keyspace.entryKey(entry.key()), StringCodec.INSTANCE);
          map.deleteAsync();
          map.putAllAsync(fields);
          batch.execute();
          return null;
        });
  }

  @Override
  public void touchEntry(String key, Instant lastAccess) {
    run(
        "touchEntry",
        key,
        () -> {
          // replace는 필드가 있을 때만 기록하므로, 그사이 삭제된 엔트리를 부분적으로 되살리지 않음
          entryMap(key).replace(FIELD_LAST_ACCESS, Long.toString(lastAccess.toEpochMilli()));
          return null;
        });
  }

  @Override
  public boolean deleteEntry(String key) {
    return run("deleteEntry", key, () -> entryMap(key).delete());
  }

  @Override
  public boolean entryExists(String key) {
    return run(
        "entryExists", key, () -> client().getKeys().countExists(keyspace.entryKey(key)) > 0);
  }

  @Override
  public void addTagMember(String tag, String key) {
    run(
        "addTagMember",
        tag,
        () -> {
          tagSet(tag).add(key);
          return null;
        });
  }

  @Override
  public void removeTagMember(String tag, String key) {
    run(
        "removeTagMember",
        tag,
        () -> {
          tagSet(tag).remove(key);
          return null;
        });
  }

  @Override
  public Set<String> tagMembers(String tag) {
    return run("tagMembers", tag, () -> new LinkedHashSet<>(tagSet(tag).readAll()));
  }

  @Override
  public Set<String> entryKeys() {
    return run(
        "entryKeys",
        "",
        () -> {
          Set<String> keys = new LinkedHashSet<>();
          for (String redisKey : client().getKeys().getKeysByPattern(keyspace.entryPattern())) {
            keys.add(keyspace.keyOf(redisKey));
          }
          return keys;
        });
  }

  @Override
  public Set<String> tagNames() {
    return run(
        "tagNames",
        "",
        () -> {
          Set<String> tags = new LinkedHashSet<>();
          for (String redisKey : client().getKeys().getKeysByPattern(keyspace.tagPattern())) {
            tags.add(keyspace.tagOf(redisKey));
          }
          return tags;
        });
  }

  @Override
  public long countRecords() {
    return run(
        "countRecords",
        "",
        () -> {
          RKeys keys = client().getKeys();
          long count = 0;
          for (String ignored : keys.getKeysByPattern(keyspace.entryPattern())) {
            count++;
          }
          for (String ignored : keys.getKeysByPattern(keyspace.tagPattern())) {
            count++;
          }
          return count;
        });
  }

  @Override
  public void clearNamespace() {
    run(
        "clearNamespace",
        keyspace.namespace(),
        () -> {
          if (!connection.isAdminAllowed()) {
            throw CacheStoreException.privilegedOperation("clear");
          }
          RKeys keys = client().getKeys();
          long removed = keys.deleteByPattern(keyspace.entryPattern());
          removed += keys.deleteByPattern(keyspace.tagPattern());
          log.info(
              "[RedisStore] Namespace cleared: namespace={}, removed={}",
              keyspace.namespace(),
              removed);
          return null;
        });
  }

  private <T> T run(String operation, String target, ThrowingSupplier<T> task) {
    return executor.executeWithTranslation(
        task,
        ExceptionTranslator.forRedis(operation + " " + target),
        TaskContext.of(COMPONENT, operation, target));
  }

  private RedissonClient client() {
    return connection.client();
  }

  private RMap<String, String> entryMap(String key) {
    return client().getMap(keyspace.entryKey(key), StringCodec.INSTANCE);
  }

  private RSet<String> tagSet(String tag) {
    return client().getSet(keyspace.tagKey(tag), StringCodec.INSTANCE);
  }

  private Map<String, String> toFields(CacheEntry entry) throws Exception {
    Map<String, String> fields = new LinkedHashMap<>();
    if (entry.payload() != null) {
      fields.put(FIELD_PAYLOAD, entry.payload());
    }
    ExpirationPolicy expiration = entry.expiration();
    if (expiration.hasAbsoluteExpiration()) {
      fields.put(
          FIELD_ABSOLUTE_EXPIRATION, Long.toString(expiration.absoluteExpiration().toEpochMilli()));
    }
    if (expiration.hasSlidingExpiration()) {
      fields.put(
          FIELD_SLIDING_EXPIRATION, Long.toString(expiration.slidingExpiration().toMillis()));
    }
    fields.put(FIELD_LAST_ACCESS, Long.toString(entry.lastAccess().toEpochMilli()));
    fields.put(FIELD_TAGS, objectMapper.writeValueAsString(List.copyOf(entry.dependentTags())));
    return fields;
  }

  private CacheEntry toEntry(String key, Map<String, String> fields) throws Exception {
    String absolute = fields.get(FIELD_ABSOLUTE_EXPIRATION);
    String sliding = fields.get(FIELD_SLIDING_EXPIRATION);
    String lastAccess = fields.get(FIELD_LAST_ACCESS);
    String tags = fields.get(FIELD_TAGS);

    ExpirationPolicy expiration =
        ExpirationPolicy.of(
            sliding == null ? null : Duration.ofMillis(Long.parseLong(sliding)),
            absolute == null ? null : Instant.ofEpochMilli(Long.parseLong(absolute)));

    return CacheEntry.restore(
        key,
        fields.get(FIELD_PAYLOAD),
        expiration,
        lastAccess == null ? Instant.EPOCH : Instant.ofEpochMilli(Long.parseLong(lastAccess)),
        tags == null ? Set.of() : new LinkedHashSet<>(objectMapper.readValue(tags, TAG_LIST)));
  }
}
