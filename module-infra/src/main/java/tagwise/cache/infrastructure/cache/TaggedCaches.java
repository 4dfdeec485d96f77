package tagwise.cache.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import tagwise.cache.infrastructure.config.TaggedCacheProperties;
import tagwise.cache.infrastructure.executor.DefaultLogicExecutor;
import tagwise.cache.infrastructure.executor.LogicExecutor;
import tagwise.cache.infrastructure.lock.RedissonLockManager;
import tagwise.cache.infrastructure.redis.RedisConnectionOptions;
import tagwise.cache.infrastructure.redis.RedisKeyspace;
import tagwise.cache.infrastructure.redis.RedissonCacheEntryStore;
import tagwise.cache.infrastructure.redis.RedissonConnectionProvider;
import tagwise.cache.infrastructure.serializer.JacksonPayloadSerializer;

/**
 * Spring 없이 엔진을 구성하는 정적 팩토리
 *
 * <pre>{@code
 * try (TaggedCacheEngine cache = TaggedCaches.create("localhost:6379,allowAdmin=true")) {
 *   cache.onCachingFailed(failure -> log.warn("cache degraded", failure));
 *   cache.putItem("order:42", order, List.of("orders"), null, null);
 * }
 * }</pre>
 *
 * <p>반환된 엔진은 Redisson 연결을 소유하므로 사용 후 {@link TaggedCacheEngine#close()}로 닫아야 합니다.
 */
public final class TaggedCaches {

  private TaggedCaches() {}

  /**
   * @param connectionConfiguration 연결 옵션 문자열 (예: {@code localhost:6379,allowAdmin=true})
   * @throws tagwise.cache.error.exception.InvalidCacheArgumentException 옵션 문자열이 잘못된 경우
   * @throws tagwise.cache.error.exception.CacheConnectivityException abortConnect=true(기본)인데
   *     연결할 수 없는 경우
   */
  public static TaggedCacheEngine create(String connectionConfiguration) {
    TaggedCacheProperties properties = new TaggedCacheProperties();
    properties.setConnection(connectionConfiguration);
    return create(properties);
  }

  public static TaggedCacheEngine create(TaggedCacheProperties properties) {
    return create(
        properties,
        RedissonConnectionProvider.connect(
            RedisConnectionOptions.parse(properties.getConnection())));
  }

  /** 이미 준비된 연결로 구성 (연결 소유권이 엔진으로 넘어감) */
  public static TaggedCacheEngine create(
      TaggedCacheProperties properties, RedissonConnectionProvider connection) {
    MeterRegistry meterRegistry = new SimpleMeterRegistry();
    LogicExecutor executor = new DefaultLogicExecutor(meterRegistry);
    RedisKeyspace keyspace = new RedisKeyspace(properties.getNamespace());

    TaggedCacheEngine engine =
        new TaggedCacheEngine(
            new RedissonCacheEntryStore(connection, keyspace, executor, new ObjectMapper()),
            new RedissonLockManager(executor, connection, keyspace, properties.getLockLeaseTime()),
            new JacksonPayloadSerializer(executor),
            executor,
            meterRegistry,
            Clock.systemUTC(),
            connection::close);
    engine.setLockWaitTimeout(properties.getLockWaitTimeout());
    return engine;
  }
}
