package tagwise.cache.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import tagwise.cache.application.port.TaggedCache;
import tagwise.cache.core.port.out.CacheEntryStore;
import tagwise.cache.core.port.out.DistributedLockPort;
import tagwise.cache.core.port.out.PayloadSerializer;
import tagwise.cache.infrastructure.cache.TaggedCacheEngine;
import tagwise.cache.infrastructure.cache.failure.CachingFailedEvent;
import tagwise.cache.infrastructure.executor.DefaultLogicExecutor;
import tagwise.cache.infrastructure.executor.LogicExecutor;
import tagwise.cache.infrastructure.lock.RedissonLockManager;
import tagwise.cache.infrastructure.redis.RedisConnectionOptions;
import tagwise.cache.infrastructure.redis.RedisKeyspace;
import tagwise.cache.infrastructure.redis.RedissonCacheEntryStore;
import tagwise.cache.infrastructure.redis.RedissonConnectionProvider;
import tagwise.cache.infrastructure.serializer.JacksonPayloadSerializer;

/**
 * tagwise-cache 자동 구성
 *
 * <p>{@code tagwise.cache.enabled=false}로 비활성화할 수 있습니다. 모든 빈은 {@code @ConditionalOnMissingBean}이므로
 * 애플리케이션이 같은 타입의 빈을 선언하면 그 빈이 우선합니다.
 *
 * <ul>
 *   <li>컨텍스트에 {@link RedissonClient}가 있으면 재사용 (종료는 소유자가 담당)
 *   <li>없으면 {@code tagwise.cache.connection} 옵션 문자열로 직접 생성
 *   <li>흡수된 캐시 장애는 {@link CachingFailedEvent}로 재발행 ({@code @EventListener}로 구독)
 * </ul>
 */
@Slf4j
@AutoConfiguration
@ConditionalOnClass(RedissonClient.class)
@ConditionalOnProperty(
    prefix = "tagwise.cache",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
@EnableConfigurationProperties(TaggedCacheProperties.class)
public class TaggedCacheAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public LogicExecutor logicExecutor(ObjectProvider<MeterRegistry> meterRegistry) {
    return new DefaultLogicExecutor(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
  }

  @Bean
  @ConditionalOnMissingBean
  public RedisKeyspace redisKeyspace(TaggedCacheProperties properties) {
    return new RedisKeyspace(properties.getNamespace());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public RedissonConnectionProvider redissonConnectionProvider(
      TaggedCacheProperties properties, ObjectProvider<RedissonClient> redissonClient) {
    RedisConnectionOptions options = RedisConnectionOptions.parse(properties.getConnection());
    RedissonClient existing = redissonClient.getIfAvailable();
    if (existing != null) {
      log.info(
          "[TaggedCache] Reusing RedissonClient from context: allowAdmin={}", options.allowAdmin());
      return RedissonConnectionProvider.wrap(existing, options.allowAdmin());
    }
    return RedissonConnectionProvider.connect(options);
  }

  @Bean
  @ConditionalOnMissingBean
  public PayloadSerializer payloadSerializer(LogicExecutor logicExecutor) {
    return new JacksonPayloadSerializer(logicExecutor);
  }

  @Bean
  @ConditionalOnMissingBean
  public DistributedLockPort distributedLockPort(
      LogicExecutor logicExecutor,
      RedissonConnectionProvider connectionProvider,
      RedisKeyspace keyspace,
      TaggedCacheProperties properties) {
    return new RedissonLockManager(
        logicExecutor, connectionProvider, keyspace, properties.getLockLeaseTime());
  }

  @Bean
  @ConditionalOnMissingBean
  public CacheEntryStore cacheEntryStore(
      RedissonConnectionProvider connectionProvider,
      RedisKeyspace keyspace,
      LogicExecutor logicExecutor) {
    return new RedissonCacheEntryStore(
        connectionProvider, keyspace, logicExecutor, new ObjectMapper());
  }

  @Bean
  @ConditionalOnMissingBean(TaggedCache.class)
  public TaggedCacheEngine taggedCache(
      CacheEntryStore cacheEntryStore,
      DistributedLockPort distributedLockPort,
      PayloadSerializer payloadSerializer,
      LogicExecutor logicExecutor,
      ObjectProvider<MeterRegistry> meterRegistry,
      TaggedCacheProperties properties,
      ApplicationEventPublisher eventPublisher) {
    TaggedCacheEngine engine =
        new TaggedCacheEngine(
            cacheEntryStore,
            distributedLockPort,
            payloadSerializer,
            logicExecutor,
            meterRegistry.getIfAvailable(SimpleMeterRegistry::new),
            Clock.systemUTC());
    engine.setLockWaitTimeout(properties.getLockWaitTimeout());
    engine.onCachingFailed(failure -> eventPublisher.publishEvent(CachingFailedEvent.of(failure)));
    return engine;
  }
}
