/**
 * Spring Boot auto-configuration for tagwise-cache.
 *
 * <p>{@link tagwise.cache.infrastructure.config.TaggedCacheAutoConfiguration} is registered in
 * {@code META-INF/spring/org.springframework.boot.autoconfigure.AutoConfiguration.imports} and
 * binds {@link tagwise.cache.infrastructure.config.TaggedCacheProperties}
 * ({@code tagwise.cache.*}).
 *
 * <h3>Exported beans:</h3>
 *
 * <ul>
 *   <li>LogicExecutor
 *   <li>RedissonConnectionProvider, RedisKeyspace
 *   <li>PayloadSerializer, DistributedLockPort, CacheEntryStore
 *   <li>TaggedCache (failures republished as CachingFailedEvent)
 * </ul>
 */
package tagwise.cache.infrastructure.config;
