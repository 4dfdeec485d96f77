package tagwise.cache.infrastructure.lock;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.redisson.api.RLock;
import tagwise.cache.core.domain.model.LockToken;
import tagwise.cache.infrastructure.executor.LogicExecutor;
import tagwise.cache.infrastructure.redis.RedisKeyspace;
import tagwise.cache.infrastructure.redis.RedissonConnectionProvider;

/**
 * Redisson {@link RLock} 기반 키 단위 분산 락
 *
 * <p>락 이름은 {@code {ns}:lock:{key}}. leaseTime을 지정하지 않으면 Redisson watchdog이 보유 중 임대를 연장하고, 보유
 * 프로세스가 죽으면 watchdog 주기 후 자동으로 풀립니다.
 */
public class RedissonLockManager extends AbstractLockManager {

  private final RedissonConnectionProvider connection;
  private final RedisKeyspace keyspace;
  private final Duration leaseTime;

  /**
   * @param leaseTime 임대 시간, {@code null}이면 watchdog 사용
   */
  public RedissonLockManager(
      LogicExecutor executor,
      RedissonConnectionProvider connection,
      RedisKeyspace keyspace,
      Duration leaseTime) {
    super(executor);
    this.connection = connection;
    this.keyspace = keyspace;
    this.leaseTime = leaseTime;
  }

  @Override
  protected boolean tryLock(String lockName, Duration waitTimeout) throws Throwable {
    RLock lock = lock(lockName);
    if (leaseTime == null) {
      return lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }
    return lock.tryLock(waitTimeout.toMillis(), leaseTime.toMillis(), TimeUnit.MILLISECONDS);
  }

  @Override
  protected void unlockInternal(LockToken token) {
    lock(token.lockName()).unlockAsync(token.ownerThreadId()).toCompletableFuture().join();
  }

  @Override
  protected boolean shouldUnlock(LockToken token) {
    return lock(token.lockName()).isHeldByThread(token.ownerThreadId());
  }

  @Override
  protected String buildLockName(String key) {
    return keyspace.lockKey(key);
  }

  private RLock lock(String lockName) {
    return connection.client().getLock(lockName);
  }
}
