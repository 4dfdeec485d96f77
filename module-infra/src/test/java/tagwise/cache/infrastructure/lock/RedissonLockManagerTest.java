package tagwise.cache.infrastructure.lock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RFuture;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisTimeoutException;
import tagwise.cache.core.domain.model.LockToken;
import tagwise.cache.error.exception.CacheConnectivityException;
import tagwise.cache.error.exception.DistributedLockException;
import tagwise.cache.error.exception.InternalSystemException;
import tagwise.cache.error.exception.LockTimeoutException;
import tagwise.cache.infrastructure.executor.DefaultLogicExecutor;
import tagwise.cache.infrastructure.redis.RedisKeyspace;
import tagwise.cache.infrastructure.redis.RedissonConnectionProvider;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedissonLockManager")
class RedissonLockManagerTest {

  private static final String LOCK_NAME = "tagcache:lock:order:42";

  @Mock private RedissonClient redissonClient;
  @Mock private RLock lock;
  @Mock private RFuture<Void> unlockFuture;

  private RedissonLockManager lockManager;

  @BeforeEach
  void setUp() {
    given(redissonClient.getLock(LOCK_NAME)).willReturn(lock);
    lockManager = newManager(null);
  }

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  private RedissonLockManager newManager(Duration leaseTime) {
    return new RedissonLockManager(
        new DefaultLogicExecutor(new SimpleMeterRegistry()),
        RedissonConnectionProvider.wrap(redissonClient, false),
        RedisKeyspace.defaults(),
        leaseTime);
  }

  @Test
  @DisplayName("leaseTime 미지정 시 watchdog 모드로 tryLock")
  void acquireUsesWatchdogWhenLeaseUnset() throws Exception {
    given(lock.tryLock(250L, TimeUnit.MILLISECONDS)).willReturn(true);

    LockToken token = lockManager.acquire("order:42", Duration.ofMillis(250));

    assertThat(token.key()).isEqualTo("order:42");
    assertThat(token.lockName()).isEqualTo(LOCK_NAME);
    assertThat(token.ownerThreadId()).isEqualTo(Thread.currentThread().getId());
  }

  @Test
  @DisplayName("leaseTime 지정 시 임대 시간과 함께 tryLock")
  void acquireUsesLeaseTimeWhenConfigured() throws Exception {
    given(lock.tryLock(100L, 30_000L, TimeUnit.MILLISECONDS)).willReturn(true);

    newManager(Duration.ofSeconds(30)).acquire("order:42", Duration.ofMillis(100));

    verify(lock).tryLock(100L, 30_000L, TimeUnit.MILLISECONDS);
  }

  @Test
  @DisplayName("대기 시간 내 획득 실패 → LockTimeoutException")
  void timeoutBecomesLockTimeout() throws Exception {
    given(lock.tryLock(anyLong(), eq(TimeUnit.MILLISECONDS))).willReturn(false);

    assertThatThrownBy(() -> lockManager.acquire("order:42", Duration.ofMillis(10)))
        .isInstanceOf(LockTimeoutException.class)
        .extracting("lockKey")
        .isEqualTo("order:42");
  }

  @Test
  @DisplayName("대기 중 인터럽트 → DistributedLockException + 인터럽트 플래그 복원")
  void interruptWhileWaiting() throws Exception {
    given(lock.tryLock(anyLong(), eq(TimeUnit.MILLISECONDS)))
        .willThrow(new InterruptedException());

    assertThatThrownBy(() -> lockManager.acquire("order:42", Duration.ofMillis(10)))
        .isExactlyInstanceOf(DistributedLockException.class);
    assertThat(Thread.currentThread().isInterrupted()).isTrue();
  }

  @Test
  @DisplayName("Redis 응답 타임아웃 → 연결 장애로 번역")
  void redisTimeoutBecomesConnectivityFailure() throws Exception {
    given(lock.tryLock(anyLong(), eq(TimeUnit.MILLISECONDS)))
        .willThrow(new RedisTimeoutException("no response"));

    assertThatThrownBy(() -> lockManager.acquire("order:42", Duration.ofMillis(10)))
        .isInstanceOf(CacheConnectivityException.class);
  }

  @Test
  @DisplayName("release는 소유 스레드 기준으로 한 번만 해제")
  void releaseIsIdempotent() throws Exception {
    long threadId = Thread.currentThread().getId();
    given(lock.tryLock(anyLong(), eq(TimeUnit.MILLISECONDS))).willReturn(true);
    given(lock.isHeldByThread(threadId)).willReturn(true);
    given(lock.unlockAsync(threadId)).willReturn(unlockFuture);
    given(unlockFuture.toCompletableFuture()).willReturn(CompletableFuture.completedFuture(null));

    LockToken token = lockManager.acquire("order:42", Duration.ofMillis(10));
    lockManager.release(token);
    lockManager.release(token);

    verify(lock, times(1)).unlockAsync(threadId);
    assertThat(token.isReleased()).isTrue();
  }

  @Test
  @DisplayName("이미 만료된 락(다른 소유자)은 해제하지 않는다")
  void releaseSkipsLockNoLongerHeld() throws Exception {
    long threadId = Thread.currentThread().getId();
    given(lock.tryLock(anyLong(), eq(TimeUnit.MILLISECONDS))).willReturn(true);
    given(lock.isHeldByThread(threadId)).willReturn(false);

    lockManager.release(lockManager.acquire("order:42", Duration.ofMillis(10)));

    verify(lock, never()).unlockAsync(anyLong());
  }

  @Test
  @DisplayName("executeWithLock은 작업이 실패해도 락을 해제")
  void scopedFormReleasesOnFailure() throws Exception {
    long threadId = Thread.currentThread().getId();
    given(lock.tryLock(anyLong(), eq(TimeUnit.MILLISECONDS))).willReturn(true);
    given(lock.isHeldByThread(threadId)).willReturn(true);
    given(lock.unlockAsync(threadId)).willReturn(unlockFuture);
    given(unlockFuture.toCompletableFuture()).willReturn(CompletableFuture.completedFuture(null));

    assertThatThrownBy(
            () ->
                lockManager.executeWithLock(
                    "order:42",
                    Duration.ofMillis(10),
                    () -> {
                      throw new IllegalStateException("task failed");
                    }))
        .isInstanceOf(InternalSystemException.class)
        .hasCauseInstanceOf(IllegalStateException.class);

    verify(lock).unlockAsync(threadId);
  }
}
