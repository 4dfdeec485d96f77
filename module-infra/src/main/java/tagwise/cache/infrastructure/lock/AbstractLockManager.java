package tagwise.cache.infrastructure.lock;

import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tagwise.cache.common.function.ThrowingSupplier;
import tagwise.cache.core.domain.model.LockToken;
import tagwise.cache.core.port.out.DistributedLockPort;
import tagwise.cache.error.exception.LockTimeoutException;
import tagwise.cache.infrastructure.executor.LogicExecutor;
import tagwise.cache.infrastructure.executor.TaskContext;
import tagwise.cache.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * 키 단위 락 관리자 추상 클래스
 *
 * <p>Template Method Pattern:
 *
 * <ul>
 *   <li>{@link #acquire}, {@link #release}, {@link #executeWithLock}: 템플릿 메서드 (변하지 않는 뼈대)
 *   <li>{@link #tryLock}, {@link #unlockInternal}, {@link #shouldUnlock}: 추상 메서드 (변하는 부분)
 *   <li>{@link #onLockAcquired}, {@link #onLockFailed}, {@link #onLockReleased}: Hook 메서드 (선택적 확장)
 * </ul>
 *
 * <p>획득 실패는 {@link LockTimeoutException}, 대기 중 인터럽트는 {@code DistributedLockException},
 * 저장소 장애는 {@code CacheConnectivityException}/{@code CacheStoreException}으로 전파됩니다.
 * 해제는 멱등이며 실패해도 예외를 던지지 않습니다.
 */
@Slf4j
@RequiredArgsConstructor
public abstract class AbstractLockManager implements DistributedLockPort {

  protected final LogicExecutor executor;

  @Override
  public LockToken acquire(String key, Duration waitTimeout) {
    String lockName = buildLockName(key);

    boolean locked =
        executor.executeWithTranslation(
            () -> tryLock(lockName, waitTimeout),
            ExceptionTranslator.forLock(lockName),
            TaskContext.of("Lock", "acquire", key));

    if (!locked) {
      onLockFailed(lockName, waitTimeout);
      throw new LockTimeoutException(key, waitTimeout);
    }

    LockToken token =
        new LockToken(key, lockName, Thread.currentThread().getId(), Instant.now());
    onLockAcquired(lockName);
    return token;
  }

  @Override
  public void release(LockToken token) {
    if (token == null || !token.markReleased()) {
      return;
    }
    executor.executeVoid(
        () -> performUnlock(token), TaskContext.of("Lock", "release", token.key()));
  }

  /**
   * 작업 실행 + finally 블록에서 락 해제
   *
   * <p>작업이 던진 {@code BaseException}은 그대로, 그 밖의 예외는 {@code InternalSystemException}으로 전파됩니다.
   */
  @Override
  public <T> T executeWithLock(String key, Duration waitTimeout, ThrowingSupplier<T> task) {
    LockToken token = acquire(key, waitTimeout);
    return executor.executeWithFinally(
        task, () -> release(token), TaskContext.of("Lock", "lockedTask", key));
  }

  /**
   * 락 해제 로직
   *
   * <p>해제 실패는 로그로만 남깁니다. 락은 lease/watchdog 만료로 결국 풀리므로 호출자의 결과를 바꾸지 않습니다.
   */
  private void performUnlock(LockToken token) {
    try {
      if (shouldUnlock(token)) {
        unlockInternal(token);
        onLockReleased(token);
      }
    } catch (Exception e) {
      log.error("락 해제 중 예외 발생: {}", token.lockName(), e);
    }
  }

  // ===== 추상 메서드 (구현체가 반드시 구현) =====

  /**
   * 락 획득 시도
   *
   * @param lockName 락 이름
   * @param waitTimeout 최대 대기 시간
   * @return 락 획득 성공 여부
   * @throws Throwable 락 획득 중 발생한 예외
   */
  protected abstract boolean tryLock(String lockName, Duration waitTimeout) throws Throwable;

  /** 락 해제 (내부용) */
  protected abstract void unlockInternal(LockToken token);

  /** 토큰 소유 스레드가 아직 락을 보유하고 있는지 */
  protected abstract boolean shouldUnlock(LockToken token);

  // ===== Hook 메서드 (구현체가 선택적으로 오버라이드) =====

  /** 락 이름 생성 전략 (기본: "lock:" 접두사) */
  protected String buildLockName(String key) {
    return "lock:" + key;
  }

  protected void onLockAcquired(String lockName) {
    log.debug("[Lock] '{}' 획득 성공", lockName);
  }

  protected void onLockFailed(String lockName, Duration waitTimeout) {
    log.warn("[Lock] '{}' 획득 실패: wait={}ms", lockName, waitTimeout.toMillis());
  }

  protected void onLockReleased(LockToken token) {
    log.debug(
        "[Lock] '{}' 해제 완료: held={}ms",
        token.lockName(),
        Duration.between(token.acquiredAt(), Instant.now()).toMillis());
  }
}
