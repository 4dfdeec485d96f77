package tagwise.cache.error.exception;

import java.time.Duration;
import lombok.Getter;
import tagwise.cache.error.CommonErrorCode;

/** 키 단위 분산 락을 대기 시간 내에 얻지 못한 경우 (LockTimeout) */
@Getter
public class LockTimeoutException extends DistributedLockException {

  private final String lockKey;
  private final Duration waitTimeout;

  public LockTimeoutException(String lockKey, Duration waitTimeout) {
    super(
        CommonErrorCode.LOCK_ACQUISITION_TIMEOUT,
        lockKey + ", wait=" + waitTimeout.toMillis() + "ms");
    this.lockKey = lockKey;
    this.waitTimeout = waitTimeout;
  }
}
