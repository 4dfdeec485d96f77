package tagwise.cache.error.exception;

import tagwise.cache.error.CommonErrorCode;
import tagwise.cache.error.exception.base.ServerBaseException;

/** 분산 락(Distributed Lock) 처리 중 발생하는 서버 예외 */
public class DistributedLockException extends ServerBaseException {

  protected DistributedLockException(CommonErrorCode errorCode, String detail) {
    super(errorCode, detail);
  }

  public DistributedLockException(String lockKey, Throwable cause) {
    super(CommonErrorCode.STORE_OPERATION_FAILURE, cause, "락 시도 중 오류: " + lockKey);
  }
}
