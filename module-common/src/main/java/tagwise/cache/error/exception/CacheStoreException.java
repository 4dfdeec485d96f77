package tagwise.cache.error.exception;

import tagwise.cache.error.CommonErrorCode;
import tagwise.cache.error.exception.base.ServerBaseException;

/**
 * 연결 문제가 아닌 기타 저장소 오류 (StoreError)
 *
 * <p>프로토콜 오류, 직렬화 실패, 권한 없이 시도한 관리자 작업 등을 포함합니다.
 */
public class CacheStoreException extends ServerBaseException {

  public CacheStoreException(String detail, Throwable cause) {
    super(CommonErrorCode.STORE_OPERATION_FAILURE, cause, detail);
  }

  private CacheStoreException(CommonErrorCode errorCode, String detail) {
    super(errorCode, detail);
  }

  public static CacheStoreException privilegedOperation(String operation) {
    return new CacheStoreException(CommonErrorCode.PRIVILEGED_OPERATION_DENIED, operation);
  }
}
