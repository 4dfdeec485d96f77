package tagwise.cache.error.exception;

import lombok.Getter;
import tagwise.cache.error.CommonErrorCode;
import tagwise.cache.error.exception.base.ServerBaseException;

/**
 * 캐시 엔진이 흡수한 장애를 실패 채널로 전달하기 위한 래퍼
 *
 * <p>메시지는 항상 {@code "Caching failed for {operation}"} 형식이며, 원본 예외는
 * {@link #getCause()}로 확인합니다. 호출자에게 throw 되지 않습니다.
 */
@Getter
public class CachingFailedException extends ServerBaseException {

  private final String operation;

  public CachingFailedException(String operation, Throwable cause) {
    super(CommonErrorCode.CACHING_FAILED, cause, operation);
    this.operation = operation;
  }
}
