package tagwise.cache.error.exception.base;

import tagwise.cache.error.ErrorCode;

/**
 * ServerBaseException: 저장소 장애, 락 타임아웃 등 인프라 측 예외. 캐시 엔진 경계에서 흡수되어 실패 채널로 전달되며, 장애 회고를 위한 상세 로그를
 * 남기는 것이 주 목적입니다.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  // 실제 에러(cause)를 포함하여 디버깅 정보 확보
  public ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
