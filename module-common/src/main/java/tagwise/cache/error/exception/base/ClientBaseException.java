package tagwise.cache.error.exception.base;

import tagwise.cache.error.ErrorCode;

/**
 * ClientBaseException: 호출자가 잘못된 인자를 넘겼을 때 발생하는 예외. 실패 채널로 라우팅되지 않고 항상 호출자에게 동기적으로 전파됩니다.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
