package tagwise.cache.error.exception;

import tagwise.cache.error.CommonErrorCode;
import tagwise.cache.error.exception.base.ServerBaseException;

/** 저장소에 도달할 수 없거나 전송 타임아웃이 발생한 경우 (ConnectivityError) */
public class CacheConnectivityException extends ServerBaseException {

  public CacheConnectivityException(String detail) {
    super(CommonErrorCode.STORE_CONNECTION_FAILURE, detail);
  }

  public CacheConnectivityException(String detail, Throwable cause) {
    super(CommonErrorCode.STORE_CONNECTION_FAILURE, cause, detail);
  }
}
