package tagwise.cache.error.exception;

import lombok.Getter;
import tagwise.cache.error.CommonErrorCode;
import tagwise.cache.error.exception.base.ClientBaseException;

/**
 * 잘못된 호출 인자 예외 (ArgumentError)
 *
 * <p>저장소 접근 전에 검사되며 항상 호출자에게 그대로 전파됩니다. 원인 구분은 {@link #getErrorCode()}와 {@link
 * #getParameterName()}으로 합니다.
 *
 * <ul>
 *   <li>{@link CommonErrorCode#INVALID_CACHE_KEY}: key가 null 또는 빈 문자열
 *   <li>{@link CommonErrorCode#MISSING_TAG_COLLECTION}: dependentTags / tags 컬렉션이 null
 * </ul>
 */
@Getter
public class InvalidCacheArgumentException extends ClientBaseException {

  private final String parameterName;

  private InvalidCacheArgumentException(CommonErrorCode errorCode, String parameterName) {
    super(errorCode, parameterName);
    this.parameterName = parameterName;
  }

  public static InvalidCacheArgumentException emptyKey(String parameterName) {
    return new InvalidCacheArgumentException(CommonErrorCode.INVALID_CACHE_KEY, parameterName);
  }

  public static InvalidCacheArgumentException missingTags(String parameterName) {
    return new InvalidCacheArgumentException(
        CommonErrorCode.MISSING_TAG_COLLECTION, parameterName);
  }

  public static InvalidCacheArgumentException invalidSetting(String detail) {
    return new InvalidCacheArgumentException(CommonErrorCode.INVALID_CACHE_SETTING, detail);
  }
}
