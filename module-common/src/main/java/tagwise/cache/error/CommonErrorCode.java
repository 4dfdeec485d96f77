package tagwise.cache.error;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (argument validation) ===
  INVALID_CACHE_KEY("C001", "캐시 키가 비어 있습니다 (parameter: %s)"),
  MISSING_TAG_COLLECTION("C002", "태그 컬렉션이 지정되지 않았습니다 (parameter: %s)"),
  INVALID_CACHE_SETTING("C003", "잘못된 캐시 설정값입니다: %s"),

  // === Server Errors (absorbed, reported on the failure channel) ===
  STORE_CONNECTION_FAILURE("S001", "캐시 저장소 연결 실패 (%s)"),
  LOCK_ACQUISITION_TIMEOUT("S002", "락 획득 타임아웃 (%s)"),
  STORE_OPERATION_FAILURE("S003", "캐시 저장소 작업 실패 (%s)"),
  PRIVILEGED_OPERATION_DENIED("S004", "관리자 권한이 필요한 작업입니다 (%s)"),
  CACHING_FAILED("S005", "Caching failed for %s"),
  INTERNAL_SERVER_ERROR("S006", "내부 오류가 발생했습니다 (%s)");

  private final String code;
  private final String message;
}
