package tagwise.cache.infrastructure.cache.failure;

import java.time.Instant;
import tagwise.cache.error.exception.CachingFailedException;

/**
 * Spring {@code ApplicationEventPublisher}로 재발행되는 캐시 장애 이벤트
 *
 * @param operation 실패한 캐시 작업 (putItem, getItem, ...)
 * @param failure 원본 래퍼 예외 (cause에 실제 원인)
 * @param occurredAt 발행 시각
 */
public record CachingFailedEvent(
    String operation, CachingFailedException failure, Instant occurredAt) {

  public static CachingFailedEvent of(CachingFailedException failure) {
    return new CachingFailedEvent(failure.getOperation(), failure, Instant.now());
  }
}
