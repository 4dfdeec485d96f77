package tagwise.cache.infrastructure.executor.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.redisson.RedissonShutdownException;
import org.redisson.client.RedisConnectionException;
import org.redisson.client.RedisTimeoutException;
import tagwise.cache.error.exception.CacheConnectivityException;
import tagwise.cache.error.exception.CacheStoreException;
import tagwise.cache.error.exception.DistributedLockException;
import tagwise.cache.error.exception.InternalSystemException;
import tagwise.cache.error.exception.base.BaseException;

/**
 * 예외 변환 전략
 *
 * <p>외부 라이브러리(Redisson, Jackson) 예외를 프로젝트 예외 계층으로 번역합니다. 모든 변환기는 다음 순서를 따릅니다.
 *
 * <ol>
 *   <li>{@link Error}: 절대 변환하지 않고 그대로 throw
 *   <li>{@link BaseException}: 그대로 전파
 *   <li>도메인별 매핑
 *   <li>나머지: 규격화 (cause 보존)
 * </ol>
 */
@FunctionalInterface
public interface ExceptionTranslator {

  RuntimeException translate(Throwable e);

  /**
   * Redis(Redisson) 예외 변환기
   *
   * <ul>
   *   <li>연결 실패, 응답 타임아웃, 클라이언트 종료 → {@link CacheConnectivityException}
   *   <li>기타 → {@link CacheStoreException}
   * </ul>
   *
   * @param detail 실패한 작업 설명 (로그/메시지용)
   */
  static ExceptionTranslator forRedis(String detail) {
    return e -> {
      if (e instanceof Error error) {
        throw error;
      }
      if (e instanceof BaseException baseException) {
        return baseException;
      }
      if (isConnectivityFailure(e)) {
        return new CacheConnectivityException(detail, e);
      }
      return new CacheStoreException(detail, e);
    };
  }

  /**
   * Lock 예외 변환기
   *
   * <ul>
   *   <li>{@link InterruptedException} → {@link DistributedLockException} (인터럽트 플래그 복원)
   *   <li>나머지 → {@link #forRedis(String)} 규칙
   * </ul>
   */
  static ExceptionTranslator forLock(String lockKey) {
    ExceptionTranslator redis = forRedis("lock " + lockKey);
    return e -> {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
        return new DistributedLockException(lockKey, e);
      }
      return redis.translate(e);
    };
  }

  /** JSON 직렬화 예외 변환기: {@link JsonProcessingException} → {@link CacheStoreException} */
  static ExceptionTranslator forJson() {
    return e -> {
      if (e instanceof Error error) {
        throw error;
      }
      if (e instanceof BaseException baseException) {
        return baseException;
      }
      if (e instanceof JsonProcessingException) {
        return new CacheStoreException("payload serialization: " + e.getMessage(), e);
      }
      return new InternalSystemException("json-processing", e);
    };
  }

  /** cause chain 중 하나라도 연결성 장애면 true (Redisson은 CompletionException 등으로 감싸기도 함) */
  static boolean isConnectivityFailure(Throwable e) {
    Throwable current = e;
    for (int depth = 0; current != null && depth < 10; depth++) {
      if (current instanceof RedisConnectionException
          || current instanceof RedisTimeoutException
          || current instanceof RedissonShutdownException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
