package tagwise.cache.infrastructure.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * tagwise-cache 외부 설정 프로퍼티
 *
 * <pre>
 * tagwise:
 *   cache:
 *     enabled: true
 *     connection: localhost:6379,allowAdmin=true,abortConnect=false
 *     namespace: tagcache
 *     lock-wait-timeout: 5s
 *     lock-lease-time: 30s   # 생략 시 Redisson watchdog
 * </pre>
 *
 * <p>{@code @ConfigurationProperties} + {@code @Validated}로 타입 안전 바인딩
 */
@Validated
@ConfigurationProperties(prefix = "tagwise.cache")
public class TaggedCacheProperties {

  /** 자동 구성 활성화 여부 */
  private boolean enabled = true;

  /**
   * 연결 옵션 문자열 ({@code host:port[,host:port][,option=value...]})
   *
   * <p>컨텍스트에 RedissonClient가 이미 있으면 endpoint는 무시되고 allowAdmin만 적용됩니다.
   */
  @NotBlank private String connection = "localhost:6379";

  /** Redis 키 접두사 */
  @NotBlank private String namespace = "tagcache";

  /** 키 락 최대 대기 시간 (런타임에 TaggedCache#setLockWaitTimeout으로 변경 가능) */
  @NotNull private Duration lockWaitTimeout = Duration.ofSeconds(5);

  /** 락 임대 시간, null이면 watchdog 자동 연장 */
  private Duration lockLeaseTime;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getConnection() {
    return connection;
  }

  public void setConnection(String connection) {
    this.connection = connection;
  }

  public String getNamespace() {
    return namespace;
  }

  public void setNamespace(String namespace) {
    this.namespace = namespace;
  }

  public Duration getLockWaitTimeout() {
    return lockWaitTimeout;
  }

  public void setLockWaitTimeout(Duration lockWaitTimeout) {
    this.lockWaitTimeout = lockWaitTimeout;
  }

  public Duration getLockLeaseTime() {
    return lockLeaseTime;
  }

  public void setLockLeaseTime(Duration lockLeaseTime) {
    this.lockLeaseTime = lockLeaseTime;
  }
}
