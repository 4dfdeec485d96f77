package tagwise.cache.core.domain.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ExpirationPolicy 평가 규칙")
class ExpirationPolicyTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  @Nested
  @DisplayName("절대 만료")
  class Absolute {

    @Test
    @DisplayName("만료 시각과 같으면 만료 (경계 포함)")
    void expiresAtBoundary() {
      ExpirationPolicy policy = ExpirationPolicy.of(null, NOW);

      assertThat(policy.evaluate(NOW, NOW)).isEqualTo(ExpirationVerdict.ABSOLUTE_EXPIRED);
      assertThat(policy.evaluate(NOW, NOW.minusMillis(1))).isEqualTo(ExpirationVerdict.VALID);
    }

    @Test
    @DisplayName("절대 만료 시각은 밀리초로 절삭되어 저장된 값과 같게 비교")
    void absoluteExpirationIsComparedAtMillisecondPrecision() {
      ExpirationPolicy policy = ExpirationPolicy.of(null, NOW.plusNanos(500_000));

      assertThat(policy.absoluteExpiration()).isEqualTo(NOW);
      assertThat(policy.evaluate(NOW, NOW.plusNanos(100)))
          .isEqualTo(ExpirationVerdict.ABSOLUTE_EXPIRED);
      assertThat(policy.evaluate(NOW, NOW.minusNanos(1))).isEqualTo(ExpirationVerdict.VALID);
    }

    @Test
    @DisplayName("절대 만료는 슬라이딩 설정과 무관하게 우선한다")
    void absoluteWinsOverSliding() {
      ExpirationPolicy policy = ExpirationPolicy.of(Duration.ofHours(1), NOW.minusSeconds(600));

      assertThat(policy.evaluate(NOW, NOW)).isEqualTo(ExpirationVerdict.ABSOLUTE_EXPIRED);
    }

    @Test
    @DisplayName("표현 불가능한 먼 미래는 '만료 없음'으로 정규화")
    void farFutureMeansNever() {
      ExpirationPolicy policy = ExpirationPolicy.of(null, Instant.MAX);

      assertThat(policy.hasAbsoluteExpiration()).isFalse();
      assertThat(policy.evaluate(NOW, NOW)).isEqualTo(ExpirationVerdict.VALID);
    }

    @Test
    void beforeEpochIsClampedAndExpired() {
      ExpirationPolicy policy = ExpirationPolicy.of(null, Instant.MIN);

      assertThat(policy.absoluteExpiration()).isEqualTo(Instant.EPOCH);
      assertThat(policy.isAbsolutelyExpired(NOW)).isTrue();
    }
  }

  @Nested
  @DisplayName("슬라이딩 만료")
  class Sliding {

    private final ExpirationPolicy tenSeconds = ExpirationPolicy.of(Duration.ofSeconds(10), null);

    @Test
    @DisplayName("유휴 시간이 창과 같으면 아직 유효")
    void idleEqualToWindowIsValid() {
      assertThat(tenSeconds.evaluate(NOW, NOW.plusSeconds(10))).isEqualTo(ExpirationVerdict.VALID);
    }

    @Test
    @DisplayName("밀리초 미만 차이로 창 경계를 넘지 않는다 (저장 정밀도와 동일하게 비교)")
    void subMillisecondNowAtBoundaryIsValid() {
      Instant lastAccess = Instant.parse("2026-01-01T00:00:00.123Z");

      assertThat(tenSeconds.evaluate(lastAccess, lastAccess.plusSeconds(10).plusNanos(999_999)))
          .isEqualTo(ExpirationVerdict.VALID);
    }

    @Test
    @DisplayName("유휴 시간이 창을 넘으면 만료")
    void idleBeyondWindowExpires() {
      assertThat(tenSeconds.evaluate(NOW, NOW.plusSeconds(10).plusMillis(1)))
          .isEqualTo(ExpirationVerdict.SLIDING_EXPIRED);
    }

    @Test
    @DisplayName("음수 창은 즉시 만료")
    void negativeWindowIsAlreadyLapsed() {
      ExpirationPolicy policy = ExpirationPolicy.of(Duration.ofMillis(-1), null);

      assertThat(policy.evaluate(NOW, NOW)).isEqualTo(ExpirationVerdict.SLIDING_EXPIRED);
    }

    @Test
    void hugeWindowMeansNone() {
      ExpirationPolicy policy = ExpirationPolicy.of(Duration.ofSeconds(Long.MAX_VALUE), null);

      assertThat(policy.hasSlidingExpiration()).isFalse();
    }

    @Test
    @DisplayName("purge 판단은 슬라이딩 만료를 보지 않는다")
    void absoluteCheckIgnoresIdleTime() {
      assertThat(tenSeconds.isAbsolutelyExpired(NOW.plusSeconds(3600))).isFalse();
    }
  }
}
