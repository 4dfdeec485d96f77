package tagwise.cache.core.domain.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class CacheEntryTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00.123456789Z");

  @Test
  void createTruncatesLastAccessToMillis() {
    CacheEntry entry =
        CacheEntry.create("k", "\"v\"", List.of("ES1"), ExpirationPolicy.never(), NOW);

    assertThat(entry.lastAccess()).isEqualTo(Instant.parse("2026-01-01T00:00:00.123Z"));
  }

  @Test
  void createDropsDuplicateAndNullTags() {
    CacheEntry entry =
        CacheEntry.create(
            "k", "\"v\"", Arrays.asList("ES1", null, "ES1", "ES2"), ExpirationPolicy.never(), NOW);

    assertThat(entry.dependentTags()).containsExactlyInAnyOrder("ES1", "ES2");
  }

  @Test
  void touchRefreshesOnlyLastAccess() {
    ExpirationPolicy policy = ExpirationPolicy.of(Duration.ofSeconds(10), null);
    CacheEntry entry = CacheEntry.create("k", "\"v\"", List.of("ES1"), policy, NOW);

    CacheEntry touched = entry.touch(NOW.plusSeconds(5));

    assertThat(touched.lastAccess()).isAfter(entry.lastAccess());
    assertThat(touched.payload()).isEqualTo(entry.payload());
    assertThat(touched.dependentTags()).isEqualTo(entry.dependentTags());
    assertThat(touched.evaluate(NOW.plusSeconds(14))).isEqualTo(ExpirationVerdict.VALID);
    assertThat(entry.evaluate(NOW.plusSeconds(14))).isEqualTo(ExpirationVerdict.SLIDING_EXPIRED);
  }

  @Test
  void readExactlyOneWindowAfterPutIsStillValid() {
    ExpirationPolicy policy = ExpirationPolicy.of(Duration.ofSeconds(10), null);
    CacheEntry entry = CacheEntry.create("k", "\"v\"", List.of(), policy, NOW);

    assertThat(entry.evaluate(NOW.plusSeconds(10))).isEqualTo(ExpirationVerdict.VALID);
  }

  @Test
  void lockTokenReleasesOnce() {
    LockToken token = new LockToken("k", "tagcache:lock:k", 1L, NOW);

    assertThat(token.markReleased()).isTrue();
    assertThat(token.markReleased()).isFalse();
    assertThat(token.isReleased()).isTrue();
  }
}
