package tagwise.cache.infrastructure.redis;

import tagwise.cache.error.exception.InvalidCacheArgumentException;

/**
 * 네임스페이스 단위 Redis 키 규칙
 *
 * <pre>
 * {ns}:entry:{key}  (HASH)  payload / absoluteExpiration / slidingExpiration / lastAccess / tags
 * {ns}:tag:{tag}    (SET)   태그를 선언한 엔트리 키 목록
 * {ns}:lock:{key}   (LOCK)  Redisson RLock, 보유 중에만 존재
 * </pre>
 *
 * <p>스캔 패턴은 네임스페이스의 glob 특수문자({@code * ? [ ] \})를 이스케이프합니다.
 *
 * @param namespace 키 접두사 (기본: {@value #DEFAULT_NAMESPACE})
 */
public record RedisKeyspace(String namespace) {

  public static final String DEFAULT_NAMESPACE = "tagcache";

  private static final String ENTRY_SEGMENT = ":entry:";
  private static final String TAG_SEGMENT = ":tag:";
  private static final String LOCK_SEGMENT = ":lock:";

  public RedisKeyspace {
    if (namespace == null || namespace.isBlank()) {
      throw InvalidCacheArgumentException.invalidSetting("namespace must not be blank");
    }
  }

  public static RedisKeyspace defaults() {
    return new RedisKeyspace(DEFAULT_NAMESPACE);
  }

  public String entryKey(String key) {
    return namespace + ENTRY_SEGMENT + key;
  }

  public String tagKey(String tag) {
    return namespace + TAG_SEGMENT + tag;
  }

  public String lockKey(String key) {
    return namespace + LOCK_SEGMENT + key;
  }

  public String entryPattern() {
    return escapeGlob(namespace) + ENTRY_SEGMENT + "*";
  }

  public String tagPattern() {
    return escapeGlob(namespace) + TAG_SEGMENT + "*";
  }

  /** {@code {ns}:entry:{key}} → {@code key} */
  public String keyOf(String entryKey) {
    return entryKey.substring(namespace.length() + ENTRY_SEGMENT.length());
  }

  /** {@code {ns}:tag:{tag}} → {@code tag} */
  public String tagOf(String tagKey) {
    return tagKey.substring(namespace.length() + TAG_SEGMENT.length());
  }

  static String escapeGlob(String value) {
    StringBuilder escaped = new StringBuilder(value.length());
    for (char c : value.toCharArray()) {
      if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
        escaped.append('\\');
      }
      escaped.append(c);
    }
    return escaped.toString();
  }
}
