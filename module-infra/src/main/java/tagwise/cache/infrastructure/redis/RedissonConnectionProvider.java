package tagwise.cache.infrastructure.redis;

import java.util.Objects;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import tagwise.cache.error.exception.CacheConnectivityException;

/**
 * RedissonClient 수명 관리
 *
 * <ul>
 *   <li><b>abortConnect=true</b> (기본): 생성 시점에 즉시 연결, 실패하면 {@link
 *       CacheConnectivityException}을 던져 구성 단계에서 실패
 *   <li><b>abortConnect=false</b>: 첫 사용 시점까지 연결을 미룸. 저장소가 내려가 있어도 엔진은 생성되고, 각 호출이 실패 채널로 보고됨
 * </ul>
 *
 * <p>외부에서 주입된 클라이언트({@link #wrap})는 소유하지 않으므로 {@link #close()}에서 종료하지 않습니다.
 */
@Slf4j
public class RedissonConnectionProvider implements AutoCloseable {

  private final Config config;
  private final Function<Config, RedissonClient> clientFactory;
  private final boolean adminAllowed;
  private final boolean owned;

  private volatile RedissonClient client;

  private RedissonConnectionProvider(
      Config config,
      Function<Config, RedissonClient> clientFactory,
      boolean adminAllowed,
      boolean owned,
      RedissonClient client) {
    this.config = config;
    this.clientFactory = clientFactory;
    this.adminAllowed = adminAllowed;
    this.owned = owned;
    this.client = client;
  }

  public static RedissonConnectionProvider connect(RedisConnectionOptions options) {
    return connect(options, Redisson::create);
  }

  /**
   * @param clientFactory Config → RedissonClient (테스트에서 교체 가능)
   */
  public static RedissonConnectionProvider connect(
      RedisConnectionOptions options, Function<Config, RedissonClient> clientFactory) {
    Objects.requireNonNull(options, "options");
    RedissonConnectionProvider provider =
        new RedissonConnectionProvider(
            options.toRedissonConfig(),
            Objects.requireNonNull(clientFactory, "clientFactory"),
            options.allowAdmin(),
            true,
            null);

    if (options.abortConnect()) {
      provider.client();
      log.info("[RedissonConnection] Connected: endpoints={}", options.endpoints());
    } else {
      log.info("[RedissonConnection] Deferred connection: endpoints={}", options.endpoints());
    }
    return provider;
  }

  /** 이미 생성된 클라이언트를 감싸기 (Spring 컨텍스트의 RedissonClient 재사용) */
  public static RedissonConnectionProvider wrap(RedissonClient client, boolean adminAllowed) {
    Objects.requireNonNull(client, "client");
    return new RedissonConnectionProvider(null, null, adminAllowed, false, client);
  }

  /**
   * 연결된 클라이언트 반환 (지연 연결 모드면 첫 호출에서 생성)
   *
   * @throws CacheConnectivityException 클라이언트 생성 실패 시. 다음 호출에서 다시 시도합니다.
   */
  public RedissonClient client() {
    RedissonClient current = client;
    if (current != null) {
      return current;
    }
    synchronized (this) {
      if (client == null) {
        client = createClient();
      }
      return client;
    }
  }

  public boolean isAdminAllowed() {
    return adminAllowed;
  }

  public boolean isConnected() {
    return client != null;
  }

  private RedissonClient createClient() {
    try {
      return clientFactory.apply(config);
    } catch (RuntimeException e) {
      throw new CacheConnectivityException("connect", e);
    }
  }

  @Override
  public void close() {
    RedissonClient current = client;
    if (owned && current != null && !current.isShutdown()) {
      current.shutdown();
      log.info("[RedissonConnection] Shutdown complete");
    }
  }
}
