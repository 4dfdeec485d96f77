package tagwise.cache.infrastructure.redis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.redisson.config.BaseConfig;
import org.redisson.config.Config;
import tagwise.cache.error.exception.InvalidCacheArgumentException;

/**
 * 연결 옵션 문자열 파싱 결과
 *
 * <p>형식: {@code host:port[,host:port...][,option=value...]}
 *
 * <pre>
 * localhost:6379
 * redis-1:6379,redis-2:6379,password=secret,ssl=true
 * sentinel-1:26379,serviceName=mymaster,allowAdmin=true,abortConnect=false
 * </pre>
 *
 * <p>지원 옵션 (대소문자 무시): password, ssl, allowAdmin, abortConnect, connectTimeout(ms),
 * syncTimeout(ms), connectRetry, defaultDatabase, name, serviceName. 알 수 없는 옵션은 거부합니다.
 *
 * <ul>
 *   <li>endpoint 1개 → Redisson single server
 *   <li>endpoint 여러 개 → replicated servers (master 자동 탐지)
 *   <li>serviceName 지정 → sentinel (endpoint = sentinel 주소)
 * </ul>
 */
public record RedisConnectionOptions(
    List<String> endpoints,
    String password,
    boolean ssl,
    boolean allowAdmin,
    boolean abortConnect,
    int connectTimeoutMillis,
    int syncTimeoutMillis,
    int connectRetry,
    int defaultDatabase,
    String clientName,
    String serviceName) {

  public static final int DEFAULT_PORT = 6379;
  static final int DEFAULT_TIMEOUT_MILLIS = 5000;
  static final int DEFAULT_CONNECT_RETRY = 3;

  public RedisConnectionOptions {
    endpoints = List.copyOf(endpoints);
  }

  public static RedisConnectionOptions parse(String configuration) {
    if (configuration == null || configuration.isBlank()) {
      throw InvalidCacheArgumentException.invalidSetting("connection configuration is empty");
    }

    List<String> endpoints = new ArrayList<>();
    String password = null;
    boolean ssl = false;
    boolean allowAdmin = false;
    boolean abortConnect = true;
    int connectTimeout = DEFAULT_TIMEOUT_MILLIS;
    int syncTimeout = DEFAULT_TIMEOUT_MILLIS;
    int connectRetry = DEFAULT_CONNECT_RETRY;
    int database = 0;
    String clientName = null;
    String serviceName = null;

    for (String rawToken : configuration.split(",")) {
      String token = rawToken.trim();
      if (token.isEmpty()) {
        continue;
      }
      int eq = token.indexOf('=');
      if (eq < 0) {
        endpoints.add(normalizeEndpoint(token));
        continue;
      }

      String option = token.substring(0, eq).trim().toLowerCase(Locale.ROOT);
      String value = token.substring(eq + 1).trim();
      switch (option) {
        case "password" -> password = value;
        case "ssl" -> ssl = parseBoolean(option, value);
        case "allowadmin" -> allowAdmin = parseBoolean(option, value);
        case "abortconnect" -> abortConnect = parseBoolean(option, value);
        case "connecttimeout" -> connectTimeout = parseNonNegativeInt(option, value);
        case "synctimeout" -> syncTimeout = parseNonNegativeInt(option, value);
        case "connectretry" -> connectRetry = parseNonNegativeInt(option, value);
        case "defaultdatabase" -> database = parseNonNegativeInt(option, value);
        case "name" -> clientName = value;
        case "servicename" -> serviceName = value;
        default -> throw InvalidCacheArgumentException.invalidSetting(
            "unsupported connection option '" + option + "'");
      }
    }

    if (endpoints.isEmpty()) {
      throw InvalidCacheArgumentException.invalidSetting("no endpoint in connection configuration");
    }

    return new RedisConnectionOptions(
        endpoints,
        password,
        ssl,
        allowAdmin,
        abortConnect,
        connectTimeout,
        syncTimeout,
        connectRetry,
        database,
        clientName,
        serviceName);
  }

  public boolean isSentinel() {
    return serviceName != null && !serviceName.isEmpty();
  }

  /** Redisson 주소 형식 ({@code redis://host:port}, ssl이면 {@code rediss://}) */
  public List<String> addresses() {
    String scheme = ssl ? "rediss://" : "redis://";
    return endpoints.stream().map(endpoint -> scheme + endpoint).toList();
  }

  /** Redisson {@link Config}로 변환 */
  public Config toRedissonConfig() {
    Config config = new Config();
    String[] addresses = addresses().toArray(String[]::new);

    if (isSentinel()) {
      applyCommon(
          config
              .useSentinelServers()
              .setMasterName(serviceName)
              .addSentinelAddress(addresses)
              .setDatabase(defaultDatabase)
              .setCheckSentinelsList(false));
    } else if (addresses.length == 1) {
      applyCommon(
          config.useSingleServer().setAddress(addresses[0]).setDatabase(defaultDatabase));
    } else {
      applyCommon(
          config.useReplicatedServers().addNodeAddress(addresses).setDatabase(defaultDatabase));
    }
    return config;
  }

  private <T extends BaseConfig<T>> void applyCommon(T serverConfig) {
    serverConfig
        .setConnectTimeout(connectTimeoutMillis)
        .setTimeout(syncTimeoutMillis)
        .setRetryAttempts(connectRetry);
    if (password != null && !password.isEmpty()) {
      serverConfig.setPassword(password);
    }
    if (clientName != null && !clientName.isEmpty()) {
      serverConfig.setClientName(clientName);
    }
  }

  private static String normalizeEndpoint(String endpoint) {
    int colon = endpoint.lastIndexOf(':');
    if (colon < 0) {
      return endpoint + ":" + DEFAULT_PORT;
    }
    parseNonNegativeInt("port", endpoint.substring(colon + 1));
    return endpoint;
  }

  private static boolean parseBoolean(String option, String value) {
    if ("true".equalsIgnoreCase(value)) {
      return true;
    }
    if ("false".equalsIgnoreCase(value)) {
      return false;
    }
    throw InvalidCacheArgumentException.invalidSetting(
        option + " expects true or false but was '" + value + "'");
  }

  private static int parseNonNegativeInt(String option, String value) {
    try {
      int parsed = Integer.parseInt(value);
      if (parsed < 0) {
        throw InvalidCacheArgumentException.invalidSetting(option + " must not be negative");
      }
      return parsed;
    } catch (NumberFormatException e) {
      throw InvalidCacheArgumentException.invalidSetting(
          option + " expects a number but was '" + value + "'");
    }
  }
}
