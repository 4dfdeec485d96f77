package tagwise.cache.infrastructure.cache.failure;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import tagwise.cache.core.failure.CachingFailureListener;
import tagwise.cache.core.failure.Subscription;
import tagwise.cache.error.exception.CachingFailedException;

/**
 * 흡수된 캐시 장애를 구독자에게 전달하는 동기 채널
 *
 * <p>발행은 실패한 호출의 스레드에서 순서대로 실행됩니다. 구독/해지는 발행 중에도 안전합니다 (CopyOnWriteArrayList).
 * 리스너가 던진 예외는 다른 리스너나 캐시 호출 결과에 영향을 주지 않습니다.
 */
@Slf4j
public class CachingFailureChannel {

  private final List<CachingFailureListener> listeners = new CopyOnWriteArrayList<>();

  public Subscription subscribe(CachingFailureListener listener) {
    Objects.requireNonNull(listener, "listener");
    listeners.add(listener);
    AtomicBoolean active = new AtomicBoolean(true);
    return () -> {
      if (active.compareAndSet(true, false)) {
        listeners.remove(listener);
      }
    };
  }

  public void publish(CachingFailedException failure) {
    log.debug("[CachingFailure] {} → {} listener(s)", failure.getMessage(), listeners.size());

    for (CachingFailureListener listener : listeners) {
      deliver(listener, failure);
    }
  }

  public int listenerCount() {
    return listeners.size();
  }

  private void deliver(CachingFailureListener listener, CachingFailedException failure) {
    try {
      listener.onCachingFailed(failure);
    } catch (RuntimeException e) {
      log.error("[CachingFailure] Listener threw while handling '{}'", failure.getMessage(), e);
    }
  }
}
