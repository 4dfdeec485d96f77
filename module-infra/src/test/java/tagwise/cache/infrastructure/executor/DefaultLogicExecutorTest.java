package tagwise.cache.infrastructure.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tagwise.cache.error.exception.CacheConnectivityException;
import tagwise.cache.error.exception.CacheStoreException;
import tagwise.cache.error.exception.InternalSystemException;
import tagwise.cache.error.exception.InvalidCacheArgumentException;

/**
 * Unit tests for {@link DefaultLogicExecutor}.
 *
 * <ul>
 *   <li>BaseException passthrough, InternalSystemException wrapping
 *   <li>Error is never absorbed, not even by executeWithRecovery
 *   <li>logic.executor timer tagged by component / operation / result
 * </ul>
 */
@DisplayName("DefaultLogicExecutor Tests")
class DefaultLogicExecutorTest {

  private SimpleMeterRegistry meterRegistry;
  private LogicExecutor executor;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    executor = new DefaultLogicExecutor(meterRegistry);
  }

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  @DisplayName("execute() returns the task result and records a success timer")
  void executeRecordsSuccess() {
    String result = executor.execute(() -> "ok", TaskContext.of("Test", "success"));

    assertThat(result).isEqualTo("ok");
    Timer timer =
        meterRegistry
            .find("logic.executor")
            .tags("component", "Test", "operation", "success", "result", "success")
            .timer();
    assertThat(timer).isNotNull();
    assertThat(timer.count()).isEqualTo(1);
  }

  @Test
  @DisplayName("project exceptions pass through untouched")
  void baseExceptionPassesThrough() {
    CacheConnectivityException original = new CacheConnectivityException("localhost:6379");

    assertThatThrownBy(
            () ->
                executor.execute(
                    () -> {
                      throw original;
                    },
                    TaskContext.of("Test", "passthrough")))
        .isSameAs(original);
  }

  @Test
  @DisplayName("unmanaged checked exceptions become InternalSystemException with the task name")
  void checkedExceptionIsWrapped() {
    assertThatThrownBy(
            () ->
                executor.execute(
                    () -> {
                      throw new IOException("disk");
                    },
                    TaskContext.of("Test", "wrap", "key-1")))
        .isInstanceOf(InternalSystemException.class)
        .hasMessageContaining("Test:wrap:key-1")
        .hasCauseInstanceOf(IOException.class);

    assertThat(
            meterRegistry
                .find("logic.executor")
                .tags("result", "failure", "exception", "InternalSystemException")
                .timer())
        .isNotNull();
  }

  @Test
  @DisplayName("Error is rethrown as-is by every variant")
  void errorIsNeverAbsorbed() {
    StackOverflowError error = new StackOverflowError("deep");
    TaskContext context = TaskContext.of("Test", "error");

    assertThatThrownBy(
            () ->
                executor.executeWithRecovery(
                    () -> {
                      throw error;
                    },
                    e -> "recovered",
                    context))
        .isSameAs(error);
    assertThatThrownBy(
            () ->
                executor.executeVoid(
                    () -> {
                      throw error;
                    },
                    context))
        .isSameAs(error);
  }

  @Test
  @DisplayName("executeWithRecovery() hands the translated exception to the recovery function")
  void recoveryReceivesTranslatedException() {
    String result =
        executor.executeWithRecovery(
            () -> {
              throw new IllegalStateException("boom");
            },
            e -> e.getClass().getSimpleName(),
            TaskContext.of("Test", "recovery"));

    assertThat(result).isEqualTo("InternalSystemException");
  }

  @Test
  @DisplayName("executeVoid() propagates BaseException unchanged")
  void executeVoidPropagatesBaseException() {
    InvalidCacheArgumentException invalid = InvalidCacheArgumentException.emptyKey("key");

    assertThatThrownBy(
            () ->
                executor.executeVoid(
                    () -> {
                      throw invalid;
                    },
                    TaskContext.of("Test", "void")))
        .isSameAs(invalid);
  }

  @Test
  @DisplayName("executeWithFinally() runs the finally block exactly once on both paths")
  void finallyRunsOnce() {
    AtomicInteger counter = new AtomicInteger();

    executor.executeWithFinally(() -> "ok", counter::incrementAndGet, TaskContext.of("T", "a"));
    assertThatThrownBy(
            () ->
                executor.executeWithFinally(
                    () -> {
                      throw new IllegalStateException();
                    },
                    counter::incrementAndGet,
                    TaskContext.of("T", "b")))
        .isInstanceOf(InternalSystemException.class);

    assertThat(counter).hasValue(2);
  }

  @Test
  @DisplayName("executeWithTranslation() uses the given translator")
  void translatorIsApplied() {
    assertThatThrownBy(
            () ->
                executor.executeWithTranslation(
                    () -> {
                      throw new IllegalStateException("protocol");
                    },
                    e -> new CacheStoreException("store", e),
                    TaskContext.of("Test", "translate")))
        .isInstanceOf(CacheStoreException.class)
        .hasCauseInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("InterruptedException restores the interrupt flag")
  void interruptFlagIsRestored() {
    assertThatThrownBy(
            () ->
                executor.execute(
                    () -> {
                      throw new InterruptedException();
                    },
                    TaskContext.of("Test", "interrupt")))
        .isInstanceOf(InternalSystemException.class);

    assertThat(Thread.currentThread().isInterrupted()).isTrue();
  }
}
