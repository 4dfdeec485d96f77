package tagwise.cache.infrastructure.executor;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tagwise.cache.common.function.ThrowingRunnable;
import tagwise.cache.common.function.ThrowingSupplier;
import tagwise.cache.error.exception.InternalSystemException;
import tagwise.cache.error.exception.base.BaseException;
import tagwise.cache.error.exception.base.ClientBaseException;
import tagwise.cache.error.exception.base.ServerBaseException;
import tagwise.cache.infrastructure.executor.strategy.ExceptionTranslator;

@Slf4j
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  private final MeterRegistry meterRegistry;

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return executeWithMetrics(task, context, null);
  }

  @Override
  public <T> T executeWithRecovery(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    try {
      return executeWithMetrics(task, context, null);
    } catch (RuntimeException e) {
      log.debug("[{}] 예외 발생, 복구 로직 실행: {}", context.toTaskName(), e.getMessage());
      return recovery.apply(e);
    }
  }

  @Override
  public void executeVoid(ThrowingRunnable task, TaskContext context) {
    execute(
        () -> {
          task.run();
          return null;
        },
        context);
  }

  @Override
  public <T> T executeWithFinally(
      ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context) {
    try {
      return executeWithMetrics(task, context, null);
    } finally {
      finallyBlock.run();
    }
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context) {
    return executeWithMetrics(task, context, translator);
  }

  private <T> T executeWithMetrics(
      ThrowingSupplier<T> task, TaskContext context, ExceptionTranslator translator) {
    Timer.Sample sample = Timer.start(meterRegistry);

    try {
      T result = task.get();
      recordSuccess(sample, context);
      return result;

    } catch (Throwable t) {
      // Error는 절대 캐치하지 않고 상위로 즉시 전파
      if (t instanceof Error error) {
        throw error;
      }
      if (t instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }

      RuntimeException translated = translateException(t, context, translator);
      recordFailure(sample, context, translated);
      logFailure(context, translated);
      throw translated;
    }
  }

  private void recordSuccess(Timer.Sample sample, TaskContext context) {
    sample.stop(
        Timer.builder("logic.executor")
            .tag("component", context.component())
            .tag("operation", context.operation())
            .tag("result", "success")
            .register(meterRegistry));
  }

  private void recordFailure(Timer.Sample sample, TaskContext context, Exception e) {
    sample.stop(
        Timer.builder("logic.executor")
            .tag("component", context.component())
            .tag("operation", context.operation())
            .tag("result", "failure")
            .tag("exception", e.getClass().getSimpleName())
            .register(meterRegistry));
  }

  /** 호출자 실수는 조용히, 인프라 장애는 warn, 관리되지 않은 예외만 error */
  private void logFailure(TaskContext context, RuntimeException e) {
    if (e instanceof ClientBaseException) {
      return;
    }
    if (e instanceof ServerBaseException && !(e instanceof InternalSystemException)) {
      log.warn("[{}] {}", context.toTaskName(), e.getMessage());
      return;
    }
    log.error("[{}] 실행 중 예외 발생", context.toTaskName(), e);
  }

  private RuntimeException translateException(
      Throwable e, TaskContext context, ExceptionTranslator translator) {
    if (translator != null) {
      return translator.translate(e);
    }
    // 프로젝트 예외 계층(BaseException)은 그대로 전파
    if (e instanceof BaseException baseException) {
      return baseException;
    }
    // 관리되지 않은 모든 예외는 InternalSystemException으로 규격화
    return new InternalSystemException(context.toTaskName(), e);
  }
}
