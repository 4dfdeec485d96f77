package tagwise.cache.infrastructure.executor;

import java.util.function.Function;
import tagwise.cache.common.function.ThrowingRunnable;
import tagwise.cache.common.function.ThrowingSupplier;
import tagwise.cache.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * try-catch 없이 예외 처리/메트릭/로깅을 일관되게 적용하는 실행 템플릿
 *
 * <ul>
 *   <li><b>Error 즉시 전파</b>: VirtualMachineError 등은 어떤 메서드에서도 흡수하지 않음
 *   <li><b>BaseException 통과</b>: 프로젝트 예외 계층은 그대로 전파
 *   <li><b>기타 예외 규격화</b>: translator가 없으면 InternalSystemException으로 래핑
 * </ul>
 */
public interface LogicExecutor {

  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /**
   * 실패 시 복구 함수 실행
   *
   * @param recovery 번역된 예외를 받아 대체 결과를 만드는 함수
   */
  <T> T executeWithRecovery(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  void executeVoid(ThrowingRunnable task, TaskContext context);

  /** finallyBlock은 성공/실패와 무관하게 정확히 1회 실행 */
  <T> T executeWithFinally(ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context);

  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
