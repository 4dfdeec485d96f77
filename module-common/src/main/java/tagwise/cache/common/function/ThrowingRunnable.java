package tagwise.cache.common.function;

@FunctionalInterface
public interface ThrowingRunnable {
  void run() throws Throwable;
}
