package tagwise.cache.core.failure;

/** Handle returned by a listener registration. */
@FunctionalInterface
public interface Subscription {

  /** Stop delivering failures to the listener. Idempotent. */
  void unsubscribe();
}
