package tagwise.cache.error;

public interface ErrorCode {
  String getCode();

  String getMessage();
}
