package sensor.relay.error.exception.base;

import sensor.relay.error.ErrorCode;

/**
 * Failure of the relay itself or of a system it talks to (5xx family). Logged with the cause for
 * later analysis, never shown verbatim to users.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
