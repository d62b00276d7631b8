package sensor.relay.error.exception.base;

import sensor.relay.error.ErrorCode;

/**
 * Failure caused by what the user sent (4xx family). The message is meant to be shown back to the
 * user as-is.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
