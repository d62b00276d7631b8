package sensor.relay.error.exception;

import sensor.relay.error.CommonErrorCode;
import sensor.relay.error.ErrorCode;
import sensor.relay.error.exception.base.ClientBaseException;

public class InvalidCommandException extends ClientBaseException {

  public InvalidCommandException(String message) {
    super(CommonErrorCode.INVALID_COMMAND, message);
  }

  public InvalidCommandException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public static InvalidCommandException unknownCommand(String command) {
    return new InvalidCommandException(CommonErrorCode.UNKNOWN_COMMAND, command);
  }

  public static InvalidCommandException invalidValue(String raw) {
    return new InvalidCommandException(CommonErrorCode.INVALID_THRESHOLD_VALUE, raw);
  }
}
