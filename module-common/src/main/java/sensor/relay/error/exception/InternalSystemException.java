package sensor.relay.error.exception;

import sensor.relay.error.CommonErrorCode;
import sensor.relay.error.exception.base.ServerBaseException;

/**
 * Wraps an unmanaged exception that escaped a task run by the execution template.
 *
 * <p>The task name ({@code component:operation:value}) tells where it came from.
 */
public class InternalSystemException extends ServerBaseException {

  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, cause, taskName);
  }

  public InternalSystemException(String taskName) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, taskName);
  }
}
