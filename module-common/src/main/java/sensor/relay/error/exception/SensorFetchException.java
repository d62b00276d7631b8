package sensor.relay.error.exception;

import lombok.Getter;
import sensor.relay.error.CommonErrorCode;
import sensor.relay.error.exception.base.ServerBaseException;

@Getter
public class SensorFetchException extends ServerBaseException {

  private final FetchFailure failure;

  public SensorFetchException(FetchFailure failure, String detail) {
    super(codeFor(failure), detail);
    this.failure = failure;
  }

  public SensorFetchException(FetchFailure failure, String detail, Throwable cause) {
    super(codeFor(failure), cause, detail);
    this.failure = failure;
  }

  private static CommonErrorCode codeFor(FetchFailure failure) {
    return failure == FetchFailure.DECODE
        ? CommonErrorCode.SENSOR_FEED_MALFORMED
        : CommonErrorCode.SENSOR_FEED_UNREACHABLE;
  }
}
