package sensor.relay.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_COMMAND("C001", "%s", HttpStatus.BAD_REQUEST),
  UNKNOWN_COMMAND("C002", "Unknown command: %s", HttpStatus.NOT_FOUND),
  INVALID_THRESHOLD_VALUE(
      "C003", "Threshold value must be a finite number, got: %s", HttpStatus.BAD_REQUEST),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "Internal error while running task (%s)", HttpStatus.INTERNAL_SERVER_ERROR),
  MISSING_CREDENTIAL(
      "S002", "Required credential is not configured (%s)", HttpStatus.INTERNAL_SERVER_ERROR),

  // === Sensor Feed (F) ===
  SENSOR_FEED_UNREACHABLE("F001", "Sensor feed unreachable (%s)", HttpStatus.SERVICE_UNAVAILABLE),
  SENSOR_FEED_MALFORMED("F002", "Sensor feed returned malformed data (%s)", HttpStatus.BAD_GATEWAY),

  // === Notification (N) ===
  NOTIFICATION_DELIVERY_FAILED(
      "N001", "Notification delivery failed (chat: %s, reason: %s)", HttpStatus.BAD_GATEWAY);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
