package sensor.relay.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import sensor.relay.error.exception.FetchFailure;
import sensor.relay.error.exception.InternalSystemException;
import sensor.relay.error.exception.InvalidCommandException;
import sensor.relay.error.exception.NotificationDeliveryException;
import sensor.relay.error.exception.SensorFetchException;

class CommonErrorCodeTest {

  @Test
  @DisplayName("every code is unique")
  void codesAreUnique() {
    long distinct =
        Arrays.stream(CommonErrorCode.values()).map(CommonErrorCode::getCode).distinct().count();

    assertThat(distinct).isEqualTo(CommonErrorCode.values().length);
  }

  @Test
  @DisplayName("client codes are 4xx, server codes are 5xx")
  void statusFamilyMatchesPrefix() {
    for (CommonErrorCode code : CommonErrorCode.values()) {
      if (code.getCode().startsWith("C")) {
        assertThat(code.getStatus().is4xxClientError()).as(code.name()).isTrue();
      } else {
        assertThat(code.getStatus().is5xxServerError()).as(code.name()).isTrue();
      }
    }
  }

  @Test
  void sensorFetchException_mapsFailureKindToCode() {
    SensorFetchException transport =
        new SensorFetchException(FetchFailure.TRANSPORT, "connection refused");
    SensorFetchException decode = new SensorFetchException(FetchFailure.DECODE, "not an array");

    assertThat(transport.getErrorCode()).isEqualTo(CommonErrorCode.SENSOR_FEED_UNREACHABLE);
    assertThat(transport.getMessage()).isEqualTo("Sensor feed unreachable (connection refused)");
    assertThat(decode.getErrorCode()).isEqualTo(CommonErrorCode.SENSOR_FEED_MALFORMED);
    assertThat(decode.getFailure()).isEqualTo(FetchFailure.DECODE);
    assertThat(decode.getErrorCode().getStatus()).isEqualTo(HttpStatus.BAD_GATEWAY);
  }

  @Test
  void invalidCommandException_keepsUserFacingMessage() {
    assertThat(new InvalidCommandException("Usage: /set <sensor> <metric> <min|max> <value>"))
        .hasMessage("Usage: /set <sensor> <metric> <min|max> <value>");
    assertThat(InvalidCommandException.unknownCommand("/foo")).hasMessage("Unknown command: /foo");
    assertThat(InvalidCommandException.invalidValue("abc"))
        .hasMessage("Threshold value must be a finite number, got: abc");
  }

  @Test
  void causeIsPreserved() {
    IllegalStateException cause = new IllegalStateException("boom");

    assertThat(new InternalSystemException("Evaluator:tick", cause))
        .hasCause(cause)
        .hasMessage("Internal error while running task (Evaluator:tick)");
    assertThat(new NotificationDeliveryException(42L, "Forbidden", cause))
        .hasCause(cause)
        .hasMessageContaining("chat: 42");
  }
}
