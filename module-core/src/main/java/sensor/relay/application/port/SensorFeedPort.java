package sensor.relay.application.port;

import java.util.List;
import sensor.relay.domain.model.Reading;

/**
 * Source of current sensor readings.
 *
 * <p>One call is one request. Implementations do not retry; a failure surfaces as {@link
 * sensor.relay.error.exception.SensorFetchException} carrying a transport or decode kind.
 */
public interface SensorFeedPort {

  List<Reading> fetchReadings();
}
