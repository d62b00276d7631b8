package sensor.relay.domain.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Identifies one bound on one sensor metric: {@code (sensorId, metric + "_min" | "_max")}.
 *
 * <p>The bound key is lower-cased, so "CO2" from the feed and "co2" typed by a subscriber name the
 * same bound.
 *
 * @param sensorId device identifier
 * @param boundKey metric name followed by the bound suffix, e.g. "temperature_max"
 */
public record ThresholdKey(String sensorId, String boundKey) {

  public ThresholdKey {
    Objects.requireNonNull(sensorId, "sensorId");
    Objects.requireNonNull(boundKey, "boundKey");
    boundKey = boundKey.toLowerCase(Locale.ROOT);
    if (!boundKey.endsWith(Bound.MIN.suffix()) && !boundKey.endsWith(Bound.MAX.suffix())) {
      throw new IllegalArgumentException("boundKey must end with _min or _max: " + boundKey);
    }
  }

  public static ThresholdKey of(String sensorId, String metric, Bound bound) {
    return new ThresholdKey(sensorId, bound.boundKey(metric));
  }

  public Bound bound() {
    return boundKey.endsWith(Bound.MIN.suffix()) ? Bound.MIN : Bound.MAX;
  }

  public String metric() {
    return boundKey.substring(0, boundKey.length() - bound().suffix().length());
  }
}
