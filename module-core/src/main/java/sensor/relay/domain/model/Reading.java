package sensor.relay.domain.model;

import java.util.Objects;

/**
 * One measurement taken from the sensor feed.
 *
 * <p>Pure domain value, produced fresh on every fetch and never stored.
 *
 * @param sensorId device identifier as reported by the feed (e.g. "sensor1")
 * @param metric measured quantity (e.g. "temperature", "humidity")
 * @param value measured value
 * @param observedAt epoch seconds
 */
public record Reading(String sensorId, String metric, double value, long observedAt) {

  public Reading {
    Objects.requireNonNull(sensorId, "sensorId");
    Objects.requireNonNull(metric, "metric");
    if (sensorId.isBlank()) {
      throw new IllegalArgumentException("sensorId must not be blank");
    }
    if (metric.isBlank()) {
      throw new IllegalArgumentException("metric must not be blank");
    }
  }

  public ThresholdKey keyFor(Bound bound) {
    return ThresholdKey.of(sensorId, metric, bound);
  }
}
