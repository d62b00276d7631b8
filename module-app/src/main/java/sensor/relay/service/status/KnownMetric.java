package sensor.relay.service.status;

import java.util.Locale;
import java.util.Optional;

/** Metrics with a friendly label and unit. Others are shown by their raw name. */
public enum KnownMetric {
  TEMPERATURE("temperature", "Temperature", "°C"),
  HUMIDITY("humidity", "Humidity", "%");

  private final String metric;
  private final String label;
  private final String unit;

  KnownMetric(String metric, String label, String unit) {
    this.metric = metric;
    this.label = label;
    this.unit = unit;
  }

  public String label() {
    return label;
  }

  public String unit() {
    return unit;
  }

  public static Optional<KnownMetric> of(String metric) {
    String normalized = metric.toLowerCase(Locale.ROOT);
    for (KnownMetric known : values()) {
      if (known.metric.equals(normalized)) {
        return Optional.of(known);
      }
    }
    return Optional.empty();
  }
}
