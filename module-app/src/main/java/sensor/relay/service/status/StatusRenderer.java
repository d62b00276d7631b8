package sensor.relay.service.status;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;
import sensor.relay.config.StatusProperties;
import sensor.relay.domain.model.Reading;
import sensor.relay.sensor.SensorDirectory;

/**
 * Formats readings for the /status reply (Telegram Markdown).
 *
 * <pre>
 * 📍 *Lounge* - Temperature: *26.3 °C* (19.10.2026 10:00:00)
 * </pre>
 */
@Component
public class StatusRenderer {

  private static final String TIMESTAMP_PATTERN = "dd.MM.yyyy HH:mm:ss";

  private final SensorDirectory sensorDirectory;
  private final DateTimeFormatter timestampFormat;

  public StatusRenderer(SensorDirectory sensorDirectory, StatusProperties properties) {
    this.sensorDirectory = sensorDirectory;
    this.timestampFormat =
        DateTimeFormatter.ofPattern(TIMESTAMP_PATTERN, Locale.ROOT).withZone(properties.zone());
  }

  public String render(List<Reading> readings) {
    if (readings.isEmpty()) {
      return "No sensor data available.";
    }
    StringBuilder text = new StringBuilder("*Current sensor readings*\n\n");
    for (Reading reading : readings) {
      text.append(line(reading)).append('\n');
    }
    return text.toString().stripTrailing();
  }

  String line(Reading reading) {
    String sensor = escapeMarkdown(sensorDirectory.displayName(reading.sensorId()));
    String label =
        KnownMetric.of(reading.metric())
            .map(KnownMetric::label)
            .orElseGet(() -> escapeMarkdown(reading.metric()));
    String unit = KnownMetric.of(reading.metric()).map(m -> " " + m.unit()).orElse("");
    String value = String.format(Locale.ROOT, "%.1f", reading.value());
    String time = timestampFormat.format(Instant.ofEpochSecond(reading.observedAt()));
    return "📍 *" + sensor + "* - " + label + ": *" + value + unit + "* (" + time + ")";
  }

  /** Escapes the characters legacy Telegram Markdown treats as markup. */
  static String escapeMarkdown(String raw) {
    StringBuilder escaped = new StringBuilder(raw.length());
    for (char c : raw.toCharArray()) {
      if (c == '_' || c == '*' || c == '`' || c == '[') {
        escaped.append('\\');
      }
      escaped.append(c);
    }
    return escaped.toString();
  }
}
