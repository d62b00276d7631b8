package sensor.relay.config;

import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Human-readable sensor names.
 *
 * <pre>{@code
 * relay:
 *   sensors:
 *     display-names:
 *       sensor1: Living room
 * }</pre>
 *
 * @param displayNames sensor id to display name
 */
@ConfigurationProperties(prefix = "relay.sensors")
public record SensorDisplayProperties(Map<String, String> displayNames) {

  public SensorDisplayProperties {
    displayNames = displayNames == null ? Map.of() : Map.copyOf(displayNames);
  }
}
