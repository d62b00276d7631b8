package sensor.relay.config;

import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param zoneId zone used to display reading timestamps; blank means the system zone
 */
@ConfigurationProperties(prefix = "relay.status")
public record StatusProperties(@DefaultValue("") String zoneId) {

  public StatusProperties {
    if (zoneId != null && !zoneId.isBlank()) {
      // fail at startup rather than on the first /status
      ZoneId.of(zoneId);
    }
  }

  public ZoneId zone() {
    return zoneId == null || zoneId.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zoneId);
  }
}
