package sensor.relay.sensor;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;
import sensor.relay.config.SensorDisplayProperties;

/**
 * Translates between sensor ids used by the feed and names shown to subscribers.
 *
 * <p>Subscribers may type either spelling; both resolve to the same id so a bound set by name
 * matches readings reported by id.
 */
@Component
public class SensorDirectory {

  private final Map<String, String> namesById;
  private final Map<String, String> idsByLowerName;

  public SensorDirectory(SensorDisplayProperties properties) {
    this.namesById = properties.displayNames();
    Map<String, String> reverse = new HashMap<>();
    namesById.forEach((id, name) -> reverse.put(name.toLowerCase(Locale.ROOT), id));
    this.idsByLowerName = Map.copyOf(reverse);
  }

  public String displayName(String sensorId) {
    return namesById.getOrDefault(sensorId, sensorId);
  }

  /** Id for a user-typed token; unknown tokens are taken as ids. */
  public String resolve(String token) {
    if (namesById.containsKey(token)) {
      return token;
    }
    return idsByLowerName.getOrDefault(token.toLowerCase(Locale.ROOT), token);
  }
}
