package sensor.relay.domain.service;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import sensor.relay.domain.model.Bound;
import sensor.relay.domain.model.BoundCheck;
import sensor.relay.domain.model.Reading;
import sensor.relay.domain.model.SubscriberThresholds;
import sensor.relay.domain.model.ThresholdKey;

/** Matches a reading against the bounds a subscriber configured for its sensor and metric. */
public class BreachDetector {

  /**
   * @return one check per configured bound ({@code _min} then {@code _max}); empty when the
   *     subscriber has no bound for this reading
   */
  public List<BoundCheck> check(Reading reading, SubscriberThresholds thresholds) {
    List<BoundCheck> checks = new ArrayList<>(2);
    for (Bound bound : Bound.values()) {
      ThresholdKey key = reading.keyFor(bound);
      OptionalDouble limit = thresholds.find(key);
      if (limit.isPresent()) {
        double value = limit.getAsDouble();
        checks.add(new BoundCheck(key, reading, value, bound.violatedBy(reading.value(), value)));
      }
    }
    return checks;
  }
}
