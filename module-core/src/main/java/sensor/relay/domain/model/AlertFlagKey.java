package sensor.relay.domain.model;

import java.util.Objects;

/** Alert state slot of one subscriber for one bound. */
public record AlertFlagKey(long subscriberId, String sensorId, String boundKey) {

  public AlertFlagKey {
    Objects.requireNonNull(sensorId, "sensorId");
    Objects.requireNonNull(boundKey, "boundKey");
  }

  public static AlertFlagKey of(long subscriberId, ThresholdKey key) {
    return new AlertFlagKey(subscriberId, key.sensorId(), key.boundKey());
  }
}
