package sensor.relay.domain.service;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import sensor.relay.domain.model.AlertFlagKey;

/**
 * "Currently alerting" flags. A key is present iff its last evaluation found a violation; an
 * absent key reads as false.
 */
public class AlertFlagTable {

  private final Set<AlertFlagKey> raised = ConcurrentHashMap.newKeySet();

  public boolean isAlerting(AlertFlagKey key) {
    return raised.contains(key);
  }

  /**
   * @return true only on the false to true transition, i.e. when the caller should notify
   */
  public boolean raise(AlertFlagKey key) {
    return raised.add(key);
  }

  /**
   * @return true if the flag was raised before (the alert is re-armed)
   */
  public boolean lower(AlertFlagKey key) {
    return raised.remove(key);
  }

  public int size() {
    return raised.size();
  }
}
