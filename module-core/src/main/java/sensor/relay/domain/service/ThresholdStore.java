package sensor.relay.domain.service;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import sensor.relay.domain.model.SubscriberThresholds;
import sensor.relay.domain.model.ThresholdKey;

/**
 * Per-subscriber threshold configuration, in memory only.
 *
 * <p>Each subscriber maps to an immutable {@link SubscriberThresholds}; updates swap the whole
 * value inside {@link ConcurrentHashMap#compute}, so readers never see a half-applied change.
 */
public class ThresholdStore {

  private final ConcurrentHashMap<Long, SubscriberThresholds> thresholds =
      new ConcurrentHashMap<>();

  /** Upsert. Last write wins. */
  public void set(long subscriberId, ThresholdKey key, double value) {
    Objects.requireNonNull(key, "key");
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException("threshold must be finite: " + value);
    }
    thresholds.compute(
        subscriberId,
        (id, current) -> (current == null ? SubscriberThresholds.empty() : current).with(key, value));
  }

  public SubscriberThresholds get(long subscriberId) {
    return thresholds.getOrDefault(subscriberId, SubscriberThresholds.empty());
  }

  /**
   * Removes one bound.
   *
   * @return true if the bound existed
   */
  public boolean clear(long subscriberId, ThresholdKey key) {
    AtomicBoolean removed = new AtomicBoolean(false);
    thresholds.computeIfPresent(
        subscriberId,
        (id, current) -> {
          removed.set(current.contains(key));
          SubscriberThresholds next = current.without(key);
          return next.isEmpty() ? null : next;
        });
    return removed.get();
  }

  /** Point-in-time copy for one evaluation pass. */
  public Map<Long, SubscriberThresholds> snapshot() {
    return Map.copyOf(thresholds);
  }
}
