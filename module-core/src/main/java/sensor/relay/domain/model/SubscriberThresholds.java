package sensor.relay.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Immutable set of bounds owned by one subscriber.
 *
 * <p>Every change returns a new instance, so a copy handed to the evaluation pass never changes
 * underneath it.
 */
public final class SubscriberThresholds {

  private static final SubscriberThresholds EMPTY = new SubscriberThresholds(Map.of());

  private final Map<ThresholdKey, Double> bounds;

  private SubscriberThresholds(Map<ThresholdKey, Double> bounds) {
    this.bounds = bounds;
  }

  public static SubscriberThresholds empty() {
    return EMPTY;
  }

  public SubscriberThresholds with(ThresholdKey key, double value) {
    Objects.requireNonNull(key, "key");
    Map<ThresholdKey, Double> copy = new LinkedHashMap<>(bounds);
    copy.put(key, value);
    return new SubscriberThresholds(Collections.unmodifiableMap(copy));
  }

  public SubscriberThresholds without(ThresholdKey key) {
    if (!bounds.containsKey(key)) {
      return this;
    }
    Map<ThresholdKey, Double> copy = new LinkedHashMap<>(bounds);
    copy.remove(key);
    return copy.isEmpty() ? EMPTY : new SubscriberThresholds(Collections.unmodifiableMap(copy));
  }

  public OptionalDouble find(ThresholdKey key) {
    Double value = bounds.get(key);
    return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
  }

  public boolean contains(ThresholdKey key) {
    return bounds.containsKey(key);
  }

  public boolean isEmpty() {
    return bounds.isEmpty();
  }

  public int size() {
    return bounds.size();
  }

  /** Read-only view in insertion order. */
  public Map<ThresholdKey, Double> asMap() {
    return bounds;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SubscriberThresholds other)) return false;
    return bounds.equals(other.bounds);
  }

  @Override
  public int hashCode() {
    return bounds.hashCode();
  }

  @Override
  public String toString() {
    return "SubscriberThresholds" + bounds;
  }
}
