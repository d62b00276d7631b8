package sensor.relay.domain.model;

/**
 * Result of comparing one reading against one configured bound.
 *
 * @param key the bound that was checked
 * @param reading the reading it was checked against
 * @param limit configured limit
 * @param violated whether the reading is outside the limit
 */
public record BoundCheck(ThresholdKey key, Reading reading, double limit, boolean violated) {

  public Bound bound() {
    return key.bound();
  }
}
