package sensor.relay.domain.model;

import java.util.Locale;
import java.util.Optional;

/** Direction of a threshold. Comparisons are strict: a value equal to the limit is in bounds. */
public enum Bound {
  MIN("_min", "min") {
    @Override
    public boolean violatedBy(double value, double limit) {
      return value < limit;
    }
  },
  MAX("_max", "max") {
    @Override
    public boolean violatedBy(double value, double limit) {
      return value > limit;
    }
  };

  private final String suffix;
  private final String keyword;

  Bound(String suffix, String keyword) {
    this.suffix = suffix;
    this.keyword = keyword;
  }

  public abstract boolean violatedBy(double value, double limit);

  public String suffix() {
    return suffix;
  }

  /** Word used in commands ("min" / "max"). */
  public String keyword() {
    return keyword;
  }

  public String boundKey(String metric) {
    return metric + suffix;
  }

  public static Optional<Bound> fromKeyword(String keyword) {
    if (keyword == null) {
      return Optional.empty();
    }
    String normalized = keyword.trim().toLowerCase(Locale.ROOT);
    for (Bound bound : values()) {
      if (bound.keyword.equals(normalized)) {
        return Optional.of(bound);
      }
    }
    return Optional.empty();
  }
}
