package sensor.relay.domain.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ThresholdKey / Bound")
class ThresholdKeyTest {

  @Nested
  @DisplayName("Bound")
  class BoundBehaviour {

    @Test
    @DisplayName("MIN is violated strictly below the limit")
    void minIsStrict() {
      assertThat(Bound.MIN.violatedBy(17.9, 18.0)).isTrue();
      assertThat(Bound.MIN.violatedBy(18.0, 18.0)).isFalse();
      assertThat(Bound.MIN.violatedBy(18.1, 18.0)).isFalse();
    }

    @Test
    @DisplayName("MAX is violated strictly above the limit")
    void maxIsStrict() {
      assertThat(Bound.MAX.violatedBy(25.1, 25.0)).isTrue();
      assertThat(Bound.MAX.violatedBy(25.0, 25.0)).isFalse();
      assertThat(Bound.MAX.violatedBy(-3.0, 25.0)).isFalse();
    }

    @Test
    void fromKeyword_ignoresCaseAndSpaces() {
      assertThat(Bound.fromKeyword(" MAX ")).contains(Bound.MAX);
      assertThat(Bound.fromKeyword("min")).contains(Bound.MIN);
      assertThat(Bound.fromKeyword("upper")).isEmpty();
      assertThat(Bound.fromKeyword(null)).isEmpty();
    }
  }

  @Test
  @DisplayName("boundKey joins metric and suffix and can be split back")
  void boundKeyRoundTrip() {
    ThresholdKey key = ThresholdKey.of("sensor1", "temperature", Bound.MAX);

    assertThat(key.boundKey()).isEqualTo("temperature_max");
    assertThat(key.metric()).isEqualTo("temperature");
    assertThat(key.bound()).isEqualTo(Bound.MAX);
    assertThat(key).isEqualTo(new ThresholdKey("sensor1", "temperature_max"));
  }

  @Test
  void metricContainingUnderscoreIsPreserved() {
    ThresholdKey key = ThresholdKey.of("sensor1", "soil_moisture", Bound.MIN);

    assertThat(key.metric()).isEqualTo("soil_moisture");
    assertThat(key.bound()).isEqualTo(Bound.MIN);
  }

  @Test
  @DisplayName("metric spelling is case-insensitive")
  void metricIsCaseInsensitive() {
    ThresholdKey typed = ThresholdKey.of("sensor1", "co2", Bound.MAX);
    ThresholdKey fromFeed = new Reading("sensor1", "CO2", 1500.0, 0L).keyFor(Bound.MAX);

    assertThat(fromFeed).isEqualTo(typed);
    assertThat(fromFeed.boundKey()).isEqualTo("co2_max");
    assertThat(new ThresholdKey("sensor1", "CO2_MAX").bound()).isEqualTo(Bound.MAX);
  }

  @Test
  void rejectsKeyWithoutSuffix() {
    assertThatThrownBy(() -> new ThresholdKey("sensor1", "temperature"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void readingRejectsBlankIdentifiers() {
    assertThatThrownBy(() -> new Reading(" ", "temperature", 1.0, 0L))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Reading("sensor1", null, 1.0, 0L))
        .isInstanceOf(NullPointerException.class);
  }
}
