package sensor.relay.domain.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sensor.relay.domain.model.AlertFlagKey;

@DisplayName("AlertFlagTable")
class AlertFlagTableTest {

  private final AlertFlagKey key = new AlertFlagKey(1L, "sensor1", "temperature_max");

  private AlertFlagTable flags;

  @BeforeEach
  void setUp() {
    flags = new AlertFlagTable();
  }

  @Test
  @DisplayName("a flag starts lowered")
  void startsLowered() {
    assertThat(flags.isAlerting(key)).isFalse();
  }

  @Test
  @DisplayName("raise reports only the first transition")
  void raiseIsEdgeTriggered() {
    assertThat(flags.raise(key)).isTrue();
    assertThat(flags.raise(key)).isFalse();
    assertThat(flags.isAlerting(key)).isTrue();
  }

  @Test
  @DisplayName("lower re-arms the flag")
  void lowerRearms() {
    flags.raise(key);

    assertThat(flags.lower(key)).isTrue();
    assertThat(flags.lower(key)).isFalse();
    assertThat(flags.raise(key)).isTrue();
  }

  @Test
  void subscribersHaveSeparateFlags() {
    AlertFlagKey other = new AlertFlagKey(2L, "sensor1", "temperature_max");
    flags.raise(key);
    flags.raise(other);

    flags.lower(key);

    assertThat(flags.size()).isEqualTo(1);
    assertThat(flags.isAlerting(other)).isTrue();
  }
}
