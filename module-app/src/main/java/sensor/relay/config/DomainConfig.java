package sensor.relay.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import sensor.relay.domain.service.AlertFlagTable;
import sensor.relay.domain.service.BreachDetector;
import sensor.relay.domain.service.ThresholdStore;

/**
 * Process-wide domain state. The core module is framework-free, so its singletons are declared
 * here and shared by the evaluation loop and command handling.
 */
@Configuration
public class DomainConfig {

  @Bean
  public ThresholdStore thresholdStore() {
    return new ThresholdStore();
  }

  @Bean
  public AlertFlagTable alertFlagTable() {
    return new AlertFlagTable();
  }

  @Bean
  public BreachDetector breachDetector() {
    return new BreachDetector();
  }
}
