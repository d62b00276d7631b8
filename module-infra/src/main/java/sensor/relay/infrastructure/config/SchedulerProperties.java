package sensor.relay.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Task scheduler pool.
 *
 * <pre>{@code
 * scheduler:
 *   task-scheduler:
 *     pool-size: 2
 *     await-termination-seconds: 30
 * }</pre>
 *
 * @see SchedulerConfig
 */
@ConfigurationProperties(prefix = "scheduler.task-scheduler")
public record SchedulerProperties(
    @DefaultValue("2") int poolSize, @DefaultValue("30") int awaitTerminationSeconds) {

  public SchedulerProperties {
    if (poolSize <= 0) {
      throw new IllegalArgumentException(
          "scheduler.task-scheduler.pool-size must be positive, got: " + poolSize);
    }
    if (awaitTerminationSeconds <= 0) {
      throw new IllegalArgumentException("await-termination-seconds must be positive");
    }
  }
}
