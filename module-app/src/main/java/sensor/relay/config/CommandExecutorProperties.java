package sensor.relay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/** Pool that runs subscriber commands, separate from the scheduler threads. */
@ConfigurationProperties(prefix = "relay.command-executor")
public record CommandExecutorProperties(
    @DefaultValue("2") int corePoolSize,
    @DefaultValue("4") int maxPoolSize,
    @DefaultValue("100") int queueCapacity) {

  public CommandExecutorProperties {
    if (corePoolSize <= 0 || maxPoolSize < corePoolSize) {
      throw new IllegalArgumentException(
          "relay.command-executor needs 0 < core-pool-size <= max-pool-size, got: "
              + corePoolSize
              + "/"
              + maxPoolSize);
    }
    if (queueCapacity < 0) {
      throw new IllegalArgumentException("relay.command-executor.queue-capacity must be >= 0");
    }
  }
}
