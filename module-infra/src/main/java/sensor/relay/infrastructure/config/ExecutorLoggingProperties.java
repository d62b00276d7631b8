package sensor.relay.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param slowMs tasks slower than this are logged at INFO; 0 disables it
 */
@ConfigurationProperties(prefix = "executor.logging")
public record ExecutorLoggingProperties(@DefaultValue("1000") long slowMs) {}
