package sensor.relay.infrastructure.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Sensor feed endpoint.
 *
 * @param baseUrl scheme, host and port of the feed
 * @param path path of the readings resource
 * @param connectTimeout TCP connect timeout
 * @param responseTimeout time allowed for the whole response
 * @param defaultSensorId sensor id given to readings of a flat single-sensor payload
 */
@ConfigurationProperties(prefix = "relay.sensor-feed")
public record SensorFeedProperties(
    @DefaultValue("http://localhost:8080") String baseUrl,
    @DefaultValue("/sensors") String path,
    @DefaultValue("5s") Duration connectTimeout,
    @DefaultValue("10s") Duration responseTimeout,
    @DefaultValue("sensor1") String defaultSensorId) {

  public SensorFeedProperties {
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new IllegalArgumentException("relay.sensor-feed.base-url must not be blank");
    }
    if (path == null || !path.startsWith("/")) {
      throw new IllegalArgumentException("relay.sensor-feed.path must start with '/': " + path);
    }
    if (connectTimeout.isNegative() || connectTimeout.isZero()) {
      throw new IllegalArgumentException("relay.sensor-feed.connect-timeout must be positive");
    }
    if (responseTimeout.isNegative() || responseTimeout.isZero()) {
      throw new IllegalArgumentException("relay.sensor-feed.response-timeout must be positive");
    }
    if (defaultSensorId == null || defaultSensorId.isBlank()) {
      throw new IllegalArgumentException("relay.sensor-feed.default-sensor-id must not be blank");
    }
  }
}
