package sensor.relay.infrastructure.external.sensor;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import sensor.relay.application.port.SensorFeedPort;
import sensor.relay.domain.model.Reading;
import sensor.relay.infrastructure.config.SensorFeedProperties;
import sensor.relay.infrastructure.executor.LogicExecutor;
import sensor.relay.infrastructure.executor.TaskContext;
import sensor.relay.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * {@link SensorFeedPort} over HTTP GET.
 *
 * <p>One request per call, no retry: the evaluation loop simply tries again on its next tick.
 * Failures leave as {@link sensor.relay.error.exception.SensorFetchException}.
 */
@Slf4j
@Component
public class WebClientSensorFeedClient implements SensorFeedPort {

  private final WebClient sensorFeedWebClient;
  private final SensorFeedProperties properties;
  private final SensorPayloadDecoder decoder;
  private final LogicExecutor executor;

  public WebClientSensorFeedClient(
      WebClient sensorFeedWebClient,
      SensorFeedProperties properties,
      ObjectMapper objectMapper,
      Clock clock,
      LogicExecutor executor) {
    this.sensorFeedWebClient = sensorFeedWebClient;
    this.properties = properties;
    this.decoder = new SensorPayloadDecoder(objectMapper, clock, properties.defaultSensorId());
    this.executor = executor;
  }

  @Override
  public List<Reading> fetchReadings() {
    return executor.executeWithTranslation(
        this::requestReadings,
        ExceptionTranslator.forSensorFeed(),
        TaskContext.of("SensorFeed", "Fetch", properties.path()));
  }

  private List<Reading> requestReadings() throws Exception {
    String body =
        sensorFeedWebClient
            .get()
            .uri(properties.path())
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(properties.responseTimeout().plusSeconds(1))
            .block();

    List<Reading> readings = decoder.decode(body);
    log.debug("[SensorFeed] Fetched {} readings from {}", readings.size(), properties.path());
    return readings;
  }
}
