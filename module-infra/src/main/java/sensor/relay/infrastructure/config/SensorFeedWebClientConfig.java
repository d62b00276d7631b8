package sensor.relay.infrastructure.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient dedicated to the sensor feed.
 *
 * <p>Separate from the Telegram client so a hanging feed cannot hold Telegram connections, and the
 * other way round.
 */
@Configuration
@RequiredArgsConstructor
@EnableConfigurationProperties(SensorFeedProperties.class)
public class SensorFeedWebClientConfig {

  private final SensorFeedProperties properties;

  @Bean("sensorFeedWebClient")
  public WebClient sensorFeedWebClient(WebClient.Builder builder) {
    long responseMillis = properties.responseTimeout().toMillis();
    HttpClient httpClient =
        HttpClient.create()
            .option(
                ChannelOption.CONNECT_TIMEOUT_MILLIS,
                Math.toIntExact(properties.connectTimeout().toMillis()))
            .responseTimeout(properties.responseTimeout())
            .doOnConnected(
                conn ->
                    conn.addHandlerLast(new ReadTimeoutHandler(responseMillis, TimeUnit.MILLISECONDS))
                        .addHandlerLast(
                            new WriteTimeoutHandler(responseMillis, TimeUnit.MILLISECONDS)));

    return builder
        .clone()
        .baseUrl(properties.baseUrl())
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .build();
  }
}
