package sensor.relay.infrastructure.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient dedicated to the Telegram Bot API.
 *
 * <p>The read timeout covers the long-poll wait of getUpdates on top of the plain response timeout.
 */
@Configuration
@RequiredArgsConstructor
@EnableConfigurationProperties(TelegramProperties.class)
public class TelegramWebClientConfig {

  private final TelegramProperties properties;

  @Bean("telegramWebClient")
  public WebClient telegramWebClient(WebClient.Builder builder) {
    Duration responseTimeout = properties.effectiveResponseTimeout();
    long readMillis = responseTimeout.toMillis();
    long writeMillis = properties.responseTimeout().toMillis();
    HttpClient httpClient =
        HttpClient.create()
            .option(
                ChannelOption.CONNECT_TIMEOUT_MILLIS,
                Math.toIntExact(properties.connectTimeout().toMillis()))
            .responseTimeout(responseTimeout)
            .doOnConnected(
                conn ->
                    conn.addHandlerLast(new ReadTimeoutHandler(readMillis, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(writeMillis, TimeUnit.MILLISECONDS)));

    return builder
        .clone()
        .baseUrl(properties.apiBaseUrl())
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .build();
  }
}
