package sensor.relay.infrastructure.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import sensor.relay.error.exception.MissingCredentialException;

@DisplayName("Relay configuration binding")
class RelayPropertiesBindingTest {

  private final ApplicationContextRunner runner =
      new ApplicationContextRunner().withUserConfiguration(TestConfig.class);

  @Test
  @DisplayName("defaults apply when only the token is set")
  void defaults() {
    runner
        .withPropertyValues("relay.telegram.bot-token=123:abc")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              SensorFeedProperties feed = context.getBean(SensorFeedProperties.class);
              assertThat(feed.baseUrl()).isEqualTo("http://localhost:8080");
              assertThat(feed.path()).isEqualTo("/sensors");
              assertThat(feed.defaultSensorId()).isEqualTo("sensor1");
              assertThat(feed.connectTimeout()).isEqualTo(Duration.ofSeconds(5));

              TelegramProperties telegram = context.getBean(TelegramProperties.class);
              assertThat(telegram.apiBaseUrl()).isEqualTo("https://api.telegram.org");
              assertThat(telegram.polling().enabled()).isTrue();
              assertThat(telegram.polling().timeoutSeconds()).isEqualTo(25);
              assertThat(telegram.toString()).doesNotContain("123:abc");
            });
  }

  @Test
  @DisplayName("missing token stops the context")
  void missingTokenIsFatal() {
    runner.run(
        context -> {
          assertThat(context).hasFailed();
          assertThat(context.getStartupFailure())
              .rootCause()
              .isInstanceOf(MissingCredentialException.class)
              .hasMessageContaining("TELEGRAMBOT_TOKEN");
        });
  }

  @Test
  @DisplayName("blank token is treated as missing")
  void blankTokenIsFatal() {
    runner
        .withPropertyValues("relay.telegram.bot-token=  ")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  @DisplayName("invalid feed path is rejected")
  void invalidPath() {
    runner
        .withPropertyValues("relay.telegram.bot-token=t", "relay.sensor-feed.path=sensors")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties({SensorFeedProperties.class, TelegramProperties.class})
  @Import(TelegramCredentialValidator.class)
  static class TestConfig {}
}
