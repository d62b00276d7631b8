package sensor.relay.infrastructure.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Telegram Bot API access.
 *
 * <pre>{@code
 * relay:
 *   telegram:
 *     bot-token: ${TELEGRAMBOT_TOKEN:}
 *     api-base-url: https://api.telegram.org
 *     polling:
 *       enabled: true
 *       timeout-seconds: 25
 * }</pre>
 *
 * A missing token is reported by {@link TelegramCredentialValidator}, not here, so the failure
 * carries the credential name instead of a binding error.
 */
@ConfigurationProperties(prefix = "relay.telegram")
public record TelegramProperties(
    String botToken,
    @DefaultValue("https://api.telegram.org") String apiBaseUrl,
    @DefaultValue("5s") Duration connectTimeout,
    @DefaultValue("10s") Duration responseTimeout,
    @DefaultValue Polling polling) {

  public TelegramProperties {
    if (apiBaseUrl == null || apiBaseUrl.isBlank()) {
      throw new IllegalArgumentException("relay.telegram.api-base-url must not be blank");
    }
    if (connectTimeout.isNegative() || connectTimeout.isZero()) {
      throw new IllegalArgumentException("relay.telegram.connect-timeout must be positive");
    }
    if (responseTimeout.isNegative() || responseTimeout.isZero()) {
      throw new IllegalArgumentException("relay.telegram.response-timeout must be positive");
    }
  }

  public boolean hasBotToken() {
    return botToken != null && !botToken.isBlank();
  }

  /** Longest a single request may take, long-poll wait included. */
  public Duration effectiveResponseTimeout() {
    return responseTimeout.plusSeconds(polling.timeoutSeconds());
  }

  @Override
  public String toString() {
    return "TelegramProperties[botToken="
        + (hasBotToken() ? "****" : "<unset>")
        + ", apiBaseUrl="
        + apiBaseUrl
        + ", polling="
        + polling
        + "]";
  }

  /**
   * @param enabled whether the update poller runs
   * @param timeoutSeconds long-poll wait passed to getUpdates
   * @param fixedDelayMs pause between two getUpdates calls
   */
  public record Polling(
      @DefaultValue("true") boolean enabled,
      @DefaultValue("25") int timeoutSeconds,
      @DefaultValue("1000") long fixedDelayMs) {

    public Polling {
      if (timeoutSeconds < 0 || timeoutSeconds > 50) {
        throw new IllegalArgumentException(
            "relay.telegram.polling.timeout-seconds must be within 0..50, got: " + timeoutSeconds);
      }
    }
  }
}
