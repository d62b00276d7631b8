package sensor.relay.infrastructure.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;
import sensor.relay.error.exception.MissingCredentialException;

/** Fails startup when no bot token is configured. Without it the relay can reach nobody. */
@Slf4j
@Component
@RequiredArgsConstructor
public class TelegramCredentialValidator implements InitializingBean {

  static final String CREDENTIAL_NAME = "TELEGRAMBOT_TOKEN";

  private final TelegramProperties properties;

  @Override
  public void afterPropertiesSet() {
    if (!properties.hasBotToken()) {
      log.error(
          """
          ========================================================================
          [TelegramConfig] CRITICAL: Telegram bot token is not configured!

          Set the environment variable TELEGRAMBOT_TOKEN
          (or the property relay.telegram.bot-token) and restart.
          ========================================================================
          """);
      throw new MissingCredentialException(CREDENTIAL_NAME);
    }
    log.info("[TelegramConfig] Bot token configured, api={}", properties.apiBaseUrl());
  }
}
