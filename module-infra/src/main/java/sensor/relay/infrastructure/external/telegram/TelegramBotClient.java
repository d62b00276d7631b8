package sensor.relay.infrastructure.external.telegram;

import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import sensor.relay.error.exception.NotificationDeliveryException;
import sensor.relay.infrastructure.config.TelegramProperties;
import sensor.relay.infrastructure.executor.LogicExecutor;
import sensor.relay.infrastructure.executor.TaskContext;
import sensor.relay.infrastructure.executor.strategy.ExceptionTranslator;
import sensor.relay.infrastructure.external.telegram.dto.SendMessageRequest;
import sensor.relay.infrastructure.external.telegram.dto.TelegramMessage;
import sensor.relay.infrastructure.external.telegram.dto.TelegramResponse;
import sensor.relay.infrastructure.external.telegram.dto.TelegramUpdate;

/**
 * Thin blocking client for the two Bot API methods the relay uses.
 *
 * <p>The token is part of the request path and is never logged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TelegramBotClient {

  private static final String METHOD_PATH = "/bot{token}/{method}";

  private static final ParameterizedTypeReference<TelegramResponse<TelegramMessage>>
      MESSAGE_RESPONSE = new ParameterizedTypeReference<>() {};

  private static final ParameterizedTypeReference<TelegramResponse<List<TelegramUpdate>>>
      UPDATES_RESPONSE = new ParameterizedTypeReference<>() {};

  private final WebClient telegramWebClient;
  private final TelegramProperties properties;
  private final LogicExecutor executor;

  /**
   * Sends a text message.
   *
   * @throws NotificationDeliveryException when Telegram rejects the message or cannot be reached
   */
  public TelegramMessage sendMessage(long chatId, String text, boolean markdown) {
    return executor.executeWithTranslation(
        () -> {
          TelegramResponse<TelegramMessage> response =
              telegramWebClient
                  .post()
                  .uri(METHOD_PATH, properties.botToken(), "sendMessage")
                  .contentType(MediaType.APPLICATION_JSON)
                  .bodyValue(SendMessageRequest.of(chatId, text, markdown))
                  .retrieve()
                  .bodyToMono(MESSAGE_RESPONSE)
                  .timeout(properties.responseTimeout().plusSeconds(1))
                  .block();
          return requireOk(chatId, response);
        },
        ExceptionTranslator.forTelegram(chatId),
        TaskContext.of("Telegram", "SendMessage", String.valueOf(chatId)));
  }

  /**
   * Long-polls for new updates.
   *
   * @param offset id of the first update to return; earlier ones are confirmed and dropped
   * @param timeoutSeconds how long Telegram may hold the request open when nothing is pending
   */
  public List<TelegramUpdate> getUpdates(long offset, int timeoutSeconds) {
    Duration wait = properties.effectiveResponseTimeout().plusSeconds(1);
    return executor.execute(
        () -> {
          TelegramResponse<List<TelegramUpdate>> response =
              telegramWebClient
                  .get()
                  .uri(
                      uriBuilder ->
                          uriBuilder
                              .path(METHOD_PATH)
                              .queryParam("offset", offset)
                              .queryParam("timeout", timeoutSeconds)
                              .queryParam("allowed_updates", "[\"message\"]")
                              .build(properties.botToken(), "getUpdates"))
                  .retrieve()
                  .bodyToMono(UPDATES_RESPONSE)
                  .timeout(wait)
                  .block();
          if (response == null || !response.ok()) {
            log.warn(
                "[TelegramBotClient] getUpdates not ok: {}",
                response == null ? "empty body" : response.description());
            return List.of();
          }
          return response.result() == null ? List.<TelegramUpdate>of() : response.result();
        },
        TaskContext.of("Telegram", "GetUpdates", String.valueOf(offset)));
  }

  private static TelegramMessage requireOk(long chatId, TelegramResponse<TelegramMessage> response) {
    if (response == null) {
      throw new NotificationDeliveryException(chatId, "empty response");
    }
    if (!response.ok()) {
      throw new NotificationDeliveryException(
          chatId, response.errorCode() + " " + response.description());
    }
    return response.result();
  }
}
