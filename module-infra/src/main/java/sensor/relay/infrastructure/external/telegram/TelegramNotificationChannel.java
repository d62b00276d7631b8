package sensor.relay.infrastructure.external.telegram;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import sensor.relay.application.port.NotificationMessage;
import sensor.relay.application.port.NotificationPort;
import sensor.relay.error.exception.NotificationDeliveryException;
import sensor.relay.infrastructure.executor.LogicExecutor;
import sensor.relay.infrastructure.executor.TaskContext;

/**
 * {@link NotificationPort} backed by the Telegram Bot API.
 *
 * <p>Failures are logged and reported as {@code false}; nothing is thrown to the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TelegramNotificationChannel implements NotificationPort {

  private final TelegramBotClient botClient;
  private final LogicExecutor executor;

  @Override
  public boolean send(NotificationMessage message) {
    return executor.executeWithFallback(
        () -> {
          botClient.sendMessage(message.subscriberId(), message.text(), message.markdown());
          log.debug("[TelegramChannel] Delivered message to chat {}", message.subscriberId());
          return true;
        },
        e -> handleFailure(message, e),
        TaskContext.of("NotificationChannel", "Telegram", String.valueOf(message.subscriberId())));
  }

  private boolean handleFailure(NotificationMessage message, Throwable e) {
    if (e instanceof NotificationDeliveryException) {
      log.warn("[TelegramChannel] {}", e.getMessage());
    } else {
      log.error(
          "[TelegramChannel] Unexpected error sending to chat {}: {}",
          message.subscriberId(),
          e.getMessage(),
          e);
    }
    return false;
  }

  @Override
  public String getChannelName() {
    return "telegram";
  }
}
