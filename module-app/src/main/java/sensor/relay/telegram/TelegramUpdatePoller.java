package sensor.relay.telegram;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import sensor.relay.application.port.NotificationMessage;
import sensor.relay.application.port.NotificationPort;
import sensor.relay.command.CommandFacade;
import sensor.relay.command.CommandReply;
import sensor.relay.infrastructure.config.TelegramProperties;
import sensor.relay.infrastructure.executor.LogicExecutor;
import sensor.relay.infrastructure.executor.TaskContext;
import sensor.relay.infrastructure.external.telegram.TelegramBotClient;
import sensor.relay.infrastructure.external.telegram.dto.TelegramMessage;
import sensor.relay.infrastructure.external.telegram.dto.TelegramUpdate;

/**
 * Long-polls Telegram for commands and hands each one to the command executor.
 *
 * <p>The offset advances past every received update, handled or not, so Telegram drops them on
 * the next call. Replies go out through the {@link NotificationPort}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "relay.telegram.polling.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class TelegramUpdatePoller {

  private final TelegramBotClient botClient;
  private final CommandFacade commandFacade;
  private final NotificationPort notificationPort;
  private final TelegramProperties properties;
  private final LogicExecutor executor;
  private final Executor commandTaskExecutor;

  private final AtomicLong nextOffset = new AtomicLong(0);

  @Scheduled(fixedDelayString = "${relay.telegram.polling.fixed-delay-ms:1000}")
  public void poll() {
    List<TelegramUpdate> updates =
        executor.executeOrCatch(
            () -> botClient.getUpdates(nextOffset.get(), properties.polling().timeoutSeconds()),
            e -> {
              log.warn("[TelegramPoller] getUpdates failed: {}", e.getMessage());
              return List.of();
            },
            TaskContext.of("Telegram", "Poll"));

    for (TelegramUpdate update : updates) {
      nextOffset.accumulateAndGet(update.updateId() + 1, Math::max);
      TelegramMessage message = update.message();
      if (message != null && message.isCommand()) {
        dispatch(message);
      }
    }
  }

  long nextOffset() {
    return nextOffset.get();
  }

  private void dispatch(TelegramMessage message) {
    long chatId = message.chat().id();
    executor.executeOrCatch(
        () -> {
          commandTaskExecutor.execute(() -> reply(chatId, message.text()));
          return null;
        },
        e -> {
          log.warn("[TelegramPoller] Command from chat {} dropped: {}", chatId, e.getMessage());
          return null;
        },
        TaskContext.of("Telegram", "Dispatch", String.valueOf(chatId)));
  }

  private void reply(long chatId, String text) {
    CommandReply reply = commandFacade.handle(chatId, text);
    notificationPort.send(new NotificationMessage(chatId, reply.text(), reply.markdown()));
  }
}
