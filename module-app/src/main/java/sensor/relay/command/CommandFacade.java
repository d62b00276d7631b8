package sensor.relay.command;

import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sensor.relay.application.port.SensorFeedPort;
import sensor.relay.domain.model.AlertFlagKey;
import sensor.relay.domain.model.Bound;
import sensor.relay.domain.model.SubscriberThresholds;
import sensor.relay.domain.model.ThresholdKey;
import sensor.relay.domain.service.AlertFlagTable;
import sensor.relay.domain.service.ThresholdStore;
import sensor.relay.error.exception.base.ClientBaseException;
import sensor.relay.infrastructure.executor.LogicExecutor;
import sensor.relay.infrastructure.executor.TaskContext;
import sensor.relay.sensor.SensorDirectory;
import sensor.relay.service.status.StatusRenderer;

/**
 * Entry point for subscriber commands.
 *
 * <p>Threshold commands change the {@link ThresholdStore} synchronously. /status fetches the feed
 * on demand and only formats the result; alert state is not touched. Rejected commands come back
 * as a reply carrying the rejection message.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommandFacade {

  static final String STATUS_UNAVAILABLE = "❌ Could not retrieve sensor data.";
  static final String UNEXPECTED_FAILURE = "❌ Something went wrong. Please try again later.";

  private final BotCommandParser parser;
  private final ThresholdStore thresholdStore;
  private final AlertFlagTable alertFlags;
  private final SensorFeedPort sensorFeed;
  private final StatusRenderer statusRenderer;
  private final SensorDirectory sensorDirectory;
  private final LogicExecutor executor;

  public CommandReply handle(long subscriberId, String text) {
    return executor.executeOrCatch(
        () -> dispatch(subscriberId, parser.parse(text)),
        e -> reject(subscriberId, e),
        TaskContext.of("Command", "Handle", String.valueOf(subscriberId)));
  }

  CommandReply dispatch(long subscriberId, BotCommand command) {
    if (command instanceof BotCommand.Start) {
      return CommandReply.plain(
          "👋 Welcome! I watch the sensor feed and message you when a reading crosses one of"
              + " your thresholds.\nSend /help to see the commands.");
    }
    if (command instanceof BotCommand.Help) {
      return CommandReply.markdown(help());
    }
    if (command instanceof BotCommand.Status) {
      return status();
    }
    if (command instanceof BotCommand.SetThreshold set) {
      return setThreshold(subscriberId, set.key(), set.value());
    }
    if (command instanceof BotCommand.ClearThreshold clear) {
      return clearThreshold(subscriberId, clear.key());
    }
    if (command instanceof BotCommand.ListThresholds) {
      return listThresholds(subscriberId);
    }
    throw new IllegalStateException("Unhandled command: " + command);
  }

  public CommandReply setThreshold(long subscriberId, ThresholdKey key, double value) {
    thresholdStore.set(subscriberId, key, value);
    log.info(
        "[Command] Subscriber {} set {} {} = {}",
        subscriberId,
        key.sensorId(),
        key.boundKey(),
        value);
    String marker = key.bound() == Bound.MIN ? "🔻" : "🔺";
    return CommandReply.plain(
        String.format(
            Locale.ROOT,
            "%s %s threshold for %s at %s: %.1f",
            marker,
            key.bound().name(),
            key.metric(),
            sensorDirectory.displayName(key.sensorId()),
            value));
  }

  public CommandReply clearThreshold(long subscriberId, ThresholdKey key) {
    boolean removed = thresholdStore.clear(subscriberId, key);
    alertFlags.lower(AlertFlagKey.of(subscriberId, key));
    String target =
        key.bound().name()
            + " threshold for "
            + key.metric()
            + " at "
            + sensorDirectory.displayName(key.sensorId());
    if (!removed) {
      return CommandReply.plain("No " + target + " was set.");
    }
    log.info("[Command] Subscriber {} cleared {} {}", subscriberId, key.sensorId(), key.boundKey());
    return CommandReply.plain("🗑 Removed " + target + ".");
  }

  public CommandReply listThresholds(long subscriberId) {
    SubscriberThresholds thresholds = thresholdStore.get(subscriberId);
    if (thresholds.isEmpty()) {
      return CommandReply.plain(
          "You have no thresholds yet. Example: "
              + CommandType.SET.command()
              + " sensor1 temperature max 25");
    }
    StringBuilder text = new StringBuilder("Your thresholds:");
    for (Map.Entry<ThresholdKey, Double> entry : thresholds.asMap().entrySet()) {
      ThresholdKey key = entry.getKey();
      text.append(
          String.format(
              Locale.ROOT,
              "%n• %s %s %s: %.1f",
              sensorDirectory.displayName(key.sensorId()),
              key.metric(),
              key.bound().keyword(),
              entry.getValue()));
    }
    return CommandReply.plain(text.toString());
  }

  /** Immediate fetch and render. Never partial: any failure yields the unavailable text. */
  public CommandReply status() {
    return executor.executeOrCatch(
        () -> CommandReply.markdown(statusRenderer.render(sensorFeed.fetchReadings())),
        e -> {
          log.warn("[Command] Status request failed: {}", e.getMessage());
          return CommandReply.plain(STATUS_UNAVAILABLE);
        },
        TaskContext.of("Command", "Status"));
  }

  private static String help() {
    StringBuilder text = new StringBuilder("*Commands*\n");
    for (CommandType type : CommandType.values()) {
      text.append("\n`").append(type.usage()).append("` - ").append(type.description());
    }
    return text.toString();
  }

  private CommandReply reject(long subscriberId, Throwable e) {
    if (e instanceof ClientBaseException) {
      return CommandReply.plain("❌ " + e.getMessage());
    }
    log.error(
        "[Command] Unexpected failure for subscriber {}: {}", subscriberId, e.getMessage(), e);
    return CommandReply.plain(UNEXPECTED_FAILURE);
  }
}
