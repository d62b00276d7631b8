package sensor.relay.command;

import java.util.Objects;
import sensor.relay.domain.model.ThresholdKey;

/** A parsed subscriber command. */
public sealed interface BotCommand
    permits BotCommand.Start,
        BotCommand.Help,
        BotCommand.Status,
        BotCommand.SetThreshold,
        BotCommand.ClearThreshold,
        BotCommand.ListThresholds {

  record Start() implements BotCommand {}

  record Help() implements BotCommand {}

  record Status() implements BotCommand {}

  record SetThreshold(ThresholdKey key, double value) implements BotCommand {
    public SetThreshold {
      Objects.requireNonNull(key, "key");
    }
  }

  record ClearThreshold(ThresholdKey key) implements BotCommand {
    public ClearThreshold {
      Objects.requireNonNull(key, "key");
    }
  }

  record ListThresholds() implements BotCommand {}
}
