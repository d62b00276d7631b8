package sensor.relay.command;

import java.util.Arrays;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import sensor.relay.domain.model.Bound;
import sensor.relay.domain.model.ThresholdKey;
import sensor.relay.error.exception.InvalidCommandException;
import sensor.relay.sensor.SensorDirectory;

/**
 * Parses chat text into a {@link BotCommand}.
 *
 * <p>Accepts the {@code /command@BotName} form Telegram uses in group chats. Decimal commas are
 * accepted in values ({@code 21,5}). Every rejection is an {@link InvalidCommandException} whose
 * message can be sent back to the user unchanged.
 */
@Component
@RequiredArgsConstructor
public class BotCommandParser {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final SensorDirectory sensorDirectory;

  public BotCommand parse(String text) {
    if (text == null || !text.strip().startsWith("/")) {
      throw new InvalidCommandException("Commands start with '/'. Send /help for the list.");
    }
    String[] tokens = WHITESPACE.split(text.strip());
    String command = stripBotName(tokens[0]);
    String[] args = Arrays.copyOfRange(tokens, 1, tokens.length);

    CommandType type =
        CommandType.fromCommand(command)
            .orElseThrow(() -> InvalidCommandException.unknownCommand(command));

    switch (type) {
      case START:
        return new BotCommand.Start();
      case HELP:
        return new BotCommand.Help();
      case STATUS:
        return new BotCommand.Status();
      case THRESHOLDS:
        return new BotCommand.ListThresholds();
      case SET:
        requireArity(type, args, 4);
        return new BotCommand.SetThreshold(key(args), parseValue(args[3]));
      case CLEAR:
        requireArity(type, args, 3);
        return new BotCommand.ClearThreshold(key(args));
      default:
        throw InvalidCommandException.unknownCommand(command);
    }
  }

  private ThresholdKey key(String[] args) {
    String sensorId = sensorDirectory.resolve(args[0]);
    Bound bound =
        Bound.fromKeyword(args[2])
            .orElseThrow(
                () ->
                    new InvalidCommandException(
                        "Direction must be 'min' or 'max', got: " + args[2]));
    return ThresholdKey.of(sensorId, args[1], bound);
  }

  private static double parseValue(String raw) {
    double value;
    try {
      value = Double.parseDouble(raw.replace(',', '.'));
    } catch (NumberFormatException e) {
      throw InvalidCommandException.invalidValue(raw);
    }
    if (!Double.isFinite(value)) {
      throw InvalidCommandException.invalidValue(raw);
    }
    return value;
  }

  private static void requireArity(CommandType type, String[] args, int expected) {
    if (args.length != expected) {
      throw new InvalidCommandException("Usage: " + type.usage());
    }
  }

  private static String stripBotName(String command) {
    int at = command.indexOf('@');
    return at < 0 ? command : command.substring(0, at);
  }
}
