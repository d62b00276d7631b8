package sensor.relay.command;

import java.util.Locale;
import java.util.Optional;

/** Commands understood by the bot, in the order /help lists them. */
public enum CommandType {
  START("/start", "", "Show the welcome message"),
  HELP("/help", "", "List the available commands"),
  STATUS("/status", "", "Show the current sensor readings"),
  SET("/set", "<sensor> <metric> <min|max> <value>", "Set a threshold"),
  CLEAR("/clear", "<sensor> <metric> <min|max>", "Remove a threshold"),
  THRESHOLDS("/thresholds", "", "List your thresholds");

  private final String command;
  private final String arguments;
  private final String description;

  CommandType(String command, String arguments, String description) {
    this.command = command;
    this.arguments = arguments;
    this.description = description;
  }

  public String command() {
    return command;
  }

  public String description() {
    return description;
  }

  public String usage() {
    return arguments.isEmpty() ? command : command + " " + arguments;
  }

  public static Optional<CommandType> fromCommand(String token) {
    String normalized = token.toLowerCase(Locale.ROOT);
    for (CommandType type : values()) {
      if (type.command.equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
