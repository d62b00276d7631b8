package sensor.relay.command;

/**
 * @param text reply body
 * @param markdown whether the body is Markdown
 */
public record CommandReply(String text, boolean markdown) {

  public static CommandReply plain(String text) {
    return new CommandReply(text, false);
  }

  public static CommandReply markdown(String text) {
    return new CommandReply(text, true);
  }
}
