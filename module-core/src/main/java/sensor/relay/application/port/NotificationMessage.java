package sensor.relay.application.port;

import java.util.Objects;

/**
 * Text addressed to one subscriber.
 *
 * @param subscriberId chat id
 * @param text message body
 * @param markdown whether the body uses Markdown formatting
 */
public record NotificationMessage(long subscriberId, String text, boolean markdown) {

  public NotificationMessage {
    Objects.requireNonNull(text, "text");
  }

  public static NotificationMessage plain(long subscriberId, String text) {
    return new NotificationMessage(subscriberId, text, false);
  }

  public static NotificationMessage markdown(long subscriberId, String text) {
    return new NotificationMessage(subscriberId, text, true);
  }
}
