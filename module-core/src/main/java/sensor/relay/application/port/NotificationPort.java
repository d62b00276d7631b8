package sensor.relay.application.port;

/**
 * Delivers a message to a subscriber.
 *
 * <p>Best effort: implementations log failures and report them through the return value instead
 * of throwing, so one failed delivery never stops the others.
 */
public interface NotificationPort {

  /**
   * @return true if the transport accepted the message
   */
  boolean send(NotificationMessage message);

  String getChannelName();
}
