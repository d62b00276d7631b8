package sensor.relay.support;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import sensor.relay.application.port.NotificationMessage;
import sensor.relay.application.port.NotificationPort;

/**
 * Captures messages. Subscribers registered via {@link #failFor} get {@code false}; those
 * registered via {@link #throwFor} make the send throw.
 */
public class RecordingNotificationPort implements NotificationPort {

  private final List<NotificationMessage> sent = new ArrayList<>();
  private final Set<Long> failing = ConcurrentHashMap.newKeySet();
  private final Set<Long> throwing = ConcurrentHashMap.newKeySet();
  private Consumer<NotificationMessage> onSend = message -> {};

  public RecordingNotificationPort failFor(long subscriberId) {
    failing.add(subscriberId);
    return this;
  }

  public RecordingNotificationPort throwFor(long subscriberId) {
    throwing.add(subscriberId);
    return this;
  }

  /** Runs before a message is recorded, on the sending thread. */
  public RecordingNotificationPort onSend(Consumer<NotificationMessage> hook) {
    this.onSend = hook;
    return this;
  }

  @Override
  public synchronized boolean send(NotificationMessage message) {
    if (throwing.contains(message.subscriberId())) {
      throw new IllegalStateException("transport exploded for " + message.subscriberId());
    }
    if (failing.contains(message.subscriberId())) {
      return false;
    }
    onSend.accept(message);
    sent.add(message);
    return true;
  }

  @Override
  public String getChannelName() {
    return "recording";
  }

  public synchronized List<NotificationMessage> sent() {
    return List.copyOf(sent);
  }

  public synchronized List<NotificationMessage> sentTo(long subscriberId) {
    return sent.stream()
        .filter(m -> m.subscriberId() == subscriberId)
        .collect(Collectors.toList());
  }

  public synchronized void reset() {
    sent.clear();
  }
}
