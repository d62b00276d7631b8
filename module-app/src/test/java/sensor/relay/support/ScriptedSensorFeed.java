package sensor.relay.support;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import sensor.relay.application.port.SensorFeedPort;
import sensor.relay.domain.model.Reading;

/** Sensor feed that replays queued responses; a queued exception is thrown instead. */
public class ScriptedSensorFeed implements SensorFeedPort {

  private final Deque<Object> responses = new ArrayDeque<>();
  private int calls;

  public ScriptedSensorFeed thenReturn(Reading... readings) {
    responses.add(List.of(readings));
    return this;
  }

  public ScriptedSensorFeed thenFail(RuntimeException failure) {
    responses.add(failure);
    return this;
  }

  public int calls() {
    return calls;
  }

  @Override
  @SuppressWarnings("unchecked")
  public List<Reading> fetchReadings() {
    calls++;
    Object next = responses.poll();
    if (next == null) {
      throw new IllegalStateException("No scripted response left");
    }
    if (next instanceof RuntimeException failure) {
      throw failure;
    }
    return (List<Reading>) next;
  }
}
