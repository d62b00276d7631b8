package sensor.relay.infrastructure.executor;

import java.util.Objects;

/**
 * Structured task name, {@code component:operation:dynamicValue}.
 *
 * <p>component and operation become metric tags and must come from a small fixed set. dynamicValue
 * (chat id, sensor id, ...) is written to logs only.
 *
 * <pre>
 * TaskContext.of("SensorFeed", "Fetch", "/sensors")  -&gt; "SensorFeed:Fetch:/sensors"
 * TaskContext.of("Scheduler", "Evaluation.Tick")     -&gt; "Scheduler:Evaluation.Tick"
 * </pre>
 */
public record TaskContext(String component, String operation, String dynamicValue) {

  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  public static TaskContext of(String component, String operation, String dynamicValue) {
    return new TaskContext(component, operation, dynamicValue);
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
