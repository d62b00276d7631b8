package sensor.relay.infrastructure.executor.policy;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import sensor.relay.infrastructure.executor.TaskContext;

/**
 * Records {@code logic.executor} timers tagged by component, operation and outcome.
 *
 * <p>dynamicValue is left out of the tags to keep cardinality bounded.
 */
@RequiredArgsConstructor
public class MetricsPolicy implements ExecutionPolicy {

  static final String TIMER_NAME = "logic.executor";

  private final MeterRegistry meterRegistry;

  @Override
  public void onSuccess(long elapsedNanos, TaskContext context) {
    record(context, "success", elapsedNanos);
  }

  @Override
  public void onFailure(Throwable error, long elapsedNanos, TaskContext context) {
    record(context, "failure", elapsedNanos);
  }

  private void record(TaskContext context, String outcome, long elapsedNanos) {
    Timer.builder(TIMER_NAME)
        .tag("component", context.component())
        .tag("operation", context.operation())
        .tag("outcome", outcome)
        .register(meterRegistry)
        .record(elapsedNanos, TimeUnit.NANOSECONDS);
  }
}
