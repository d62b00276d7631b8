package sensor.relay.infrastructure.executor.policy;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import sensor.relay.common.function.ThrowingSupplier;
import sensor.relay.infrastructure.executor.TaskContext;

/** Runs a task between the hooks of an ordered list of {@link ExecutionPolicy}. */
@Slf4j
public class ExecutionPipeline {

  private final List<ExecutionPolicy> policies;

  public ExecutionPipeline(List<ExecutionPolicy> policies) {
    Objects.requireNonNull(policies, "policies must not be null");
    this.policies = List.copyOf(policies);
  }

  /** Runs the task, propagating the original Throwable. */
  public <T> T executeRaw(ThrowingSupplier<T> task, TaskContext context) throws Throwable {
    Objects.requireNonNull(task, "task must not be null");
    Objects.requireNonNull(context, "context must not be null");

    long start = System.nanoTime();
    notifyPolicies(p -> p.before(context), context);
    T result;
    try {
      result = task.get();
    } catch (Throwable t) {
      long elapsed = System.nanoTime() - start;
      notifyPolicies(p -> p.onFailure(t, elapsed, context), context);
      throw t;
    }
    long elapsed = System.nanoTime() - start;
    notifyPolicies(p -> p.onSuccess(elapsed, context), context);
    return result;
  }

  private void notifyPolicies(Consumer<ExecutionPolicy> hook, TaskContext context) {
    for (ExecutionPolicy policy : policies) {
      try {
        hook.accept(policy);
      } catch (RuntimeException e) {
        log.warn(
            "[ExecutionPipeline] Policy {} failed for {}: {}",
            policy.getClass().getSimpleName(),
            TaskLogSupport.safeTaskName(context),
            e.toString());
      }
    }
  }
}
