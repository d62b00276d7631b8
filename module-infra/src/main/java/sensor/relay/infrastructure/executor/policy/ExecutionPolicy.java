package sensor.relay.infrastructure.executor.policy;

import sensor.relay.infrastructure.executor.TaskContext;

/**
 * Cross-cutting hook around a task run by the {@link ExecutionPipeline}.
 *
 * <p>Policies observe, they never change the outcome: an exception thrown by a hook is logged and
 * dropped by the pipeline.
 */
public interface ExecutionPolicy {

  default void before(TaskContext context) {}

  default void onSuccess(long elapsedNanos, TaskContext context) {}

  default void onFailure(Throwable error, long elapsedNanos, TaskContext context) {}
}
