package sensor.relay.infrastructure.executor;

import java.util.function.Function;
import sensor.relay.common.function.ThrowingSupplier;
import sensor.relay.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * Execution template used instead of try/catch in service code.
 *
 * <p>Every task runs through the {@link sensor.relay.infrastructure.executor.policy.ExecutionPipeline}
 * (logging, timing). {@link Error}s are never caught.
 */
public interface LogicExecutor {

  /** Runs the task; failures are translated by the default translator and rethrown. */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /** Runs the task; on failure hands the translated exception to {@code recovery}. */
  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  /** Runs the task; failures are translated by {@code translator} and rethrown. */
  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);

  /** Runs the task; on failure hands the original, untranslated exception to {@code fallback}. */
  <T> T executeWithFallback(
      ThrowingSupplier<T> task, Function<Throwable, T> fallback, TaskContext context);
}
