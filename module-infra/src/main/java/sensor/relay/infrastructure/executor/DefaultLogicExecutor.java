package sensor.relay.infrastructure.executor;

import java.util.Objects;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import sensor.relay.common.function.ThrowingSupplier;
import sensor.relay.infrastructure.executor.policy.ExecutionPipeline;
import sensor.relay.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * {@link LogicExecutor} on top of an {@link ExecutionPipeline}.
 *
 * <p>All variants share {@link #run}: the task goes through the pipeline and a failure is handed
 * to the variant's handler. Errors never reach a handler. A translator that throws has its own
 * exception used as the failure.
 */
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  private final ExecutionPipeline pipeline;
  private final ExceptionTranslator translator;

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return executeWithTranslation(task, translator, context);
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(recovery, "recovery");
    return run(task, context, failure -> recovery.apply(translate(translator, failure, context)));
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator customTranslator, TaskContext context) {
    Objects.requireNonNull(customTranslator, "customTranslator");
    return run(
        task,
        context,
        failure -> {
          throw translate(customTranslator, failure, context);
        });
  }

  @Override
  public <T> T executeWithFallback(
      ThrowingSupplier<T> task, Function<Throwable, T> fallback, TaskContext context) {
    Objects.requireNonNull(fallback, "fallback");
    return run(task, context, fallback);
  }

  private <T> T run(
      ThrowingSupplier<T> task, TaskContext context, Function<Throwable, T> onFailure) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(context, "context");
    try {
      return pipeline.executeRaw(task, context);
    } catch (Error e) {
      throw e;
    } catch (Throwable failure) {
      return onFailure.apply(failure);
    }
  }

  private static RuntimeException translate(
      ExceptionTranslator translator, Throwable failure, TaskContext context) {
    RuntimeException translated;
    try {
      translated = translator.translate(failure, context);
    } catch (RuntimeException translatorFailure) {
      return translatorFailure;
    }
    if (translated == null) {
      return new IllegalStateException("Translator returned null for " + context.toTaskName());
    }
    return translated;
  }
}
