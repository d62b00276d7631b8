package sensor.relay.infrastructure.executor.policy;

import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import sensor.relay.error.exception.base.ClientBaseException;
import sensor.relay.infrastructure.executor.TaskContext;

/**
 * Logs each task run.
 *
 * <ul>
 *   <li>start / success: DEBUG
 *   <li>success slower than {@code slowMs}: INFO with a SLOW tag
 *   <li>failure: WARN with the error type; user errors ({@link ClientBaseException}) at DEBUG
 * </ul>
 *
 * Full stack traces are left to whoever handles the failure.
 */
@Slf4j
public class LoggingPolicy implements ExecutionPolicy {

  private static final long MAX_SLOW_MS = 60_000L;

  private final long slowThresholdMs;
  private final long slowThresholdNanos;

  /**
   * @param slowMs slow threshold in milliseconds; 0 or less disables the SLOW tag
   */
  public LoggingPolicy(long slowMs) {
    long clamped = Math.max(0L, Math.min(slowMs, MAX_SLOW_MS));
    this.slowThresholdMs = clamped;
    this.slowThresholdNanos = clamped > 0 ? TimeUnit.MILLISECONDS.toNanos(clamped) : Long.MAX_VALUE;
  }

  @Override
  public void before(TaskContext context) {
    if (!log.isDebugEnabled()) return;
    log.debug("[Task:START] {}", TaskLogSupport.safeTaskName(context));
  }

  @Override
  public void onSuccess(long elapsedNanos, TaskContext context) {
    if (elapsedNanos >= slowThresholdNanos) {
      log.info(
          "[Task:SLOW] {}, elapsed={}, threshold={}ms",
          TaskLogSupport.safeTaskName(context),
          TaskLogSupport.formatDuration(elapsedNanos),
          slowThresholdMs);
      return;
    }
    if (!log.isDebugEnabled()) return;
    log.debug(
        "[Task:SUCCESS] {}, elapsed={}",
        TaskLogSupport.safeTaskName(context),
        TaskLogSupport.formatDuration(elapsedNanos));
  }

  @Override
  public void onFailure(Throwable error, long elapsedNanos, TaskContext context) {
    String taskName = TaskLogSupport.safeTaskName(context);
    String elapsed = TaskLogSupport.formatDuration(elapsedNanos);
    String errorType = error.getClass().getSimpleName();

    if (error instanceof ClientBaseException) {
      log.debug("[Task:REJECTED] {}, elapsed={}, errorType={}", taskName, elapsed, errorType);
      return;
    }
    log.warn(
        "[Task:FAILURE] {}, elapsed={}, errorType={}, message={}",
        taskName,
        elapsed,
        errorType,
        error.getMessage());
  }
}
