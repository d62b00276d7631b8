package sensor.relay.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import sensor.relay.infrastructure.executor.LogicExecutor;
import sensor.relay.infrastructure.executor.TaskContext;
import sensor.relay.service.alert.AlertEvaluationService;
import sensor.relay.service.alert.EvaluationMetrics;
import sensor.relay.service.alert.EvaluationReport;

/**
 * Drives the alert loop.
 *
 * <p>fixedDelay: the next tick starts {@code relay.evaluation.fixed-delay-ms} after the previous
 * one finished, so ticks never overlap. A failing tick is logged and the schedule continues.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "relay.evaluation.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class AlertEvaluationScheduler {

  private final AlertEvaluationService evaluationService;
  private final EvaluationMetrics evaluationMetrics;
  private final LogicExecutor executor;

  @Scheduled(
      fixedDelayString = "${relay.evaluation.fixed-delay-ms:600000}",
      initialDelayString = "${relay.evaluation.initial-delay-ms:10000}")
  public void evaluate() {
    executor.executeOrCatch(
        () -> {
          EvaluationReport report = evaluationService.evaluateOnce();
          evaluationMetrics.record(report);
          log.info("[Scheduler] Evaluation tick finished: {}", report);
          return report;
        },
        e -> {
          log.error("[Scheduler] Evaluation tick aborted: {}", e.getMessage(), e);
          return null;
        },
        TaskContext.of("Scheduler", "Evaluation.Tick"));
  }
}
