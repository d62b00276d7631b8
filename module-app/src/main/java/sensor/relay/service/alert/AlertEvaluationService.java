package sensor.relay.service.alert;

import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sensor.relay.application.port.NotificationPort;
import sensor.relay.application.port.SensorFeedPort;
import sensor.relay.domain.model.AlertFlagKey;
import sensor.relay.domain.model.BoundCheck;
import sensor.relay.domain.model.Reading;
import sensor.relay.domain.model.SubscriberThresholds;
import sensor.relay.domain.service.AlertFlagTable;
import sensor.relay.domain.service.BreachDetector;
import sensor.relay.domain.service.ThresholdStore;
import sensor.relay.error.exception.FetchFailure;
import sensor.relay.error.exception.SensorFetchException;
import sensor.relay.infrastructure.executor.LogicExecutor;
import sensor.relay.infrastructure.executor.TaskContext;

/**
 * One pass of the alert loop: fetch, compare, notify on edges.
 *
 * <h3>Edge-triggered policy</h3>
 *
 * <ul>
 *   <li>violation, flag lowered: raise the flag, send one notification
 *   <li>violation, flag raised: nothing (repeat suppressed)
 *   <li>no violation: lower the flag so the next violation notifies again
 * </ul>
 *
 * <p>Thresholds are never removed by the loop; only the clear command does that. The flag is
 * raised before sending, so a failed delivery is not retried on the next tick.
 *
 * <p>The pass reads a snapshot of the threshold store and holds no lock while sending. A threshold
 * set during a pass is picked up on the next one at the latest.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertEvaluationService {

  private final SensorFeedPort sensorFeed;
  private final NotificationPort notificationPort;
  private final ThresholdStore thresholdStore;
  private final AlertFlagTable alertFlags;
  private final BreachDetector breachDetector;
  private final AlertMessageFactory messageFactory;
  private final LogicExecutor executor;

  public EvaluationReport evaluateOnce() {
    FetchResult fetch =
        executor.executeOrCatch(
            () -> FetchResult.of(sensorFeed.fetchReadings()),
            this::fetchFailed,
            TaskContext.of("Evaluator", "Fetch"));
    if (fetch.failure() != null) {
      return EvaluationReport.fetchFailed(fetch.failure());
    }

    Map<Long, SubscriberThresholds> snapshot = thresholdStore.snapshot();
    Tally tally = new Tally();
    for (Reading reading : fetch.readings()) {
      snapshot.forEach(
          (subscriberId, thresholds) -> evaluate(subscriberId, reading, thresholds, tally));
    }
    return tally.toReport(fetch.readings().size());
  }

  private void evaluate(
      long subscriberId, Reading reading, SubscriberThresholds thresholds, Tally tally) {
    for (BoundCheck check : breachDetector.check(reading, thresholds)) {
      tally.checks++;
      boolean ok =
          executor.executeOrCatch(
              () -> {
                apply(subscriberId, check, tally);
                return true;
              },
              e -> {
                log.error(
                    "[AlertEvaluator] Check failed for subscriber {} on {}: {}",
                    subscriberId,
                    check.key(),
                    e.getMessage(),
                    e);
                return false;
              },
              TaskContext.of("Evaluator", "Check", subscriberId + ":" + check.key().boundKey()));
      if (!ok) {
        tally.checkErrors++;
      }
    }
  }

  private void apply(long subscriberId, BoundCheck check, Tally tally) {
    AlertFlagKey flagKey = AlertFlagKey.of(subscriberId, check.key());

    if (!check.violated()) {
      if (alertFlags.lower(flagKey)) {
        tally.rearmed++;
        log.info(
            "[AlertEvaluator] {} back within {} for subscriber {} (value={})",
            check.key().sensorId(),
            check.key().boundKey(),
            subscriberId,
            check.reading().value());
      }
      return;
    }

    if (!alertFlags.raise(flagKey)) {
      tally.suppressed++;
      return;
    }
    // a clear that raced this pass removes the bound and lowers the flag; keep it lowered
    if (!thresholdStore.get(subscriberId).contains(check.key())) {
      alertFlags.lower(flagKey);
      log.debug(
          "[AlertEvaluator] {} {} was cleared by subscriber {} during the pass",
          check.key().sensorId(),
          check.key().boundKey(),
          subscriberId);
      return;
    }

    boolean delivered = notificationPort.send(messageFactory.breach(subscriberId, check));
    if (delivered) {
      tally.notified++;
      log.info(
          "[AlertEvaluator] Notified subscriber {}: {} {} (value={}, limit={})",
          subscriberId,
          check.key().sensorId(),
          check.key().boundKey(),
          check.reading().value(),
          check.limit());
    } else {
      tally.deliveryFailures++;
      log.warn(
          "[AlertEvaluator] Notification to subscriber {} for {} {} was not delivered",
          subscriberId,
          check.key().sensorId(),
          check.key().boundKey());
    }
  }

  private FetchResult fetchFailed(Throwable e) {
    if (e instanceof SensorFetchException sfe) {
      log.warn(
          "[AlertEvaluator] Sensor fetch failed ({}), skipping tick: {}",
          sfe.getFailure(),
          e.getMessage());
      return FetchResult.failed(sfe.getFailure());
    }
    log.error("[AlertEvaluator] Sensor fetch failed unexpectedly, skipping tick", e);
    return FetchResult.failed(FetchFailure.INTERNAL);
  }

  private record FetchResult(List<Reading> readings, FetchFailure failure) {

    static FetchResult of(List<Reading> readings) {
      return new FetchResult(readings, null);
    }

    static FetchResult failed(FetchFailure failure) {
      return new FetchResult(List.of(), failure);
    }
  }

  /** Counters of a single pass; confined to the evaluating thread. */
  private static final class Tally {
    int checks;
    int notified;
    int deliveryFailures;
    int suppressed;
    int rearmed;
    int checkErrors;

    EvaluationReport toReport(int readings) {
      return new EvaluationReport(
          readings, checks, notified, deliveryFailures, suppressed, rearmed, checkErrors, null);
    }
  }
}
