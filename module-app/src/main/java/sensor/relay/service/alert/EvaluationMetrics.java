package sensor.relay.service.alert;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** {@code relay.evaluation.*} counters. */
@Component
@RequiredArgsConstructor
public class EvaluationMetrics {

  private final MeterRegistry meterRegistry;

  public void record(EvaluationReport report) {
    counter("relay.evaluation.ticks", "result", report.fetched() ? "fetched" : "fetch_failed")
        .increment();
    if (!report.fetched()) {
      counter("relay.evaluation.fetch.failures", "kind", report.fetchFailure().name()).increment();
      return;
    }
    counter("relay.evaluation.notifications", "result", "sent").increment(report.notified());
    counter("relay.evaluation.notifications", "result", "failed")
        .increment(report.deliveryFailures());
    counter("relay.evaluation.suppressed").increment(report.suppressed());
    counter("relay.evaluation.rearmed").increment(report.rearmed());
  }

  private Counter counter(String name, String... tags) {
    return Counter.builder(name).tags(tags).register(meterRegistry);
  }
}
