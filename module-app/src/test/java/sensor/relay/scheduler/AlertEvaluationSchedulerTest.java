package sensor.relay.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import sensor.relay.error.exception.FetchFailure;
import sensor.relay.service.alert.AlertEvaluationService;
import sensor.relay.service.alert.EvaluationMetrics;
import sensor.relay.service.alert.EvaluationReport;
import sensor.relay.support.TestLogicExecutors;

@ExtendWith(MockitoExtension.class)
@DisplayName("AlertEvaluationScheduler")
class AlertEvaluationSchedulerTest {

  @Mock private AlertEvaluationService evaluationService;

  private SimpleMeterRegistry meterRegistry;
  private AlertEvaluationScheduler scheduler;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    scheduler =
        new AlertEvaluationScheduler(
            evaluationService, new EvaluationMetrics(meterRegistry), TestLogicExecutors.plain());
  }

  @Test
  @DisplayName("records the report of a successful tick")
  void recordsReport() {
    given(evaluationService.evaluateOnce())
        .willReturn(new EvaluationReport(1, 2, 1, 1, 0, 1, 0, null));

    scheduler.evaluate();

    assertThat(meterRegistry.counter("relay.evaluation.ticks", "result", "fetched").count())
        .isEqualTo(1.0);
    assertThat(meterRegistry.counter("relay.evaluation.notifications", "result", "sent").count())
        .isEqualTo(1.0);
    assertThat(meterRegistry.counter("relay.evaluation.notifications", "result", "failed").count())
        .isEqualTo(1.0);
    assertThat(meterRegistry.counter("relay.evaluation.rearmed").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("counts fetch failures by kind")
  void recordsFetchFailure() {
    given(evaluationService.evaluateOnce())
        .willReturn(EvaluationReport.fetchFailed(FetchFailure.DECODE));

    scheduler.evaluate();

    assertThat(meterRegistry.counter("relay.evaluation.fetch.failures", "kind", "DECODE").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("a failing tick does not break the schedule")
  void failingTickIsContained() {
    given(evaluationService.evaluateOnce())
        .willThrow(new IllegalStateException("boom"))
        .willReturn(new EvaluationReport(0, 0, 0, 0, 0, 0, 0, null));

    assertThatCode(() -> scheduler.evaluate()).doesNotThrowAnyException();
    scheduler.evaluate();

    verify(evaluationService, times(2)).evaluateOnce();
    assertThat(meterRegistry.counter("relay.evaluation.ticks", "result", "fetched").count())
        .isEqualTo(1.0);
  }
}
