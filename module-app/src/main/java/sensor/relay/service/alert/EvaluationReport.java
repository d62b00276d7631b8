package sensor.relay.service.alert;

import sensor.relay.error.exception.FetchFailure;

/**
 * Outcome of one evaluation tick.
 *
 * @param readings readings returned by the feed
 * @param checks (reading, subscriber, bound) combinations evaluated
 * @param notified notifications accepted by the transport
 * @param deliveryFailures notifications the transport rejected
 * @param suppressed violations that were already flagged
 * @param rearmed flags lowered because the reading came back in bounds
 * @param checkErrors checks that failed unexpectedly and were skipped
 * @param fetchFailure why the fetch failed, or null when it succeeded
 */
public record EvaluationReport(
    int readings,
    int checks,
    int notified,
    int deliveryFailures,
    int suppressed,
    int rearmed,
    int checkErrors,
    FetchFailure fetchFailure) {

  public static EvaluationReport fetchFailed(FetchFailure failure) {
    return new EvaluationReport(0, 0, 0, 0, 0, 0, 0, failure);
  }

  public boolean fetched() {
    return fetchFailure == null;
  }
}
