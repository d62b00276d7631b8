package sensor.relay.error.exception;

/** Why a sensor feed fetch failed. */
public enum FetchFailure {
  /** Connection refused, timeout or non-2xx status. */
  TRANSPORT,
  /** Body was not valid JSON or did not have the expected shape. */
  DECODE,
  /** The client itself failed; never raised for a feed problem. */
  INTERNAL
}
