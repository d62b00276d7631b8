package sensor.relay.infrastructure.executor.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.util.concurrent.TimeoutException;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import sensor.relay.error.exception.FetchFailure;
import sensor.relay.error.exception.InternalSystemException;
import sensor.relay.error.exception.NotificationDeliveryException;
import sensor.relay.error.exception.SensorFetchException;
import sensor.relay.error.exception.base.BaseException;
import sensor.relay.infrastructure.executor.TaskContext;
import sensor.relay.infrastructure.util.ExceptionUtils;

/** Turns a technical exception into one of the relay's exceptions. */
@FunctionalInterface
public interface ExceptionTranslator {

  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * Decorator shared by every factory below.
   *
   * <ol>
   *   <li>{@link Error} is rethrown immediately
   *   <li>async and Reactor wrappers are unwrapped
   *   <li>a {@link BaseException} passes through unchanged
   *   <li>anything else goes to {@code inner}
   * </ol>
   */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = ExceptionUtils.unwrapAsyncException(e);
      if (unwrapped instanceof Error err) {
        throw err;
      }
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      return inner.translate(unwrapped, context);
    };
  }

  /** Wraps everything unknown into {@link InternalSystemException}. */
  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) ->
            new InternalSystemException("default-task:" + context.toTaskName(), unwrapped));
  }

  /**
   * Sensor feed translator.
   *
   * <ul>
   *   <li>non-2xx response: TRANSPORT
   *   <li>malformed JSON: DECODE
   *   <li>connect failure, timeout, other I/O: TRANSPORT
   * </ul>
   */
  static ExceptionTranslator forSensorFeed() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof WebClientResponseException wre) {
            return new SensorFetchException(
                FetchFailure.TRANSPORT, "HTTP " + wre.getStatusCode().value(), wre);
          }
          if (unwrapped instanceof JsonProcessingException jpe) {
            return new SensorFetchException(
                FetchFailure.DECODE, jpe.getOriginalMessage(), jpe);
          }
          if (unwrapped instanceof WebClientException
              || unwrapped instanceof TimeoutException
              || unwrapped instanceof IOException) {
            return new SensorFetchException(
                FetchFailure.TRANSPORT, rootMessage(unwrapped), unwrapped);
          }
          return new InternalSystemException("sensor-feed:" + context.operation(), unwrapped);
        });
  }

  /**
   * Telegram send translator: every transport or API failure becomes a {@link
   * NotificationDeliveryException} for the addressed chat.
   */
  static ExceptionTranslator forTelegram(long chatId) {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof WebClientResponseException wre) {
            return new NotificationDeliveryException(
                chatId, "HTTP " + wre.getStatusCode().value(), wre);
          }
          if (unwrapped instanceof WebClientException
              || unwrapped instanceof TimeoutException
              || unwrapped instanceof IOException) {
            return new NotificationDeliveryException(chatId, rootMessage(unwrapped), unwrapped);
          }
          return new InternalSystemException("telegram:" + context.operation(), unwrapped);
        });
  }

  private static String rootMessage(Throwable t) {
    Throwable root = t;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    String message = root.getMessage();
    return message == null ? root.getClass().getSimpleName() : message;
  }
}
