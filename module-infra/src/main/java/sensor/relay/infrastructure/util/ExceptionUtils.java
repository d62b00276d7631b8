package sensor.relay.infrastructure.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import reactor.core.Exceptions;

public class ExceptionUtils {

  /**
   * Strips async and Reactor wrappers ({@link CompletionException}, {@link ExecutionException},
   * the wrapper {@code Mono.block()} puts around checked exceptions) down to the original cause.
   */
  public static Throwable unwrapAsyncException(Throwable throwable) {
    Throwable cause = Exceptions.unwrap(throwable);
    while (cause instanceof CompletionException || cause instanceof ExecutionException) {
      Throwable next = cause.getCause();
      if (next == null) {
        return cause;
      }
      cause = Exceptions.unwrap(next);
    }
    return cause;
  }

  private ExceptionUtils() {
    // Utility class
  }
}
