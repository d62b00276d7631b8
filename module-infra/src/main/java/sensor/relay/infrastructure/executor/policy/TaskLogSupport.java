package sensor.relay.infrastructure.executor.policy;

import java.util.Locale;
import java.util.regex.Pattern;
import sensor.relay.infrastructure.executor.TaskContext;

final class TaskLogSupport {

  private static final String UNKNOWN = "unknown";
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private TaskLogSupport() {}

  static String safeTaskName(TaskContext context) {
    if (context == null) return UNKNOWN;
    // control characters and line breaks would split one log line into several
    String normalized = WHITESPACE.matcher(context.toTaskName()).replaceAll(" ").trim();
    return normalized.isEmpty() ? UNKNOWN : normalized;
  }

  static String formatDuration(long elapsedNanos) {
    return String.format(Locale.ROOT, "%.3fms", elapsedNanos / 1_000_000d);
  }
}
