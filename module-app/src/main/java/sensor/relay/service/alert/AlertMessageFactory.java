package sensor.relay.service.alert;

import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import sensor.relay.application.port.NotificationMessage;
import sensor.relay.domain.model.Bound;
import sensor.relay.domain.model.BoundCheck;
import sensor.relay.sensor.SensorDirectory;

/** Builds the alert text for a bound that has just been crossed. */
@Component
@RequiredArgsConstructor
public class AlertMessageFactory {

  private final SensorDirectory sensorDirectory;

  public NotificationMessage breach(long subscriberId, BoundCheck check) {
    String direction =
        check.bound() == Bound.MIN ? "dropped below the threshold" : "rose above the threshold";
    String text =
        String.format(
            Locale.ROOT,
            "⚠ %s at %s %s: %.1f (threshold: %.1f)",
            check.reading().metric(),
            sensorDirectory.displayName(check.reading().sensorId()),
            direction,
            check.reading().value(),
            check.limit());
    return NotificationMessage.plain(subscriberId, text);
  }
}
