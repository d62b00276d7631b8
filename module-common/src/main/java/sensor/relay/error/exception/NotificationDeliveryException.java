package sensor.relay.error.exception;

import sensor.relay.error.CommonErrorCode;
import sensor.relay.error.exception.base.ServerBaseException;

public class NotificationDeliveryException extends ServerBaseException {

  public NotificationDeliveryException(long chatId, String reason) {
    super(CommonErrorCode.NOTIFICATION_DELIVERY_FAILED, chatId, reason);
  }

  public NotificationDeliveryException(long chatId, String reason, Throwable cause) {
    super(CommonErrorCode.NOTIFICATION_DELIVERY_FAILED, cause, chatId, reason);
  }
}
