package sensor.relay.error.exception;

import sensor.relay.error.CommonErrorCode;
import sensor.relay.error.exception.base.ServerBaseException;

/** Thrown at startup when a required secret is absent. The process must not keep running. */
public class MissingCredentialException extends ServerBaseException {

  public MissingCredentialException(String credentialName) {
    super(CommonErrorCode.MISSING_CREDENTIAL, credentialName);
  }
}
