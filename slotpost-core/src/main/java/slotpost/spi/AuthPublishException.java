package slotpost.spi;

import slotpost.model.ErrorKind;

/**
 * Credentials rejected by the endpoint. Not retried.
 */
public class AuthPublishException extends PublishException {

    public AuthPublishException(String message) {
        super(ErrorKind.AUTH, message, null);
    }

    public AuthPublishException(String message, Throwable cause) {
        super(ErrorKind.AUTH, message, cause);
    }
}
