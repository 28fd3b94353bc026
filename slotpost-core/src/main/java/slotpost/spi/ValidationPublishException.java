package slotpost.spi;

import slotpost.model.ErrorKind;

/**
 * Payload rejected by the endpoint. Not retried.
 */
public class ValidationPublishException extends PublishException {

    public ValidationPublishException(String message) {
        super(ErrorKind.VALIDATION, message, null);
    }

    public ValidationPublishException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
