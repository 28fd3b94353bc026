package slotpost.spi;

import slotpost.model.ErrorKind;

/**
 * Retriable endpoint failure such as a network error, rate limit or 5xx.
 */
public class TransientPublishException extends PublishException {

    public TransientPublishException(String message) {
        super(ErrorKind.TRANSIENT, message, null);
    }

    public TransientPublishException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT, message, cause);
    }
}
