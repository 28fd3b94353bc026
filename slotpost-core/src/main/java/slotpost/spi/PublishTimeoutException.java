package slotpost.spi;

import slotpost.model.ErrorKind;

import java.time.Duration;

/**
 * The publish call did not complete within its bound. Raised by the executor when
 * it abandons a call, or by a publisher enforcing its own deadline.
 */
public class PublishTimeoutException extends PublishException {

    public PublishTimeoutException(String message) {
        super(ErrorKind.TIMEOUT, message, null);
    }

    public PublishTimeoutException(Duration timeout, Throwable cause) {
        super(ErrorKind.TIMEOUT, "Publish did not complete within " + timeout, cause);
    }
}
