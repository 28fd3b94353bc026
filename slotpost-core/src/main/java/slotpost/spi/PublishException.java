package slotpost.spi;

import slotpost.model.ErrorKind;

import java.util.Objects;

/**
 * Classified publish failure thrown by a {@link Publisher}.
 *
 * @see TransientPublishException
 * @see AuthPublishException
 * @see ValidationPublishException
 * @see PublishTimeoutException
 */
public abstract class PublishException extends Exception {
    private final ErrorKind kind;

    protected PublishException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
