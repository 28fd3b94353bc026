package slotpost.model;

/**
 * Classification of a publish failure.
 */
public enum ErrorKind {
    /** Network blip, rate limit, 5xx. */
    TRANSIENT,
    /** Credentials rejected; retrying will not help until an operator intervenes. */
    AUTH,
    /** Payload rejected by the endpoint. */
    VALIDATION,
    /** Publish call exceeded its time bound. */
    TIMEOUT;

    public boolean isRetriable() {
        return this == TRANSIENT || this == TIMEOUT;
    }
}
