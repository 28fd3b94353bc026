package slotpost.spi;

import java.time.Instant;

/**
 * Client of the content endpoint.
 *
 * <p>Called from a dedicated worker thread and bounded by the executor's publish
 * timeout; implementations should respond to interruption.
 */
@FunctionalInterface
public interface Publisher {

    /**
     * Publishes one payload.
     *
     * @param payload       opaque entry payload
     * @param scheduledTime the slot the entry was scheduled for
     * @return the endpoint's identifier for the new post
     * @throws PublishException classified failure
     */
    String publish(String payload, Instant scheduledTime) throws PublishException;
}
