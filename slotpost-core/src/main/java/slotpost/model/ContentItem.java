package slotpost.model;

import java.util.Objects;

/**
 * One discovered item ready for scheduling.
 *
 * @param contentKey stable identity of the item; the schedule holds at most one live entry per key
 * @param payload    opaque text handed to the publisher
 */
public record ContentItem(String contentKey, String payload) {

    public ContentItem {
        Objects.requireNonNull(contentKey, "contentKey");
        Objects.requireNonNull(payload, "payload");
        if (contentKey.isBlank()) {
            throw new IllegalArgumentException("contentKey must not be blank");
        }
    }
}
