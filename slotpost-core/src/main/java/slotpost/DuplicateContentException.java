package slotpost;

/**
 * A live (non-SKIPPED) entry already exists for the content key.
 */
public final class DuplicateContentException extends ScheduleConflictException {
    private final String contentKey;

    public DuplicateContentException(String contentKey) {
        super("Content already scheduled: " + contentKey);
        this.contentKey = contentKey;
    }

    public String contentKey() {
        return contentKey;
    }
}
