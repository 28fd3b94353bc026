package slotpost.model;

import java.time.Instant;

/**
 * One row of the transition journal. Appended in the same transaction as the
 * entry update it describes; posted and failed rows form the publication archive.
 *
 * @param fromState {@code null} for the creation row
 */
public record StateTransition(
    long seq,
    String entryId,
    String contentKey,
    EntryState fromState,
    EntryState toState,
    int attempt,
    Instant scheduledTime,
    ErrorKind errorKind,
    String error,
    String externalPostId,
    Instant occurredAt
) {}
