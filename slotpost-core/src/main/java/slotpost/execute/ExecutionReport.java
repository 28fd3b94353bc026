package slotpost.execute;

import slotpost.health.HealthReport;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Summary of one executor invocation.
 *
 * @param outcome     overall outcome: the last attempt's outcome, or {@code LOCK_HELD},
 *                    {@code NO_ACTION} or {@code STORE_ERROR}
 * @param attempts    publish attempts in slot order
 * @param recovered   entries re-enqueued by the recovery sweep
 * @param reconciled  entries found stuck IN_PROGRESS and settled as timed out
 * @param health      health evaluation at the end of the run, if one was made
 * @param startedAt   clock reading at start
 * @param finishedAt  clock reading at end
 */
public record ExecutionReport(
    ExecutionOutcome outcome,
    List<PublishAttempt> attempts,
    int recovered,
    int reconciled,
    HealthReport health,
    Instant startedAt,
    Instant finishedAt
) {

    public ExecutionReport {
        attempts = List.copyOf(attempts);
    }

    public Optional<HealthReport> healthReport() {
        return Optional.ofNullable(health);
    }

    public int posted() {
        return (int) attempts.stream().filter(a -> a.outcome() == ExecutionOutcome.POSTED).count();
    }
}
