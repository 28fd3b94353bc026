package slotpost.execute;

import slotpost.model.ErrorKind;
import slotpost.model.ScheduleEntry;

/**
 * One publish attempt made during a run.
 *
 * @param entry     the entry as committed after the attempt
 * @param outcome   {@link ExecutionOutcome#POSTED}, {@link ExecutionOutcome#RETRY_SCHEDULED}
 *                  or {@link ExecutionOutcome#FAILED}
 * @param errorKind failure classification, {@code null} when posted
 * @param error     failure message, {@code null} when posted
 * @param latencyMs time spent in the publisher call
 */
public record PublishAttempt(
    ScheduleEntry entry,
    ExecutionOutcome outcome,
    ErrorKind errorKind,
    String error,
    long latencyMs
) {}
