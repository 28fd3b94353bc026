package slotpost.execute;

import slotpost.model.EntryState;
import slotpost.model.ErrorKind;
import slotpost.model.ScheduleEntry;

import java.util.EnumSet;
import java.util.Set;

/**
 * Retries {@link ErrorKind#isRetriable() retriable} failures until {@code maxAttempts}
 * attempts were made, and lets the sweeper recover an entry at most
 * {@code maxRecoveryRounds} times. Fatal kinds fail immediately and are never recovered.
 */
public final class BoundedRetryPolicy implements RetryPolicy {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final int DEFAULT_MAX_RECOVERY_ROUNDS = 3;

    private final int maxAttempts;
    private final int maxRecoveryRounds;
    private final Set<ErrorKind> retriable;

    public BoundedRetryPolicy() {
        this(DEFAULT_MAX_ATTEMPTS, DEFAULT_MAX_RECOVERY_ROUNDS);
    }

    public BoundedRetryPolicy(int maxAttempts, int maxRecoveryRounds) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (maxRecoveryRounds < 0) {
            throw new IllegalArgumentException("maxRecoveryRounds must be >= 0");
        }
        this.maxAttempts = maxAttempts;
        this.maxRecoveryRounds = maxRecoveryRounds;
        EnumSet<ErrorKind> kinds = EnumSet.noneOf(ErrorKind.class);
        for (ErrorKind kind : ErrorKind.values()) {
            if (kind.isRetriable()) {
                kinds.add(kind);
            }
        }
        this.retriable = Set.copyOf(kinds);
    }

    @Override
    public Decision onFailure(int attempts, ErrorKind kind) {
        if (retriable.contains(kind) && attempts < maxAttempts) {
            return Decision.RETRY;
        }
        return Decision.FAIL;
    }

    @Override
    public boolean isRecoverable(ScheduleEntry entry) {
        return entry.state() == EntryState.FAILED
            && entry.lastErrorKind() != null
            && retriable.contains(entry.lastErrorKind())
            && entry.recoveryRounds() < maxRecoveryRounds;
    }

    @Override
    public Set<ErrorKind> retriableKinds() {
        return retriable;
    }

    @Override
    public int maxAttempts() {
        return maxAttempts;
    }

    @Override
    public int maxRecoveryRounds() {
        return maxRecoveryRounds;
    }
}
