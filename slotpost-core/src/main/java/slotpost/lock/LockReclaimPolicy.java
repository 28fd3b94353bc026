package slotpost.lock;

import slotpost.spi.MetricsExporter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Staleness rules shared by the lock managers: a holder is stale when the liveness
 * probe reports it dead, or when its lease is older than {@code staleAfter}.
 */
public final class LockReclaimPolicy {
    private final LivenessProbe probe;
    private final Duration staleAfter;
    private final LockEventListener listener;
    private final MetricsExporter metrics;
    private final Clock clock;

    /**
     * @param probe      liveness check; defaults to {@link ProcessLivenessProbe}
     * @param staleAfter maximum lease age, or {@code null} for no bound
     * @param listener   reclaim listener; defaults to {@link LockEventListener#LOGGING}
     * @param metrics    metrics exporter; defaults to {@link MetricsExporter#NOOP}
     * @param clock      time source; defaults to the UTC system clock
     */
    public LockReclaimPolicy(LivenessProbe probe, Duration staleAfter, LockEventListener listener,
        MetricsExporter metrics, Clock clock) {
        if (staleAfter != null && (staleAfter.isNegative() || staleAfter.isZero())) {
            throw new IllegalArgumentException("staleAfter must be positive");
        }
        this.probe = probe != null ? probe : ProcessLivenessProbe.INSTANCE;
        this.staleAfter = staleAfter;
        this.listener = listener != null ? listener : LockEventListener.LOGGING;
        this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public static LockReclaimPolicy defaults() {
        return new LockReclaimPolicy(null, null, null, null, null);
    }

    public Clock clock() {
        return clock;
    }

    /**
     * Returns why {@code holder} should be reclaimed, or empty if it is live.
     */
    public Optional<String> staleReason(LockOwner holder) {
        Objects.requireNonNull(holder, "holder");
        if (!probe.isAlive(holder)) {
            return Optional.of("holder process " + holder.pid() + " on " + holder.host() + " is not running");
        }
        if (staleAfter != null && holder.acquiredAt().plus(staleAfter).isBefore(clock.instant())) {
            return Optional.of("lease older than " + staleAfter);
        }
        return Optional.empty();
    }

    /**
     * Publishes a reclaim to the listener and metrics.
     */
    public void reclaimed(LockOwner previous, LockOwner next, String reason) {
        metrics.incrementStaleLockReclaimed();
        listener.staleLockReclaimed(new StaleLockReclaimed(previous, next, reason, clock.instant()));
    }
}
