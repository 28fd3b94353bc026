package slotpost.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import slotpost.model.EntrySource;
import slotpost.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code slotpost.scheduled} (tag {@code source}) - entries added to the schedule</li>
 *   <li>{@code slotpost.publish.posted} - entries published</li>
 *   <li>{@code slotpost.publish.retry} - failed attempts returned to PENDING</li>
 *   <li>{@code slotpost.publish.failed} - entries moved to FAILED</li>
 *   <li>{@code slotpost.recovery.requeued} - FAILED entries re-enqueued by the sweeper</li>
 *   <li>{@code slotpost.lock.contended} - runs skipped because the lock was held</li>
 *   <li>{@code slotpost.lock.reclaimed} - stale locks taken over</li>
 *   <li>{@code slotpost.purge.deleted} - finished entries removed by retention purges</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code slotpost.health.success.rate} - trailing-window success rate, NaN until known</li>
 *   <li>{@code slotpost.queue.pending} - PENDING entries at the end of the last run</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code slotpost.publish.latency.ms} - time spent in the publisher call</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter scheduledDiscovery;
    private final Counter scheduledFrontload;
    private final Counter posted;
    private final Counter retryScheduled;
    private final Counter failed;
    private final Counter recovered;
    private final Counter lockContended;
    private final Counter lockReclaimed;
    private final Counter purged;
    private final Gauge successRateGauge;
    private final Gauge pendingGauge;
    private final DistributionSummary publishLatency;

    private final AtomicLong successRateBits = new AtomicLong(Double.doubleToLongBits(Double.NaN));
    private final AtomicInteger pendingDepth = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "slotpost"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "slotpost");
    }

    /**
     * Creates an exporter with a custom metric name prefix, for running several schedulers
     * against one registry.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "blog.slotpost"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.scheduledDiscovery = Counter.builder(namePrefix + ".scheduled")
                .tag("source", "discovery")
                .description("Entries placed after the queue tail")
                .register(registry);
        this.scheduledFrontload = Counter.builder(namePrefix + ".scheduled")
                .tag("source", "frontload")
                .description("Entries placed on the front-load path")
                .register(registry);
        this.posted = Counter.builder(namePrefix + ".publish.posted")
                .description("Entries published successfully")
                .register(registry);
        this.retryScheduled = Counter.builder(namePrefix + ".publish.retry")
                .description("Failed attempts returned to PENDING")
                .register(registry);
        this.failed = Counter.builder(namePrefix + ".publish.failed")
                .description("Entries moved to FAILED")
                .register(registry);
        this.recovered = Counter.builder(namePrefix + ".recovery.requeued")
                .description("FAILED entries re-enqueued by the recovery sweeper")
                .register(registry);
        this.lockContended = Counter.builder(namePrefix + ".lock.contended")
                .description("Runs skipped because a live holder owned the lock")
                .register(registry);
        this.lockReclaimed = Counter.builder(namePrefix + ".lock.reclaimed")
                .description("Locks reclaimed from a dead or expired holder")
                .register(registry);
        this.purged = Counter.builder(namePrefix + ".purge.deleted")
                .description("Finished entries removed by retention purges")
                .register(registry);

        this.successRateGauge = Gauge.builder(namePrefix + ".health.success.rate", successRateBits,
                        bits -> Double.longBitsToDouble(bits.get()))
                .description("Publish success rate over the health window")
                .register(registry);
        this.pendingGauge = Gauge.builder(namePrefix + ".queue.pending", pendingDepth, AtomicInteger::get)
                .description("Entries waiting for their slot")
                .register(registry);

        this.publishLatency = DistributionSummary.builder(namePrefix + ".publish.latency.ms")
                .description("Publisher call latency in milliseconds")
                .register(registry);
    }

    @Override
    public void incrementScheduled(EntrySource source) {
        if (closed) return;
        (source == EntrySource.FRONTLOAD ? scheduledFrontload : scheduledDiscovery).increment();
    }

    @Override
    public void incrementPosted() {
        if (closed) return;
        posted.increment();
    }

    @Override
    public void incrementRetryScheduled() {
        if (closed) return;
        retryScheduled.increment();
    }

    @Override
    public void incrementFailed() {
        if (closed) return;
        failed.increment();
    }

    @Override
    public void incrementRecovered() {
        if (closed) return;
        recovered.increment();
    }

    @Override
    public void incrementLockContended() {
        if (closed) return;
        lockContended.increment();
    }

    @Override
    public void incrementStaleLockReclaimed() {
        if (closed) return;
        lockReclaimed.increment();
    }

    @Override
    public void incrementPurged(long count) {
        if (closed || count <= 0) return;
        purged.increment(count);
    }

    @Override
    public void recordSuccessRate(double rate) {
        if (closed) return;
        successRateBits.set(Double.doubleToLongBits(rate));
    }

    @Override
    public void recordPendingDepth(int depth) {
        if (closed) return;
        pendingDepth.set(depth);
    }

    @Override
    public void recordPublishLatencyMs(long latencyMs) {
        if (closed) return;
        publishLatency.record(latencyMs);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>{@link slotpost.SlotPost#close()} calls this, so gauges do not outlive the scheduler.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(scheduledDiscovery, scheduledFrontload, posted, retryScheduled,
                failed, recovered, lockContended, lockReclaimed, purged,
                successRateGauge, pendingGauge, publishLatency)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
