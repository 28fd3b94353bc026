package slotpost.health;

import slotpost.model.EntryState;
import slotpost.spi.ConnectionProvider;
import slotpost.spi.MetricsExporter;
import slotpost.spi.ScheduleStore;
import slotpost.util.Transactions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Computes the publish success rate from the transition journal and flags degradation.
 *
 * <p>Read-only against the store. The rate is exported through the
 * {@link MetricsExporter} on every evaluation; a degraded result is logged at
 * {@code WARNING}. Create instances via {@link #builder()}.
 */
public final class HealthMonitor {
    private static final Logger logger = Logger.getLogger(HealthMonitor.class.getName());

    private final ConnectionProvider connectionProvider;
    private final ScheduleStore store;
    private final Duration window;
    private final double threshold;
    private final int minSamples;
    private final MetricsExporter metrics;
    private final Clock clock;

    private HealthMonitor(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(builder.store, "store");
        Duration window = builder.window != null ? builder.window : Duration.ofHours(24);
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (builder.threshold < 0.0 || builder.threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be within [0, 1]");
        }
        if (builder.minSamples < 0) {
            throw new IllegalArgumentException("minSamples must be >= 0");
        }
        this.window = window;
        this.threshold = builder.threshold;
        this.minSamples = builder.minSamples;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Success rate over the trailing window; {@code 1.0} when nothing was attempted.
     */
    public double successRate() {
        return evaluate().successRate();
    }

    /**
     * Evaluates the trailing window ending now.
     *
     * @throws slotpost.ScheduleStoreException on database failure
     */
    public HealthReport evaluate() {
        Instant now = clock.instant();
        Map<EntryState, Integer> counts = Transactions.readOnly(connectionProvider,
            conn -> store.countTransitionsSince(conn, now.minus(window)));
        int posted = counts.getOrDefault(EntryState.POSTED, 0);
        int failed = counts.getOrDefault(EntryState.FAILED, 0);
        int total = posted + failed;
        double rate = total == 0 ? 1.0 : (double) posted / total;
        boolean degraded = total >= minSamples && rate < threshold;

        metrics.recordSuccessRate(rate);
        if (degraded) {
            logger.log(Level.WARNING, "Publish success rate {0} is below {1} over the last {2} ({3} posted, {4} failed)",
                new Object[]{String.format("%.2f", rate), threshold, window, posted, failed});
        }
        return new HealthReport(rate, posted, failed, window, threshold, degraded, now);
    }

    /**
     * Builder for {@link HealthMonitor}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private ScheduleStore store;
        private Duration window;
        private double threshold = 0.90;
        private int minSamples = 10;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * <b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder store(ScheduleStore store) {
            this.store = store;
            return this;
        }

        /**
         * Optional. Defaults to 24 hours.
         */
        public Builder window(Duration window) {
            this.window = window;
            return this;
        }

        /**
         * Optional. Defaults to {@code 0.90}.
         */
        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        /**
         * Samples required before the scheduler can be reported degraded.
         *
         * <p>Optional. Defaults to {@code 10}.
         */
        public Builder minSamples(int minSamples) {
            this.minSamples = minSamples;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public HealthMonitor build() {
            return new HealthMonitor(this);
        }
    }
}
