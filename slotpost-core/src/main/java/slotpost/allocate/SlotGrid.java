package slotpost.allocate;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fixed-cadence grid of publication slots anchored at the Unix epoch (UTC).
 *
 * <p>With the default 15-minute cadence every slot falls on {@code :00}, {@code :15},
 * {@code :30} or {@code :45} UTC, giving 96 slots per day. Zones with a non-quarter-hour
 * offset see the same instants at other wall-clock minutes.
 */
public final class SlotGrid {
    public static final Duration DEFAULT_CADENCE = Duration.ofMinutes(15);

    private final Duration cadence;
    private final long cadenceMs;

    public SlotGrid(Duration cadence) {
        Objects.requireNonNull(cadence, "cadence");
        if (cadence.isNegative() || cadence.isZero()) {
            throw new IllegalArgumentException("cadence must be positive");
        }
        if (cadence.toMillis() < 1000 || cadence.toMillis() % 1000 != 0 || cadence.getNano() % 1_000_000 != 0) {
            throw new IllegalArgumentException("cadence must be a whole number of seconds: " + cadence);
        }
        this.cadence = cadence;
        this.cadenceMs = cadence.toMillis();
    }

    public static SlotGrid defaultGrid() {
        return new SlotGrid(DEFAULT_CADENCE);
    }

    public Duration cadence() {
        return cadence;
    }

    /**
     * Whether {@code time} lies exactly on a slot boundary.
     */
    public boolean isAligned(Instant time) {
        return time.getNano() % 1_000_000 == 0 && Math.floorMod(time.toEpochMilli(), cadenceMs) == 0;
    }

    /**
     * Smallest slot boundary {@code >= time}.
     */
    public Instant ceil(Instant time) {
        long ms = time.toEpochMilli();
        if (time.getNano() % 1_000_000 != 0) {
            ms++;
        }
        long rem = Math.floorMod(ms, cadenceMs);
        return Instant.ofEpochMilli(rem == 0 ? ms : ms - rem + cadenceMs);
    }

    /**
     * Largest slot boundary {@code <= time}.
     */
    public Instant floor(Instant time) {
        long ms = time.toEpochMilli();
        return Instant.ofEpochMilli(ms - Math.floorMod(ms, cadenceMs));
    }

    /**
     * The boundary one cadence after {@code slot}.
     */
    public Instant next(Instant slot) {
        return slot.plus(cadence);
    }

    public int slotsPerDay() {
        return (int) (Duration.ofDays(1).toMillis() / cadenceMs);
    }

    /**
     * @throws IllegalArgumentException if {@code time} is off the grid
     */
    public Instant requireAligned(Instant time) {
        if (!isAligned(time)) {
            throw new IllegalArgumentException("Scheduled time " + time + " is not aligned to the "
                + cadence + " slot grid");
        }
        return time;
    }

    @Override
    public String toString() {
        return "SlotGrid[" + cadence + "]";
    }
}
