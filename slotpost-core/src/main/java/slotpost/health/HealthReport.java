package slotpost.health;

import java.time.Duration;
import java.time.Instant;

/**
 * Publish success statistics over a trailing window.
 *
 * @param successRate posted / (posted + failed); {@code 1.0} without samples
 * @param posted      POSTED transitions in the window
 * @param failed      FAILED transitions in the window
 * @param window      window length
 * @param threshold   rate below which the scheduler is degraded
 * @param degraded    whether the rate is below the threshold with enough samples
 * @param evaluatedAt evaluation time
 */
public record HealthReport(
    double successRate,
    int posted,
    int failed,
    Duration window,
    double threshold,
    boolean degraded,
    Instant evaluatedAt
) {

    public int total() {
        return posted + failed;
    }
}
