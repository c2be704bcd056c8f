// src/main/java/dev/devanks/solaredge/schedule/UpdateScheduler.java
package dev.devanks.solaredge.schedule;

import lombok.Value;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Advises when the next poll of overview, power or energy data is worth issuing.
 * <p>
 * The API publishes a new measurement roughly every 15 minutes and rejects requests once the hourly
 * quota is used up. A poll is therefore scheduled one refresh interval after the last reading, plus
 * a small grace margin because publication is a few seconds late at times. Both values are
 * observations, not documented guarantees, and can be tuned through
 * {@code solaredge.schedule.*}.
 * <p>
 * Nothing is enforced here: the caller decides whether to wait, and the server enforces the quota.
 */
@Value
public class UpdateScheduler {

    public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofMinutes(15);
    public static final Duration DEFAULT_GRACE_MARGIN = Duration.ofSeconds(10);
    public static final UpdateScheduler DEFAULT = new UpdateScheduler(DEFAULT_REFRESH_INTERVAL, DEFAULT_GRACE_MARGIN);

    Duration refreshInterval;
    Duration graceMargin;

    public UpdateScheduler(Duration refreshInterval, Duration graceMargin) {
        this.refreshInterval = requireNotNegative(refreshInterval, "refreshInterval");
        this.graceMargin = requireNotNegative(graceMargin, "graceMargin");
    }

    /**
     * @param lastReading timestamp of the most recent reading received
     * @param now         current time
     * @return the estimated publication time of the next reading and the signed duration until it,
     * negative when {@code now} is already past the estimate
     */
    public NextUpdateEstimate estimateNextUpdate(ZonedDateTime lastReading, ZonedDateTime now) {
        Objects.requireNonNull(lastReading, "lastReading");
        Objects.requireNonNull(now, "now");
        ZonedDateTime next = lastReading.plus(refreshInterval).plus(graceMargin);
        return new NextUpdateEstimate(next, Duration.between(now, next));
    }

    public NextUpdateEstimate estimateNextUpdate(ZonedDateTime lastReading, Clock clock) {
        return estimateNextUpdate(lastReading, ZonedDateTime.now(clock));
    }

    private static Duration requireNotNegative(Duration duration, String name) {
        Objects.requireNonNull(duration, name);
        if (duration.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative: " + duration);
        }
        return duration;
    }
}
