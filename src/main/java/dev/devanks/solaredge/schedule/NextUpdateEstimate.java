package dev.devanks.solaredge.schedule;

import lombok.Value;

import java.time.Duration;
import java.time.ZonedDateTime;

@Value
public class NextUpdateEstimate {

    ZonedDateTime nextUpdate;

    /**
     * Signed: negative when the estimated update time has already passed.
     */
    Duration durationFromNow;

    /**
     * @return how long to wait before polling, never negative
     */
    public Duration waitTime() {
        return durationFromNow.isNegative() ? Duration.ZERO : durationFromNow;
    }

    public boolean isDue() {
        return durationFromNow.isNegative() || durationFromNow.isZero();
    }
}
