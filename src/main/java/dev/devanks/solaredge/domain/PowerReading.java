package dev.devanks.solaredge.domain;

import dev.devanks.solaredge.measurement.Power;
import lombok.Value;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Average power of the quarter hour starting at {@link #getDate()}, empty when nothing was reported.
 */
@Value
public class PowerReading {

    ZonedDateTime date;
    Optional<Power> value;

    public boolean isReported() {
        return value.isPresent();
    }
}
