package dev.devanks.solaredge.domain;

import dev.devanks.solaredge.measurement.Energy;
import lombok.Value;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Energy of one period starting at {@link #getDate()}. Empty when the site reported nothing for
 * that period, which is different from a reported zero.
 */
@Value
public class EnergyReading {

    ZonedDateTime date;
    Optional<Energy> value;

    public boolean isReported() {
        return value.isPresent();
    }
}
