package dev.devanks.solaredge.domain;

import dev.devanks.solaredge.measurement.Energy;
import lombok.Builder;
import lombok.Value;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Total energy produced by a site within a {@link DataPeriod}.
 */
@Value
@Builder
public class TimeFrameEnergy {

    Energy energy;

    @Builder.Default
    Optional<String> measuredBy = Optional.empty();
    @Builder.Default
    Optional<LifetimeEnergy> startLifetimeEnergy = Optional.empty();
    @Builder.Default
    Optional<LifetimeEnergy> endLifetimeEnergy = Optional.empty();

    /**
     * Lifetime energy counter of the site at a given moment.
     */
    @Value
    public static class LifetimeEnergy {
        ZonedDateTime date;
        Energy energy;
    }
}
