package dev.devanks.solaredge.domain;

import dev.devanks.solaredge.measurement.EnergyUnit;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Energy series of a site, in the order the API returned it (chronological).
 */
@Value
@Builder
public class GeneratedEnergy {

    TimeUnit timeUnit;
    EnergyUnit unit;

    @Builder.Default
    Optional<String> measuredBy = Optional.empty();

    @Builder.Default
    List<EnergyReading> values = List.of();
}
