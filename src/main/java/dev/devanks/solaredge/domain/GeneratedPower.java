package dev.devanks.solaredge.domain;

import dev.devanks.solaredge.measurement.PowerUnit;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Power series of a site in quarter hour resolution, chronological.
 */
@Value
@Builder
public class GeneratedPower {

    TimeUnit timeUnit;
    PowerUnit unit;

    @Builder.Default
    Optional<String> measuredBy = Optional.empty();

    @Builder.Default
    List<PowerReading> values = List.of();
}
