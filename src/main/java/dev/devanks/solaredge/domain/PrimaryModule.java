package dev.devanks.solaredge.domain;

import dev.devanks.solaredge.measurement.Power;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Model of the PV module most used on a site.
 */
@Value
@Builder
public class PrimaryModule {

    @Builder.Default
    Optional<String> manufacturerName = Optional.empty();
    @Builder.Default
    Optional<String> modelName = Optional.empty();
    @Builder.Default
    Optional<Power> maximumPower = Optional.empty();
    // percent per degree Celsius
    @Builder.Default
    Optional<BigDecimal> temperatureCoef = Optional.empty();
}
