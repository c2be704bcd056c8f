package dev.devanks.solaredge.domain;

import dev.devanks.solaredge.measurement.Energy;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Energy produced over one overview window, with its revenue when the site has a tariff configured.
 */
@Value
@Builder
public class TimeData {

    Energy energy;

    @Builder.Default
    Optional<BigDecimal> revenue = Optional.empty();
}
