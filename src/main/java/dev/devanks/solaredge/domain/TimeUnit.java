package dev.devanks.solaredge.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Aggregation period of energy and power series. The constant names are the wire values.
 */
public enum TimeUnit {
    QUARTER_OF_AN_HOUR,
    HOUR,
    DAY,
    WEEK,
    MONTH,
    YEAR;

    public String toParameter() {
        return name();
    }

    public static Optional<TimeUnit> fromParameter(String parameter) {
        return Arrays.stream(values())
                .filter(unit -> unit.name().equals(parameter))
                .findFirst();
    }
}
