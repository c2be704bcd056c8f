package dev.devanks.solaredge.measurement;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum PowerUnit implements MeasurementUnit {
    WATT("W", 1d),
    KILOWATT("kW", 1_000d);

    private final String symbol;
    private final double factorToBase;

    public static Optional<PowerUnit> fromSymbol(String symbol) {
        return Arrays.stream(values())
                .filter(unit -> unit.symbol.equals(symbol))
                .findFirst();
    }
}
