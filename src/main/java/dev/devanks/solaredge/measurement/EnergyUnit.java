package dev.devanks.solaredge.measurement;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum EnergyUnit implements MeasurementUnit {
    WATT_HOUR("Wh", 1d),
    KILOWATT_HOUR("kWh", 1_000d),
    MEGAWATT_HOUR("MWh", 1_000_000d);

    private final String symbol;
    private final double factorToBase;

    public static Optional<EnergyUnit> fromSymbol(String symbol) {
        return Arrays.stream(values())
                .filter(unit -> unit.symbol.equals(symbol))
                .findFirst();
    }
}
