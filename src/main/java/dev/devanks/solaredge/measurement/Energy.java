package dev.devanks.solaredge.measurement;

import static dev.devanks.solaredge.measurement.EnergyUnit.WATT_HOUR;

/**
 * Accumulated energy.
 */
public final class Energy extends Quantity<EnergyUnit> implements Comparable<Energy> {

    private Energy(double value, EnergyUnit unit) {
        super(value, unit);
    }

    public static Energy of(double value, EnergyUnit unit) {
        return new Energy(value, unit);
    }

    public static Energy wattHours(double value) {
        return new Energy(value, WATT_HOUR);
    }

    public Energy to(EnergyUnit target) {
        return new Energy(get(target), target);
    }

    @Override
    public int compareTo(Energy other) {
        return compareBase(other);
    }
}
