package dev.devanks.solaredge.measurement;

import static dev.devanks.solaredge.measurement.PowerUnit.KILOWATT;
import static dev.devanks.solaredge.measurement.PowerUnit.WATT;

/**
 * Instantaneous power.
 */
public final class Power extends Quantity<PowerUnit> implements Comparable<Power> {

    private Power(double value, PowerUnit unit) {
        super(value, unit);
    }

    public static Power of(double value, PowerUnit unit) {
        return new Power(value, unit);
    }

    public static Power watts(double value) {
        return new Power(value, WATT);
    }

    public static Power kilowatts(double value) {
        return new Power(value, KILOWATT);
    }

    public Power to(PowerUnit target) {
        return new Power(get(target), target);
    }

    @Override
    public int compareTo(Power other) {
        return compareBase(other);
    }
}
