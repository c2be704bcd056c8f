// src/main/java/dev/devanks/solaredge/measurement/Quantity.java
package dev.devanks.solaredge.measurement;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Objects;

/**
 * A value tagged with the unit it was measured in. The unit never changes after construction;
 * {@link #get(MeasurementUnit)} converts on read.
 * <p>
 * Two quantities are equal when they are of the same kind and describe the same physical amount,
 * so 1 kW equals 1000 W, but a {@link Power} is never equal to an {@link Energy}.
 *
 * @param <U> the unit family of this quantity
 */
public abstract class Quantity<U extends MeasurementUnit> {

    private final double value;
    private final U unit;

    protected Quantity(double value, U unit) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Quantity value must be finite, got " + value);
        }
        this.value = value;
        this.unit = Objects.requireNonNull(unit, "unit");
    }

    /**
     * @return the value in the unit this quantity was constructed with
     */
    public double getValue() {
        return value;
    }

    public U getUnit() {
        return unit;
    }

    /**
     * @param target unit to express the value in
     * @return the value converted to {@code target}
     */
    public double get(U target) {
        Objects.requireNonNull(target, "target");
        if (target == unit) {
            return value;
        }
        return baseValue()
                .divide(BigDecimal.valueOf(target.getFactorToBase()), MathContext.DECIMAL64)
                .doubleValue();
    }

    protected int compareBase(Quantity<U> other) {
        return baseValue().compareTo(other.baseValue());
    }

    // Decimal amount in the base unit, so that 2.01 kW and 2010 W share one representation.
    private BigDecimal baseValue() {
        BigDecimal base = BigDecimal.valueOf(value).multiply(BigDecimal.valueOf(unit.getFactorToBase()));
        return base.signum() == 0 ? BigDecimal.ZERO : base.stripTrailingZeros();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Quantity<?> other = (Quantity<?>) o;
        return baseValue().equals(other.baseValue());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), baseValue());
    }

    @Override
    public String toString() {
        return value + " " + unit.getSymbol();
    }
}
