// src/main/java/dev/devanks/solaredge/measurement/Measurements.java
package dev.devanks.solaredge.measurement;

import dev.devanks.solaredge.exception.ResponseParseException;

import java.util.Optional;

/**
 * Turns raw numbers read from a reply into quantities. The API sends no unit next to a value, so
 * the caller names the field being read and the unit that field is documented to use.
 * All methods fail with {@link ResponseParseException} carrying the field name.
 */
public final class Measurements {

    private Measurements() {
    }

    public static Power power(String field, Double raw, PowerUnit unit) {
        return Power.of(requireFinite(field, raw), unit);
    }

    /**
     * Rated power (peak power of a site, maximum power of a module) which cannot be negative.
     */
    public static Power ratedPower(String field, Double raw, PowerUnit unit) {
        return Power.of(requireNonNegative(field, raw), unit);
    }

    public static Optional<Power> optionalPower(String field, Double raw, PowerUnit unit) {
        return raw == null ? Optional.empty() : Optional.of(power(field, raw, unit));
    }

    public static Optional<Power> optionalRatedPower(String field, Double raw, PowerUnit unit) {
        return raw == null ? Optional.empty() : Optional.of(ratedPower(field, raw, unit));
    }

    public static Energy energy(String field, Double raw, EnergyUnit unit) {
        return Energy.of(requireNonNegative(field, raw), unit);
    }

    public static Optional<Energy> optionalEnergy(String field, Double raw, EnergyUnit unit) {
        return raw == null ? Optional.empty() : Optional.of(energy(field, raw, unit));
    }

    public static PowerUnit powerUnit(String field, String symbol) {
        if (symbol == null) {
            throw new ResponseParseException(field, "missing required unit");
        }
        return PowerUnit.fromSymbol(symbol)
                .orElseThrow(() -> new ResponseParseException(field, "unsupported power unit '" + symbol + "'"));
    }

    public static EnergyUnit energyUnit(String field, String symbol) {
        if (symbol == null) {
            throw new ResponseParseException(field, "missing required unit");
        }
        return EnergyUnit.fromSymbol(symbol)
                .orElseThrow(() -> new ResponseParseException(field, "unsupported energy unit '" + symbol + "'"));
    }

    private static double requireFinite(String field, Double raw) {
        if (raw == null) {
            throw new ResponseParseException(field, "missing required value");
        }
        if (!Double.isFinite(raw)) {
            throw new ResponseParseException(field, "value is not a finite number: " + raw);
        }
        return raw;
    }

    private static double requireNonNegative(String field, Double raw) {
        double value = requireFinite(field, raw);
        if (value < 0) {
            throw new ResponseParseException(field, "value must not be negative: " + value);
        }
        return value;
    }
}
