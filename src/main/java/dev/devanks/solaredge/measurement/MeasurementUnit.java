package dev.devanks.solaredge.measurement;

/**
 * A unit of one physical dimension, expressed as a factor of that dimension's base unit.
 */
public interface MeasurementUnit {

    String getSymbol();

    double getFactorToBase();
}
