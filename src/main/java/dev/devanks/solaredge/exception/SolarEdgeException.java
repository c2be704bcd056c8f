package dev.devanks.solaredge.exception;

/**
 * Base type of every failure raised while talking to the SolarEdge Monitoring API.
 * Callers that do not care about the cause can catch this one type.
 */
public class SolarEdgeException extends RuntimeException {
    public SolarEdgeException(String message) {
        super(message);
    }

    public SolarEdgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
