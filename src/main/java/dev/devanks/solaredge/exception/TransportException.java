package dev.devanks.solaredge.exception;

/**
 * The API could not be reached: connection refused, TLS failure, timeout, broken stream.
 */
public class TransportException extends SolarEdgeException {
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
