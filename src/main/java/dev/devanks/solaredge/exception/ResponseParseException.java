// src/main/java/dev/devanks/solaredge/exception/ResponseParseException.java
package dev.devanks.solaredge.exception;

import lombok.Getter;

/**
 * A 2xx reply whose body does not have the expected shape. {@link #getField()} holds the dotted
 * path of the offending field, e.g. {@code overview.lastUpdateTime} or {@code energy.values[3].value}.
 */
@Getter
public class ResponseParseException extends SolarEdgeException {

    public static final String ROOT = "$";

    private final String field;

    public ResponseParseException(String field, String message) {
        super(String.format("Could not parse field '%s': %s", field, message));
        this.field = field;
    }

    public ResponseParseException(String field, String message, Throwable cause) {
        super(String.format("Could not parse field '%s': %s", field, message), cause);
        this.field = field;
    }
}
