package dev.devanks.solaredge.mapper;

import dev.devanks.solaredge.exception.ResponseParseException;

import java.util.Optional;

final class MapperSupport {

    private MapperSupport() {
    }

    static <T> T require(T value, String field) {
        if (value == null) {
            throw new ResponseParseException(field, "missing required field");
        }
        return value;
    }

    static String requireText(String value, String field) {
        if (require(value, field).isBlank()) {
            throw new ResponseParseException(field, "required field is blank");
        }
        return value;
    }

    static Optional<String> optionalText(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    static String field(String parent, String name) {
        return parent + "." + name;
    }
}
