// src/main/java/dev/devanks/solaredge/mapper/SolarEdgeJsonReader.java
package dev.devanks.solaredge.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import dev.devanks.solaredge.exception.ResponseParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Binds reply bodies to the wire DTOs of the {@code model} package and turns every Jackson failure
 * into a {@link ResponseParseException} pointing at the offending field.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SolarEdgeJsonReader {

    private final ObjectMapper objectMapper;

    public <T> T read(String body, Class<T> type) {
        if (body == null || body.isBlank()) {
            throw new ResponseParseException(ResponseParseException.ROOT, "empty response body");
        }
        try {
            T value = objectMapper.readValue(body, type);
            if (value == null) {
                throw new ResponseParseException(ResponseParseException.ROOT, "response body is JSON null");
            }
            return value;
        } catch (JsonMappingException e) {
            String field = pathOf(e.getPath());
            log.debug("Failed to bind {} at '{}': {}", type.getSimpleName(), field, e.getOriginalMessage());
            throw new ResponseParseException(field, e.getOriginalMessage(), e);
        } catch (JsonProcessingException e) {
            throw new ResponseParseException(ResponseParseException.ROOT, "malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Error replies usually carry a {@code message} field; anything else yields empty.
     */
    public Optional<String> readErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode message = objectMapper.readTree(body).path("message");
            return message.isTextual() ? Optional.of(message.asText()) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    @VisibleForTesting
    static String pathOf(List<JsonMappingException.Reference> references) {
        if (references == null || references.isEmpty()) {
            return ResponseParseException.ROOT;
        }
        var path = new StringBuilder();
        for (JsonMappingException.Reference reference : references) {
            if (reference.getFieldName() != null) {
                if (path.length() > 0) {
                    path.append('.');
                }
                path.append(reference.getFieldName());
            } else if (reference.getIndex() >= 0) {
                path.append('[').append(reference.getIndex()).append(']');
            }
        }
        return path.length() == 0 ? ResponseParseException.ROOT : path.toString();
    }
}
