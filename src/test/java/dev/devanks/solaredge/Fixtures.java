package dev.devanks.solaredge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.Resources;
import dev.devanks.solaredge.mapper.SolarEdgeJsonReader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Reply bodies captured from the SolarEdge API, stored under {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static String load(String name) {
        try {
            return Resources.toString(Resources.getResource("fixtures/" + name), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static SolarEdgeJsonReader jsonReader() {
        return new SolarEdgeJsonReader(new ObjectMapper());
    }
}
