package dev.devanks.solaredge.mapper;

import dev.devanks.solaredge.Fixtures;
import dev.devanks.solaredge.exception.ResponseParseException;
import dev.devanks.solaredge.model.EnergyResponse;
import dev.devanks.solaredge.model.OverviewResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SolarEdgeJsonReader Unit Tests")
class SolarEdgeJsonReaderTest {

    private final SolarEdgeJsonReader reader = Fixtures.jsonReader();

    @Test
    @DisplayName("read: Unknown fields are ignored")
    void read_unknownFields_ignored() {
        var response = reader.read("{\"overview\":{\"lastUpdateTime\":\"x\",\"somethingNew\":1}}", OverviewResponse.class);

        assertThat(response.getOverview().getLastUpdateTime()).isEqualTo("x");
    }

    @Test
    @DisplayName("read: Malformed JSON, empty body and JSON null fail at the root")
    void read_unusableBody_failsAtRoot() {
        assertThatThrownBy(() -> reader.read("{\"overview\":", OverviewResponse.class))
                .isInstanceOf(ResponseParseException.class)
                .extracting("field").isEqualTo(ResponseParseException.ROOT);
        assertThatThrownBy(() -> reader.read("  ", OverviewResponse.class))
                .isInstanceOf(ResponseParseException.class)
                .extracting("field").isEqualTo(ResponseParseException.ROOT);
        assertThatThrownBy(() -> reader.read("null", OverviewResponse.class))
                .isInstanceOf(ResponseParseException.class)
                .extracting("field").isEqualTo(ResponseParseException.ROOT);
    }

    @Test
    @DisplayName("read: Non-numeric value inside a list carries index and field")
    void read_nonNumericInList_pathHasIndex() {
        var body = "{\"energy\":{\"values\":[{\"date\":\"d\",\"value\":\"abc\"}]}}";

        assertThatThrownBy(() -> reader.read(body, EnergyResponse.class))
                .isInstanceOf(ResponseParseException.class)
                .extracting("field").isEqualTo("energy.values[0].value");
    }

    @Test
    @DisplayName("readErrorMessage: Picks the message field of a JSON error body")
    void readErrorMessage_jsonBody() {
        assertThat(reader.readErrorMessage("{\"message\":\"Invalid API key\"}")).contains("Invalid API key");
    }

    @Test
    @DisplayName("readErrorMessage: Empty for plain text, blank or message-less bodies")
    void readErrorMessage_noMessage() {
        assertThat(reader.readErrorMessage("Too many requests")).isEmpty();
        assertThat(reader.readErrorMessage("")).isEmpty();
        assertThat(reader.readErrorMessage("{\"String\":\"Invalid token\"}")).isEmpty();
    }
}
