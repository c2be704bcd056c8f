package dev.devanks.solaredge.mapper;

import dev.devanks.solaredge.Fixtures;
import dev.devanks.solaredge.domain.TimeUnit;
import dev.devanks.solaredge.exception.ResponseParseException;
import dev.devanks.solaredge.measurement.Power;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;

import static dev.devanks.solaredge.measurement.PowerUnit.KILOWATT;
import static dev.devanks.solaredge.measurement.PowerUnit.WATT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("PowerMapper Unit Tests")
class PowerMapperTest {

    private static final ZoneId ZONE = ZoneId.of("Europe/Amsterdam");

    private final PowerMapper mapper = new PowerMapper(Fixtures.jsonReader());

    @Test
    @DisplayName("fromJson: Quarter-hour series in watts, trailing null stays empty")
    void fromJson_validFixture() {
        var power = mapper.fromJson(Fixtures.load("power-quarter.json"), ZONE);

        assertThat(power.getTimeUnit()).isEqualTo(TimeUnit.QUARTER_OF_AN_HOUR);
        assertThat(power.getUnit()).isEqualTo(WATT);
        assertThat(power.getValues()).hasSize(5);
        assertThat(power.getValues().get(0).getValue()).contains(Power.watts(761.538));
        assertThat(power.getValues().get(4).getValue()).isEmpty();
        assertThat(power.getValues().get(4).getDate().toLocalTime()).hasToString("13:15");
    }

    @Test
    @DisplayName("fromJson: kW series converts on read")
    void fromJson_kilowatts() {
        var body = Fixtures.load("power-quarter.json").replace("\"W\"", "\"kW\"");

        var power = mapper.fromJson(body, ZONE);

        assertThat(power.getUnit()).isEqualTo(KILOWATT);
        assertThat(power.getValues().get(3).getValue().orElseThrow().get(WATT)).isCloseTo(563110.0, within(1e-6));
    }

    @Test
    @DisplayName("fromJson: Malformed reading date names its index")
    void fromJson_badDate_throws() {
        var body = Fixtures.load("power-quarter.json").replace("2023-11-09 12:15:00", "12:15");

        assertThatThrownBy(() -> mapper.fromJson(body, ZONE))
                .isInstanceOf(ResponseParseException.class)
                .extracting("field").isEqualTo("power.values[0].date");
    }

    @Test
    @DisplayName("fromJson: Missing series is reported on power")
    void fromJson_missingSeries_throws() {
        assertThatThrownBy(() -> mapper.fromJson("{}", ZONE))
                .isInstanceOf(ResponseParseException.class)
                .extracting("field").isEqualTo("power");
    }
}
