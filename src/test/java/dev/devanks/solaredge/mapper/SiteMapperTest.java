package dev.devanks.solaredge.mapper;

import dev.devanks.solaredge.Fixtures;
import dev.devanks.solaredge.exception.ResponseParseException;
import dev.devanks.solaredge.measurement.Power;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;

import static dev.devanks.solaredge.measurement.PowerUnit.KILOWATT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SiteMapper Unit Tests")
class SiteMapperTest {

    private final SiteMapper mapper = new SiteMapper(Fixtures.jsonReader());

    @Test
    @DisplayName("listFromJson: Keeps API order and maps optional fields")
    void listFromJson_validFixture() {
        // Act
        var sites = mapper.listFromJson(Fixtures.load("sites-list.json"));

        // Assert
        assertThat(sites).hasSize(2);
        var first = sites.get(0);
        assertThat(first.getId()).isEqualTo(1234123L);
        assertThat(first.getName()).isEqualTo("MySiteName");
        assertThat(first.getAccountId()).contains(123456L);
        assertThat(first.getPeakPower()).isEqualTo(Power.kilowatts(7.41));
        assertThat(first.getPeakPower().getUnit()).isEqualTo(KILOWATT);
        assertThat(first.getPtoDate()).isEmpty();
        assertThat(first.getInstallationDate()).contains(LocalDate.of(2021, 2, 25));
        assertThat(first.getLocation()).isPresent();
        assertThat(first.getLocation().get().getTimeZone()).contains(ZoneId.of("Europe/Amsterdam"));
        assertThat(first.getUris()).containsEntry("OVERVIEW", "/site/1234123/overview");
        assertThat(first.getPublicSite()).contains(false);

        var second = sites.get(1);
        assertThat(second.getId()).isEqualTo(77L);
        assertThat(second.getName()).isEqualTo("Garage");
        assertThat(second.getAccountId()).isEmpty();
        assertThat(second.getLocation()).isEmpty();
        assertThat(second.getPrimaryModule()).isEmpty();
        assertThat(second.getNotes()).isEmpty();
        assertThat(second.getUris()).isEmpty();
        assertThat(second.getPublicSite()).contains(true);
    }

    @Test
    @DisplayName("detailsFromJson: Maps dates, module and notes")
    void detailsFromJson_validFixture() {
        var site = mapper.detailsFromJson(Fixtures.load("site-details.json"));

        assertThat(site.getStatus()).isEqualTo("Active");
        assertThat(site.getPtoDate()).contains(LocalDate.of(2021, 3, 1));
        assertThat(site.getLastUpdateTime()).contains(LocalDate.of(2023, 11, 9));
        assertThat(site.getNotes()).isEqualTo("roof south");
        assertThat(site.getType()).contains("Optimizers & Inverters");
        var module = site.getPrimaryModule().orElseThrow();
        assertThat(module.getManufacturerName()).contains("JinkoSolar");
        assertThat(module.getMaximumPower()).contains(Power.kilowatts(0.39));
        assertThat(module.getTemperatureCoef()).contains(BigDecimal.valueOf(-0.35));
        assertThat(site.getLocation().orElseThrow().getCountryCode()).contains("NL");
    }

    @Test
    @DisplayName("detailsFromJson: Missing publicSettings leaves the public flag unreported")
    void detailsFromJson_missingPublicSettings_isEmpty() {
        var body = Fixtures.load("site-details.json").replace(",\n    \"publicSettings\":{\n        \"isPublic\":false\n    }", "");

        var site = mapper.detailsFromJson(body);

        assertThat(site.getPublicSite()).isEmpty();
    }

    @Test
    @DisplayName("detailsFromJson: Null uri entry is reported by its key")
    void detailsFromJson_nullUri_throws() {
        var body = Fixtures.load("site-details.json")
                .replace("\"DETAILS\":\"/site/1234123/details\"", "\"SITE_IMAGE\":null");

        assertThatThrownBy(() -> mapper.detailsFromJson(body))
                .isInstanceOf(ResponseParseException.class)
                .extracting("field").isEqualTo("details.uris.SITE_IMAGE");
    }

    @Test
    @DisplayName("detailsFromJson: Missing peak power is reported by name")
    void detailsFromJson_missingPeakPower_throws() {
        var body = Fixtures.load("site-details.json").replace("\"peakPower\":7.41,", "");

        assertThatThrownBy(() -> mapper.detailsFromJson(body))
                .isInstanceOf(ResponseParseException.class)
                .extracting("field").isEqualTo("details.peakPower");
    }

    @Test
    @DisplayName("listFromJson: Missing name of the second site names its index")
    void listFromJson_missingName_throws() {
        var body = Fixtures.load("sites-list.json").replace("\"name\":\"Garage\",", "");

        assertThatThrownBy(() -> mapper.listFromJson(body))
                .isInstanceOf(ResponseParseException.class)
                .extracting("field").isEqualTo("sites.site[1].name");
    }

    @Test
    @DisplayName("detailsFromJson: Unknown time zone is a parse error")
    void detailsFromJson_unknownTimeZone_throws() {
        var body = Fixtures.load("site-details.json").replace("Europe/Amsterdam", "Mars/Olympus");

        assertThatThrownBy(() -> mapper.detailsFromJson(body))
                .isInstanceOf(ResponseParseException.class)
                .extracting("field").isEqualTo("details.location.timeZone");
    }

    @Test
    @DisplayName("detailsFromJson: Malformed installation date is reported by name")
    void detailsFromJson_badDate_throws() {
        var body = Fixtures.load("site-details.json").replace("\"2021-02-25\"", "\"25-02-2021\"");

        assertThatThrownBy(() -> mapper.detailsFromJson(body))
                .isInstanceOf(ResponseParseException.class)
                .extracting("field").isEqualTo("details.installationDate");
    }
}
