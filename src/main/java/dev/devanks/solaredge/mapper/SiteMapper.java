// src/main/java/dev/devanks/solaredge/mapper/SiteMapper.java
package dev.devanks.solaredge.mapper;

import dev.devanks.solaredge.domain.Location;
import dev.devanks.solaredge.domain.PrimaryModule;
import dev.devanks.solaredge.domain.Site;
import dev.devanks.solaredge.exception.ResponseParseException;
import dev.devanks.solaredge.measurement.Measurements;
import dev.devanks.solaredge.measurement.SiteTimestamps;
import dev.devanks.solaredge.model.SiteDetailsResponse;
import dev.devanks.solaredge.model.SiteListResponse;
import dev.devanks.solaredge.model.SiteResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static dev.devanks.solaredge.mapper.MapperSupport.field;
import static dev.devanks.solaredge.mapper.MapperSupport.optionalText;
import static dev.devanks.solaredge.mapper.MapperSupport.require;
import static dev.devanks.solaredge.mapper.MapperSupport.requireText;
import static dev.devanks.solaredge.measurement.PowerUnit.KILOWATT;

@Component
@RequiredArgsConstructor
public class SiteMapper {

    private final SolarEdgeJsonReader jsonReader;

    /**
     * Maps the body of {@code /sites/list}, keeping the order of the reply.
     */
    public List<Site> listFromJson(String body) {
        SiteListResponse response = jsonReader.read(body, SiteListResponse.class);
        SiteListResponse.Sites sites = require(response.getSites(), "sites");
        List<SiteResponse> rawSites = require(sites.getSite(), "sites.site");

        List<Site> result = new ArrayList<>(rawSites.size());
        for (int i = 0; i < rawSites.size(); i++) {
            String path = "sites.site[" + i + "]";
            result.add(toSite(require(rawSites.get(i), path), path));
        }
        return List.copyOf(result);
    }

    /**
     * Maps the body of {@code /site/{siteId}/details}.
     */
    public Site detailsFromJson(String body) {
        SiteDetailsResponse response = jsonReader.read(body, SiteDetailsResponse.class);
        return toSite(require(response.getDetails(), "details"), "details");
    }

    Site toSite(SiteResponse raw, String path) {
        return Site.builder()
                .id(require(raw.getId(), field(path, "id")))
                .name(requireText(raw.getName(), field(path, "name")))
                .status(requireText(raw.getStatus(), field(path, "status")))
                .peakPower(Measurements.ratedPower(field(path, "peakPower"), raw.getPeakPower(), KILOWATT))
                .accountId(Optional.ofNullable(raw.getAccountId()))
                .lastUpdateTime(SiteTimestamps.optionalDate(field(path, "lastUpdateTime"), raw.getLastUpdateTime()))
                .installationDate(SiteTimestamps.optionalDate(field(path, "installationDate"), raw.getInstallationDate()))
                .ptoDate(SiteTimestamps.optionalDate(field(path, "ptoDate"), raw.getPtoDate()))
                .notes(raw.getNotes() == null ? "" : raw.getNotes())
                .type(optionalText(raw.getType()))
                .location(Optional.ofNullable(raw.getLocation()).map(location -> toLocation(location, field(path, "location"))))
                .primaryModule(Optional.ofNullable(raw.getPrimaryModule())
                        .map(module -> toPrimaryModule(module, field(path, "primaryModule"))))
                .uris(toUris(raw.getUris(), field(path, "uris")))
                .publicSite(Optional.ofNullable(raw.getPublicSettings())
                        .map(SiteResponse.PublicSettingsResponse::getPublicSite))
                .build();
    }

    private Location toLocation(SiteResponse.LocationResponse raw, String path) {
        return Location.builder()
                .country(optionalText(raw.getCountry()))
                .state(optionalText(raw.getState()))
                .city(optionalText(raw.getCity()))
                .address(optionalText(raw.getAddress()))
                .address2(optionalText(raw.getAddress2()))
                .zip(optionalText(raw.getZip()))
                .timeZone(optionalText(raw.getTimeZone()).map(zone -> toZoneId(zone, field(path, "timeZone"))))
                .countryCode(optionalText(raw.getCountryCode()))
                .build();
    }

    private PrimaryModule toPrimaryModule(SiteResponse.PrimaryModuleResponse raw, String path) {
        return PrimaryModule.builder()
                .manufacturerName(optionalText(raw.getManufacturerName()))
                .modelName(optionalText(raw.getModelName()))
                .maximumPower(Measurements.optionalRatedPower(field(path, "maximumPower"), raw.getMaximumPower(), KILOWATT))
                .temperatureCoef(Optional.ofNullable(raw.getTemperatureCoef()).map(BigDecimal::valueOf))
                .build();
    }

    private static Map<String, String> toUris(Map<String, String> raw, String path) {
        if (raw == null) {
            return Map.of();
        }
        raw.forEach((name, uri) -> require(uri, field(path, name)));
        return Map.copyOf(raw);
    }

    private static ZoneId toZoneId(String zone, String field) {
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new ResponseParseException(field, "unknown time zone '" + zone + "'", e);
        }
    }
}
