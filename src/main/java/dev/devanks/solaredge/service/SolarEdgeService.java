// src/main/java/dev/devanks/solaredge/service/SolarEdgeService.java
package dev.devanks.solaredge.service;

import dev.devanks.solaredge.client.ApiKey;
import dev.devanks.solaredge.client.SolarEdgeApiClient;
import dev.devanks.solaredge.config.SolarEdgeProperties;
import dev.devanks.solaredge.domain.DataPeriod;
import dev.devanks.solaredge.domain.GeneratedEnergy;
import dev.devanks.solaredge.domain.GeneratedPower;
import dev.devanks.solaredge.domain.Overview;
import dev.devanks.solaredge.domain.Site;
import dev.devanks.solaredge.domain.TimeFrameEnergy;
import dev.devanks.solaredge.domain.TimeUnit;
import dev.devanks.solaredge.exception.ApiException;
import dev.devanks.solaredge.exception.ResponseParseException;
import dev.devanks.solaredge.exception.TransportException;
import dev.devanks.solaredge.mapper.DataPeriodMapper;
import dev.devanks.solaredge.mapper.EnergyMapper;
import dev.devanks.solaredge.mapper.OverviewMapper;
import dev.devanks.solaredge.mapper.PowerMapper;
import dev.devanks.solaredge.mapper.SiteMapper;
import dev.devanks.solaredge.mapper.SolarEdgeJsonReader;
import dev.devanks.solaredge.measurement.SiteTimestamps;
import feign.FeignException;
import feign.Response;
import feign.Util;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * One blocking operation per modeled endpoint of the SolarEdge Monitoring API.
 * <p>
 * Every call takes the API key and site id, so the service holds no per-caller state and can be
 * shared freely. Failures surface as one of three exceptions and are never retried:
 * <ul>
 *     <li>{@link TransportException} when the server could not be reached,</li>
 *     <li>{@link ApiException} when it answered with a non-2xx status,</li>
 *     <li>{@link ResponseParseException} when a 2xx body does not have the expected shape.</li>
 * </ul>
 * Invalid arguments are rejected with {@link IllegalArgumentException} before any request is sent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SolarEdgeService {

    private final SolarEdgeApiClient apiClient;
    private final SolarEdgeProperties properties;
    private final SolarEdgeJsonReader jsonReader;
    private final SiteMapper siteMapper;
    private final DataPeriodMapper dataPeriodMapper;
    private final OverviewMapper overviewMapper;
    private final EnergyMapper energyMapper;
    private final PowerMapper powerMapper;

    /**
     * Lists all sites of the account. Each {@link Site#getId()} can be used with the other operations.
     */
    public List<Site> listSites(ApiKey apiKey) {
        requireApiKey(apiKey);
        log.debug("Getting list of sites");
        String body = execute("listSites", () -> apiClient.listSites(apiKey.getValue()));
        return siteMapper.listFromJson(body);
    }

    /**
     * Site details such as name, location, status and peak power.
     */
    public Site siteDetails(ApiKey apiKey, long siteId) {
        requireApiKey(apiKey);
        requireSiteId(siteId);
        log.debug("Getting details of site {}", siteId);
        String body = execute("siteDetails", () -> apiClient.siteDetails(siteId, apiKey.getValue()));
        return siteMapper.detailsFromJson(body);
    }

    /**
     * First and last date the site produced energy.
     */
    public DataPeriod dataPeriod(ApiKey apiKey, long siteId) {
        requireApiKey(apiKey);
        requireSiteId(siteId);
        log.debug("Getting data period of site {}", siteId);
        String body = execute("dataPeriod", () -> apiClient.dataPeriod(siteId, apiKey.getValue()));
        return dataPeriodMapper.fromJson(body);
    }

    /**
     * Current power and energy totals of the site. Use {@link Overview#estimatedNextUpdate()} to
     * decide when polling again makes sense.
     */
    public Overview overview(ApiKey apiKey, long siteId) {
        requireApiKey(apiKey);
        requireSiteId(siteId);
        log.debug("Getting overview of site {}", siteId);
        String body = execute("overview", () -> apiClient.overview(siteId, apiKey.getValue()));
        return overviewMapper.fromJson(body, siteZone());
    }

    /**
     * Energy series of the site. The API limits the period to one year with {@link TimeUnit#DAY}
     * and to one month with {@link TimeUnit#QUARTER_OF_AN_HOUR} or {@link TimeUnit#HOUR}, and
     * answers longer periods with an error.
     */
    public GeneratedEnergy energy(ApiKey apiKey, long siteId, DataPeriod period, TimeUnit timeUnit) {
        requireApiKey(apiKey);
        requireSiteId(siteId);
        requirePeriod(period);
        if (timeUnit == null) {
            throw new IllegalArgumentException("Time unit must be given");
        }
        log.debug("Getting energy of site {} for {} - {} with unit {}",
                siteId, period.getStartDate(), period.getEndDate(), timeUnit);
        String body = execute("energy", () -> apiClient.energy(siteId, apiKey.getValue(),
                period.formattedStartDate(), period.formattedEndDate(), timeUnit.toParameter()));
        return energyMapper.fromJson(body, siteZone());
    }

    /**
     * Total energy produced in the period.
     */
    public TimeFrameEnergy energyForPeriod(ApiKey apiKey, long siteId, DataPeriod period) {
        requireApiKey(apiKey);
        requireSiteId(siteId);
        requirePeriod(period);
        log.debug("Getting total energy of site {} for {} - {}", siteId, period.getStartDate(), period.getEndDate());
        String body = execute("energyForPeriod", () -> apiClient.timeFrameEnergy(siteId, apiKey.getValue(),
                period.formattedStartDate(), period.formattedEndDate()));
        return energyMapper.timeFrameFromJson(body, siteZone());
    }

    /**
     * Power series of the site in 15 minute resolution. The API limits the window to one month.
     *
     * @param startTime inclusive start, site local time
     * @param endTime   end, site local time, not before {@code startTime}
     */
    public GeneratedPower power(ApiKey apiKey, long siteId, LocalDateTime startTime, LocalDateTime endTime) {
        requireApiKey(apiKey);
        requireSiteId(siteId);
        if (startTime == null || endTime == null) {
            throw new IllegalArgumentException("Power window needs both a start and an end time");
        }
        if (startTime.isAfter(endTime)) {
            throw new IllegalArgumentException(
                    String.format("Power window start %s is after its end %s", startTime, endTime));
        }
        log.debug("Getting power of site {} for {} - {}", siteId, startTime, endTime);
        String body = execute("power", () -> apiClient.power(siteId, apiKey.getValue(),
                SiteTimestamps.format(startTime), SiteTimestamps.format(endTime)));
        return powerMapper.fromJson(body, siteZone());
    }

    private String execute(String operation, Supplier<Response> call) {
        Response response = send(operation, call);
        try (response) {
            String body = readBody(response);
            int status = response.status();
            if (log.isTraceEnabled()) {
                log.trace("Reply {} from {}", status, ApiKey.maskInUrl(response.request().url()));
                log.trace("Reply body: {}", body);
            }
            if (status < 200 || status >= 300) {
                String message = jsonReader.readErrorMessage(body)
                        .orElseGet(() -> body.isBlank() ? Objects.toString(response.reason(), "") : body);
                log.warn("SolarEdge API call {} rejected: Status={}, Message={}", operation, status, message);
                throw new ApiException(status, message);
            }
            return body;
        } catch (IOException e) {
            log.error("Failed to read SolarEdge reply body of {}: {}", operation, e.getMessage(), e);
            throw new TransportException("Could not read reply of SolarEdge API call " + operation, e);
        }
    }

    private Response send(String operation, Supplier<Response> call) {
        try {
            return call.get();
        } catch (FeignException e) {
            log.error("SolarEdge API call {} failed (Feign): {}", operation, e.getMessage(), e);
            throw new TransportException("Could not retrieve data from SolarEdge Monitoring API during " + operation, e);
        }
    }

    private static String readBody(Response response) throws IOException {
        if (response.body() == null) {
            return "";
        }
        try (Reader reader = response.body().asReader(StandardCharsets.UTF_8)) {
            return Util.toString(reader);
        }
    }

    private ZoneId siteZone() {
        return properties.getClient().resolveSiteTimeZone();
    }

    private static void requireApiKey(ApiKey apiKey) {
        if (apiKey == null) {
            throw new IllegalArgumentException("API key must be given");
        }
    }

    private static void requireSiteId(long siteId) {
        if (siteId <= 0) {
            throw new IllegalArgumentException("Site id must be positive, got " + siteId);
        }
    }

    private static void requirePeriod(DataPeriod period) {
        if (period == null) {
            throw new IllegalArgumentException("Data period must be given");
        }
    }
}
