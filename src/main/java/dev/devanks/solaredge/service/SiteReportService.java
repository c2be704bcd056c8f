// src/main/java/dev/devanks/solaredge/service/SiteReportService.java
package dev.devanks.solaredge.service;

import dev.devanks.solaredge.client.ApiKey;
import dev.devanks.solaredge.config.SolarEdgeProperties;
import dev.devanks.solaredge.domain.DataPeriod;
import dev.devanks.solaredge.domain.GeneratedEnergy;
import dev.devanks.solaredge.domain.GeneratedPower;
import dev.devanks.solaredge.domain.Overview;
import dev.devanks.solaredge.domain.Site;
import dev.devanks.solaredge.domain.TimeUnit;
import dev.devanks.solaredge.exception.SolarEdgeException;
import dev.devanks.solaredge.measurement.EnergyUnit;
import dev.devanks.solaredge.measurement.PowerUnit;
import dev.devanks.solaredge.schedule.NextUpdateEstimate;
import dev.devanks.solaredge.schedule.UpdateScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Walks every endpoint once for a single site and renders the results as a plain text report.
 * Handy to check an API key and site id, and an example of using {@link SolarEdgeService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SiteReportService {

    static final String NO_VALUE = "No value";

    private final SolarEdgeService solarEdgeService;
    private final SolarEdgeProperties properties;
    private final UpdateScheduler updateScheduler;
    private final Clock clock;

    /**
     * Builds the report for the site configured under {@code solaredge.report}.
     */
    public String buildConfiguredReport() {
        var report = properties.getReport();
        if (!report.isConfigured()) {
            log.error("solaredge.report.api-key and solaredge.report.site-id must both be set.");
            throw new IllegalStateException("Site report is not configured (solaredge.report.api-key / site-id).");
        }
        return buildReport(ApiKey.of(report.getApiKey()), report.getSiteId());
    }

    public String buildReport(ApiKey apiKey, long siteId) {
        log.info("Starting SolarEdge report for site {}.", siteId);
        Instant start = clock.instant();
        var lines = new StringJoiner(System.lineSeparator());

        try {
            lines.add("Sites of this account:");
            for (Site site : solarEdgeService.listSites(apiKey)) {
                lines.add(String.format("Id: %d\tName: %s", site.getId(), site.getName()));
            }

            Site details = solarEdgeService.siteDetails(apiKey, siteId);
            lines.add(String.format(Locale.ROOT, "Id = %d\tstatus: %s\tpeak power: %.2f kW",
                    details.getId(), details.getStatus(), details.getPeakPower().get(PowerUnit.KILOWATT)));

            DataPeriod dataPeriod = solarEdgeService.dataPeriod(apiKey, siteId);
            lines.add(String.format("Data available from %s until %s", dataPeriod.getStartDate(), dataPeriod.getEndDate()));

            Overview overview = solarEdgeService.overview(apiKey, siteId);
            lines.add(String.format(Locale.ROOT,
                    "Site generated %.2f MWh since installation and is currently generating %.2f W",
                    overview.getLifeTimeEnergy().get(EnergyUnit.MEGAWATT_HOUR),
                    overview.getCurrentPower().get(PowerUnit.WATT)));

            NextUpdateEstimate next = overview.estimatedNextUpdate(updateScheduler, clock);
            lines.add(String.format("Next update expected at %s (wait %d s)",
                    next.getNextUpdate(), next.waitTime().toSeconds()));

            LocalDateTime now = LocalDateTime.now(clock.withZone(overview.getLastUpdateTime().getZone()));
            GeneratedEnergy energy = solarEdgeService.energy(apiKey, siteId,
                    DataPeriod.singleDay(now.toLocalDate()), TimeUnit.HOUR);
            lines.add("Energy generation of today:");
            energy.getValues().forEach(reading -> lines.add(String.format("\t%s - %s",
                    reading.getDate().toLocalDateTime(),
                    reading.getValue()
                            .map(value -> String.format(Locale.ROOT, "%.1f Wh", value.get(EnergyUnit.WATT_HOUR)))
                            .orElse(NO_VALUE))));

            GeneratedPower power = solarEdgeService.power(apiKey, siteId, now.minusHours(1), now);
            lines.add("Power generation of the past hour:");
            power.getValues().forEach(reading -> lines.add(String.format("\t%s - %s",
                    reading.getDate().toLocalDateTime(),
                    reading.getValue()
                            .map(value -> String.format(Locale.ROOT, "%.1f W", value.get(PowerUnit.WATT)))
                            .orElse(NO_VALUE))));
        } catch (SolarEdgeException e) {
            log.error("SolarEdge report for site {} failed: {}", siteId, e.getMessage(), e);
            throw e;
        }

        log.info("SolarEdge report for site {} finished in {} ms.", siteId,
                ChronoUnit.MILLIS.between(start, clock.instant()));
        return lines.toString();
    }
}
