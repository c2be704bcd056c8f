// src/main/java/dev/devanks/solaredge/mapper/OverviewMapper.java
package dev.devanks.solaredge.mapper;

import dev.devanks.solaredge.domain.Overview;
import dev.devanks.solaredge.domain.TimeData;
import dev.devanks.solaredge.measurement.Measurements;
import dev.devanks.solaredge.measurement.SiteTimestamps;
import dev.devanks.solaredge.model.OverviewResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.ZoneId;
import java.util.Optional;

import static dev.devanks.solaredge.mapper.MapperSupport.field;
import static dev.devanks.solaredge.mapper.MapperSupport.optionalText;
import static dev.devanks.solaredge.mapper.MapperSupport.require;
import static dev.devanks.solaredge.measurement.EnergyUnit.WATT_HOUR;
import static dev.devanks.solaredge.measurement.PowerUnit.WATT;

@Component
@RequiredArgsConstructor
public class OverviewMapper {

    private static final String ROOT = "overview";

    private final SolarEdgeJsonReader jsonReader;

    /**
     * Maps the body of {@code /site/{siteId}/overview}. Energies are in Wh and the current power in W.
     *
     * @param zone time zone of the site, used to place {@code lastUpdateTime} on the timeline
     */
    public Overview fromJson(String body, ZoneId zone) {
        OverviewResponse response = jsonReader.read(body, OverviewResponse.class);
        OverviewResponse.Payload overview = require(response.getOverview(), ROOT);
        OverviewResponse.CurrentPower currentPower = require(overview.getCurrentPower(), field(ROOT, "currentPower"));

        return Overview.builder()
                .lastUpdateTime(SiteTimestamps.dateTime(field(ROOT, "lastUpdateTime"), overview.getLastUpdateTime(), zone))
                .lifeTimeData(toTimeData(overview.getLifeTimeData(), field(ROOT, "lifeTimeData")))
                .lastYearData(toTimeData(overview.getLastYearData(), field(ROOT, "lastYearData")))
                .lastMonthData(toTimeData(overview.getLastMonthData(), field(ROOT, "lastMonthData")))
                .lastDayData(toTimeData(overview.getLastDayData(), field(ROOT, "lastDayData")))
                .currentPower(Measurements.power(field(ROOT, "currentPower.power"), currentPower.getPower(), WATT))
                .measuredBy(optionalText(overview.getMeasuredBy()))
                .build();
    }

    private static TimeData toTimeData(OverviewResponse.TimeDataResponse raw, String path) {
        require(raw, path);
        return TimeData.builder()
                .energy(Measurements.energy(field(path, "energy"), raw.getEnergy(), WATT_HOUR))
                .revenue(Optional.ofNullable(raw.getRevenue()).map(BigDecimal::valueOf))
                .build();
    }
}
