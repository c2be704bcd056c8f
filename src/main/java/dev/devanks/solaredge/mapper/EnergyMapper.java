// src/main/java/dev/devanks/solaredge/mapper/EnergyMapper.java
package dev.devanks.solaredge.mapper;

import dev.devanks.solaredge.domain.EnergyReading;
import dev.devanks.solaredge.domain.GeneratedEnergy;
import dev.devanks.solaredge.domain.TimeFrameEnergy;
import dev.devanks.solaredge.domain.TimeUnit;
import dev.devanks.solaredge.exception.ResponseParseException;
import dev.devanks.solaredge.measurement.EnergyUnit;
import dev.devanks.solaredge.measurement.Measurements;
import dev.devanks.solaredge.measurement.SiteTimestamps;
import dev.devanks.solaredge.model.EnergyResponse;
import dev.devanks.solaredge.model.SeriesResponse;
import dev.devanks.solaredge.model.TimeFrameEnergyResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static dev.devanks.solaredge.mapper.MapperSupport.field;
import static dev.devanks.solaredge.mapper.MapperSupport.optionalText;
import static dev.devanks.solaredge.mapper.MapperSupport.require;

@Component
@RequiredArgsConstructor
public class EnergyMapper {

    private final SolarEdgeJsonReader jsonReader;

    /**
     * Maps the body of {@code /site/{siteId}/energy}. The reply names the unit of all its values
     * once, in {@code energy.unit}.
     */
    public GeneratedEnergy fromJson(String body, ZoneId zone) {
        EnergyResponse response = jsonReader.read(body, EnergyResponse.class);
        SeriesResponse series = require(response.getEnergy(), "energy");
        EnergyUnit unit = Measurements.energyUnit("energy.unit", series.getUnit());
        List<SeriesResponse.DataPoint> points = require(series.getValues(), "energy.values");

        List<EnergyReading> readings = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            String path = "energy.values[" + i + "]";
            SeriesResponse.DataPoint point = require(points.get(i), path);
            readings.add(new EnergyReading(
                    SiteTimestamps.dateTime(field(path, "date"), point.getDate(), zone),
                    Measurements.optionalEnergy(field(path, "value"), point.getValue(), unit)));
        }

        return GeneratedEnergy.builder()
                .timeUnit(timeUnit("energy.timeUnit", series.getTimeUnit()))
                .unit(unit)
                .measuredBy(optionalText(series.getMeasuredBy()))
                .values(List.copyOf(readings))
                .build();
    }

    /**
     * Maps the body of {@code /site/{siteId}/timeFrameEnergy}.
     */
    public TimeFrameEnergy timeFrameFromJson(String body, ZoneId zone) {
        TimeFrameEnergyResponse response = jsonReader.read(body, TimeFrameEnergyResponse.class);
        TimeFrameEnergyResponse.Payload payload = require(response.getTimeFrameEnergy(), "timeFrameEnergy");
        EnergyUnit unit = Measurements.energyUnit("timeFrameEnergy.unit", payload.getUnit());

        return TimeFrameEnergy.builder()
                .energy(Measurements.energy("timeFrameEnergy.energy", payload.getEnergy(), unit))
                .measuredBy(optionalText(payload.getMeasuredBy()))
                .startLifetimeEnergy(Optional.ofNullable(payload.getStartLifetimeEnergy())
                        .map(raw -> toLifetimeEnergy(raw, "timeFrameEnergy.startLifetimeEnergy", unit, zone)))
                .endLifetimeEnergy(Optional.ofNullable(payload.getEndLifetimeEnergy())
                        .map(raw -> toLifetimeEnergy(raw, "timeFrameEnergy.endLifetimeEnergy", unit, zone)))
                .build();
    }

    private static TimeFrameEnergy.LifetimeEnergy toLifetimeEnergy(TimeFrameEnergyResponse.LifetimeEnergy raw, String path,
                                                                   EnergyUnit fallbackUnit, ZoneId zone) {
        EnergyUnit unit = raw.getUnit() == null ? fallbackUnit : Measurements.energyUnit(field(path, "unit"), raw.getUnit());
        return new TimeFrameEnergy.LifetimeEnergy(
                SiteTimestamps.dateTime(field(path, "date"), raw.getDate(), zone),
                Measurements.energy(field(path, "energy"), raw.getEnergy(), unit));
    }

    static TimeUnit timeUnit(String field, String raw) {
        require(raw, field);
        return TimeUnit.fromParameter(raw)
                .orElseThrow(() -> new ResponseParseException(field, "unknown time unit '" + raw + "'"));
    }
}
