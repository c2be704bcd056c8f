package dev.devanks.solaredge.mapper;

import dev.devanks.solaredge.domain.GeneratedPower;
import dev.devanks.solaredge.domain.PowerReading;
import dev.devanks.solaredge.measurement.Measurements;
import dev.devanks.solaredge.measurement.PowerUnit;
import dev.devanks.solaredge.measurement.SiteTimestamps;
import dev.devanks.solaredge.model.PowerResponse;
import dev.devanks.solaredge.model.SeriesResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import static dev.devanks.solaredge.mapper.MapperSupport.field;
import static dev.devanks.solaredge.mapper.MapperSupport.optionalText;
import static dev.devanks.solaredge.mapper.MapperSupport.require;

@Component
@RequiredArgsConstructor
public class PowerMapper {

    private final SolarEdgeJsonReader jsonReader;

    /**
     * Maps the body of {@code /site/{siteId}/power}.
     */
    public GeneratedPower fromJson(String body, ZoneId zone) {
        PowerResponse response = jsonReader.read(body, PowerResponse.class);
        SeriesResponse series = require(response.getPower(), "power");
        PowerUnit unit = Measurements.powerUnit("power.unit", series.getUnit());
        List<SeriesResponse.DataPoint> points = require(series.getValues(), "power.values");

        List<PowerReading> readings = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            String path = "power.values[" + i + "]";
            SeriesResponse.DataPoint point = require(points.get(i), path);
            readings.add(new PowerReading(
                    SiteTimestamps.dateTime(field(path, "date"), point.getDate(), zone),
                    Measurements.optionalPower(field(path, "value"), point.getValue(), unit)));
        }

        return GeneratedPower.builder()
                .timeUnit(EnergyMapper.timeUnit("power.timeUnit", series.getTimeUnit()))
                .unit(unit)
                .measuredBy(optionalText(series.getMeasuredBy()))
                .values(List.copyOf(readings))
                .build();
    }
}
