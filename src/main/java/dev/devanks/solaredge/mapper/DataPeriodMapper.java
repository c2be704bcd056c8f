package dev.devanks.solaredge.mapper;

import dev.devanks.solaredge.domain.DataPeriod;
import dev.devanks.solaredge.exception.ResponseParseException;
import dev.devanks.solaredge.measurement.SiteTimestamps;
import dev.devanks.solaredge.model.DataPeriodResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

import static dev.devanks.solaredge.mapper.MapperSupport.require;

@Component
@RequiredArgsConstructor
public class DataPeriodMapper {

    private final SolarEdgeJsonReader jsonReader;

    public DataPeriod fromJson(String body) {
        DataPeriodResponse response = jsonReader.read(body, DataPeriodResponse.class);
        DataPeriodResponse.Period period = require(response.getDataPeriod(), "dataPeriod");

        LocalDate start = SiteTimestamps.date("dataPeriod.startDate", period.getStartDate());
        LocalDate end = SiteTimestamps.date("dataPeriod.endDate", period.getEndDate());
        if (start.isAfter(end)) {
            throw new ResponseParseException("dataPeriod.endDate", "end date " + end + " is before start date " + start);
        }
        return DataPeriod.of(start, end);
    }
}
