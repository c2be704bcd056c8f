// src/main/java/dev/devanks/solaredge/domain/DataPeriod.java
package dev.devanks.solaredge.domain;

import dev.devanks.solaredge.measurement.SiteTimestamps;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDate;
import java.util.Objects;

/**
 * An inclusive range of dates. Returned by the data period endpoint (the dates a site has been
 * producing) and used as the query window of the energy endpoints.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DataPeriod {

    LocalDate startDate;
    LocalDate endDate;

    /**
     * @throws IllegalArgumentException when a date is missing or {@code startDate} is after {@code endDate}
     */
    public static DataPeriod of(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("Data period needs both a start and an end date");
        }
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException(
                    String.format("Data period start %s is after its end %s", startDate, endDate));
        }
        return new DataPeriod(startDate, endDate);
    }

    public static DataPeriod singleDay(LocalDate day) {
        return of(Objects.requireNonNull(day, "day"), day);
    }

    public String formattedStartDate() {
        return SiteTimestamps.format(startDate);
    }

    public String formattedEndDate() {
        return SiteTimestamps.format(endDate);
    }
}
