// src/main/java/dev/devanks/solaredge/domain/Overview.java
package dev.devanks.solaredge.domain;

import dev.devanks.solaredge.measurement.Energy;
import dev.devanks.solaredge.measurement.Power;
import dev.devanks.solaredge.schedule.NextUpdateEstimate;
import dev.devanks.solaredge.schedule.UpdateScheduler;
import lombok.Builder;
import lombok.Value;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Snapshot of a site: current power, energy produced today, this month, this year and since installation.
 */
@Value
@Builder
public class Overview {

    ZonedDateTime lastUpdateTime;
    TimeData lifeTimeData;
    TimeData lastYearData;
    TimeData lastMonthData;
    TimeData lastDayData;
    Power currentPower;

    @Builder.Default
    Optional<String> measuredBy = Optional.empty();

    public Energy getLifeTimeEnergy() {
        return lifeTimeData.getEnergy();
    }

    /**
     * Estimates when the next measurement will be published, based on {@link #getLastUpdateTime()}
     * and the default 15 minute interval plus 10 second grace margin.
     * The returned duration is negative when that moment has already passed.
     */
    public NextUpdateEstimate estimatedNextUpdate() {
        return estimatedNextUpdate(UpdateScheduler.DEFAULT, Clock.system(lastUpdateTime.getZone()));
    }

    public NextUpdateEstimate estimatedNextUpdate(UpdateScheduler scheduler, Clock clock) {
        return scheduler.estimateNextUpdate(lastUpdateTime, clock);
    }
}
