// src/main/java/dev/devanks/solaredge/config/AppConfig.java
package dev.devanks.solaredge.config;

import dev.devanks.solaredge.schedule.UpdateScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@Slf4j
public class AppConfig {

    @Bean
    public UpdateScheduler updateScheduler(SolarEdgeProperties properties) {
        var schedule = properties.getSchedule();
        log.info("Initializing UpdateScheduler (refresh interval {}, grace margin {}).",
                schedule.getRefreshInterval(), schedule.getGraceMargin());
        return new UpdateScheduler(schedule.getRefreshInterval(), schedule.getGraceMargin());
    }

    @Bean
    public Clock clock(SolarEdgeProperties properties) {
        return Clock.system(properties.getClient().resolveSiteTimeZone());
    }
}
