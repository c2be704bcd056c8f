// src/main/java/dev/devanks/solaredge/config/SolarEdgeProperties.java
package dev.devanks.solaredge.config;

import feign.Logger;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.hibernate.validator.constraints.URL;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "solaredge")
public class SolarEdgeProperties {

    // Transport settings of the Feign client
    @Data
    @Validated
    public static class ClientProperties {
        @NotEmpty
        @URL
        private String url = "https://monitoringapi.solaredge.com";

        /**
         * Zone the API's site-local timestamps are read in. Empty means the JVM default zone.
         */
        private ZoneId siteTimeZone;

        /**
         * Feign wire logging, active only with the client logger at DEBUG. Any level other than
         * NONE prints request URLs including the api_key.
         */
        @NotNull
        private Logger.Level loggerLevel = Logger.Level.BASIC;

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(60);

        public ZoneId resolveSiteTimeZone() {
            return siteTimeZone != null ? siteTimeZone : ZoneId.systemDefault();
        }
    }

    // Advisory polling schedule, see UpdateScheduler
    @Data
    @Validated
    public static class ScheduleProperties {
        @NotNull
        private Duration refreshInterval = Duration.ofMinutes(15);

        @NotNull
        private Duration graceMargin = Duration.ofSeconds(10);
    }

    // Site polled by the siteReportFunction bean
    @Data
    @Validated
    public static class ReportProperties {
        private String apiKey;

        @Positive
        private Long siteId;

        /**
         * Run the report once when the application starts, if api key and site id are set.
         */
        private boolean runOnStartup = true;

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank() && siteId != null;
        }
    }

    @Valid
    @NotNull
    private ClientProperties client = new ClientProperties();

    @Valid
    @NotNull
    private ScheduleProperties schedule = new ScheduleProperties();

    @Valid
    @NotNull
    private ReportProperties report = new ReportProperties();
}
