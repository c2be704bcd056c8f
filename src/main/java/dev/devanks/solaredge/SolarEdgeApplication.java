// src/main/java/dev/devanks/solaredge/SolarEdgeApplication.java
package dev.devanks.solaredge;

import dev.devanks.solaredge.config.SolarEdgeProperties;
import dev.devanks.solaredge.service.SiteReportService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Bean;

import java.util.function.Supplier;

@SpringBootApplication
@EnableFeignClients
@Slf4j
public class SolarEdgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(SolarEdgeApplication.class, args);
    }

    /**
     * Report of the site configured under {@code solaredge.report}, built on every call.
     * Registered in the Spring Cloud Function catalog under its bean name.
     *
     * @param siteReportService builds the report (auto-injected by Spring).
     * @return A Supplier returning the report, or a short failure message.
     */
    @Bean
    public Supplier<String> siteReportFunction(SiteReportService siteReportService) {
        return () -> {
            try {
                return siteReportService.buildConfiguredReport();
            } catch (Exception e) {
                // Details are logged by the service; the caller gets the reason.
                log.debug("Site report failed", e);
                return "Report failed: " + e.getMessage();
            }
        };
    }

    /**
     * Prints the site report once at startup when {@code solaredge.report} names a site.
     */
    @Bean
    public ApplicationRunner siteReportRunner(Supplier<String> siteReportFunction, SolarEdgeProperties properties) {
        return args -> {
            var report = properties.getReport();
            if (!report.isRunOnStartup() || !report.isConfigured()) {
                log.info("No site report at startup (set solaredge.report.api-key and solaredge.report.site-id).");
                return;
            }
            log.info("Site report:{}{}", System.lineSeparator(), siteReportFunction.get());
        };
    }
}
