// src/main/java/dev/devanks/solaredge/client/SolarEdgeApiClient.java
package dev.devanks.solaredge.client;

import dev.devanks.solaredge.config.SolarEdgeApiClientConfig;
import feign.Response;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * Feign client for the read-only endpoints of the SolarEdge Monitoring API.
 * <p>
 * Methods return the raw {@link Response} so that status code and body reach
 * {@link dev.devanks.solaredge.service.SolarEdgeService} untouched; Feign does not decode or
 * classify errors here. The key is sent as the {@code api_key} query parameter on every call.
 * Transport settings (timeouts, logging, no retries) come from {@link SolarEdgeApiClientConfig}.
 */
@FeignClient(name = "solaredge-api",
        url = "${solaredge.client.url}",
        configuration = SolarEdgeApiClientConfig.class)
public interface SolarEdgeApiClient {

    String API_KEY = "api_key";

    @GetMapping("/sites/list")
    Response listSites(@RequestParam(API_KEY) String apiKey);

    @GetMapping("/site/{siteId}/details")
    Response siteDetails(@PathVariable("siteId") long siteId,
                         @RequestParam(API_KEY) String apiKey);

    @GetMapping("/site/{siteId}/dataPeriod")
    Response dataPeriod(@PathVariable("siteId") long siteId,
                        @RequestParam(API_KEY) String apiKey);

    @GetMapping("/site/{siteId}/overview")
    Response overview(@PathVariable("siteId") long siteId,
                      @RequestParam(API_KEY) String apiKey);

    // dates as yyyy-MM-dd
    @GetMapping("/site/{siteId}/energy")
    Response energy(@PathVariable("siteId") long siteId,
                    @RequestParam(API_KEY) String apiKey,
                    @RequestParam("startDate") String startDate,
                    @RequestParam("endDate") String endDate,
                    @RequestParam("timeUnit") String timeUnit);

    @GetMapping("/site/{siteId}/timeFrameEnergy")
    Response timeFrameEnergy(@PathVariable("siteId") long siteId,
                             @RequestParam(API_KEY) String apiKey,
                             @RequestParam("startDate") String startDate,
                             @RequestParam("endDate") String endDate);

    // times as yyyy-MM-dd HH:mm:ss, site local
    @GetMapping("/site/{siteId}/power")
    Response power(@PathVariable("siteId") long siteId,
                   @RequestParam(API_KEY) String apiKey,
                   @RequestParam("startTime") String startTime,
                   @RequestParam("endTime") String endTime);
}
