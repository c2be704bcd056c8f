// src/main/java/dev/devanks/solaredge/model/OverviewResponse.java
package dev.devanks.solaredge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

// GET /site/{siteId}/overview
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OverviewResponse {

    @JsonProperty("overview")
    private Payload overview;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Payload {
        @JsonProperty("lastUpdateTime")
        private String lastUpdateTime; // site local, yyyy-MM-dd HH:mm:ss

        @JsonProperty("lifeTimeData")
        private TimeDataResponse lifeTimeData;

        @JsonProperty("lastYearData")
        private TimeDataResponse lastYearData;

        @JsonProperty("lastMonthData")
        private TimeDataResponse lastMonthData;

        @JsonProperty("lastDayData")
        private TimeDataResponse lastDayData;

        @JsonProperty("currentPower")
        private CurrentPower currentPower;

        @JsonProperty("measuredBy")
        private String measuredBy;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TimeDataResponse {
        @JsonProperty("energy")
        private Double energy; // Wh

        @JsonProperty("revenue")
        private Double revenue;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CurrentPower {
        @JsonProperty("power")
        private Double power; // W
    }
}
