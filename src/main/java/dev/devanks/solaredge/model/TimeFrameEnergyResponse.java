package dev.devanks.solaredge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

// GET /site/{siteId}/timeFrameEnergy
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TimeFrameEnergyResponse {

    @JsonProperty("timeFrameEnergy")
    private Payload timeFrameEnergy;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Payload {
        @JsonProperty("energy")
        private Double energy;

        @JsonProperty("unit")
        private String unit;

        @JsonProperty("measuredBy")
        private String measuredBy;

        @JsonProperty("startLifetimeEnergy")
        private LifetimeEnergy startLifetimeEnergy;

        @JsonProperty("endLifetimeEnergy")
        private LifetimeEnergy endLifetimeEnergy;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LifetimeEnergy {
        @JsonProperty("date")
        private String date;

        @JsonProperty("energy")
        private Double energy;

        @JsonProperty("unit")
        private String unit;
    }
}
