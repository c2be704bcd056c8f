package dev.devanks.solaredge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body shared by the energy and power series replies.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SeriesResponse {

    @JsonProperty("timeUnit")
    private String timeUnit;

    @JsonProperty("unit")
    private String unit;

    @JsonProperty("measuredBy")
    private String measuredBy;

    @JsonProperty("values")
    private List<DataPoint> values;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DataPoint {
        @JsonProperty("date")
        private String date;

        @JsonProperty("value")
        private Double value; // null when nothing was reported
    }
}
