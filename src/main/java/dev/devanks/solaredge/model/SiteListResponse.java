package dev.devanks.solaredge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

// GET /sites/list
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SiteListResponse {

    @JsonProperty("sites")
    private Sites sites;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Sites {
        @JsonProperty("count")
        private Integer count;

        @JsonProperty("site")
        private List<SiteResponse> site;
    }
}
