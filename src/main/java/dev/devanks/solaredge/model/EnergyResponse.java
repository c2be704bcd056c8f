package dev.devanks.solaredge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

// GET /site/{siteId}/energy
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EnergyResponse {

    @JsonProperty("energy")
    private SeriesResponse energy;
}
