// src/main/java/dev/devanks/solaredge/model/SiteResponse.java
package dev.devanks.solaredge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One site as it appears on the wire, shared by the list and details replies.
 * Numbers are boxed so that an absent field stays distinguishable from zero.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SiteResponse {

    @JsonProperty("id")
    private Long id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("accountId")
    private Long accountId;

    @JsonProperty("status")
    private String status;

    @JsonProperty("peakPower")
    private Double peakPower; // kW

    @JsonProperty("lastUpdateTime")
    private String lastUpdateTime; // yyyy-MM-dd

    @JsonProperty("installationDate")
    private String installationDate;

    @JsonProperty("ptoDate")
    private String ptoDate;

    @JsonProperty("notes")
    private String notes;

    @JsonProperty("type")
    private String type;

    @JsonProperty("location")
    private LocationResponse location;

    @JsonProperty("primaryModule")
    private PrimaryModuleResponse primaryModule;

    @JsonProperty("uris")
    private Map<String, String> uris;

    @JsonProperty("publicSettings")
    private PublicSettingsResponse publicSettings;

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LocationResponse {
        @JsonProperty("country")
        private String country;
        @JsonProperty("state")
        private String state;
        @JsonProperty("city")
        private String city;
        @JsonProperty("address")
        private String address;
        @JsonProperty("address2")
        private String address2;
        @JsonProperty("zip")
        private String zip;
        @JsonProperty("timeZone")
        private String timeZone;
        @JsonProperty("countryCode")
        private String countryCode;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrimaryModuleResponse {
        @JsonProperty("manufacturerName")
        private String manufacturerName;
        @JsonProperty("modelName")
        private String modelName;
        @JsonProperty("maximumPower")
        private Double maximumPower; // kW
        @JsonProperty("temperatureCoef")
        private Double temperatureCoef;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PublicSettingsResponse {
        @JsonProperty("isPublic")
        private Boolean publicSite;
    }
}
