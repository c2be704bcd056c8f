// src/main/java/dev/devanks/solaredge/domain/Site.java
package dev.devanks.solaredge.domain;

import dev.devanks.solaredge.measurement.Power;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * Descriptive data of one installation, as returned by the site list and site details endpoints.
 */
@Value
@Builder
public class Site {

    long id;
    String name;
    String status;
    Power peakPower;

    @Builder.Default
    Optional<Long> accountId = Optional.empty();
    @Builder.Default
    Optional<LocalDate> lastUpdateTime = Optional.empty();
    @Builder.Default
    Optional<LocalDate> installationDate = Optional.empty();
    // permission to operate
    @Builder.Default
    Optional<LocalDate> ptoDate = Optional.empty();
    @Builder.Default
    String notes = "";
    @Builder.Default
    Optional<String> type = Optional.empty();
    @Builder.Default
    Optional<Location> location = Optional.empty();
    @Builder.Default
    Optional<PrimaryModule> primaryModule = Optional.empty();
    @Builder.Default
    Map<String, String> uris = Map.of();
    // empty when the reply has no publicSettings
    @Builder.Default
    Optional<Boolean> publicSite = Optional.empty();
}
