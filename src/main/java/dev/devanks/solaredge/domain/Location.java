package dev.devanks.solaredge.domain;

import lombok.Builder;
import lombok.Value;

import java.time.ZoneId;
import java.util.Optional;

@Value
@Builder
public class Location {

    @Builder.Default
    Optional<String> country = Optional.empty();
    @Builder.Default
    Optional<String> state = Optional.empty();
    @Builder.Default
    Optional<String> city = Optional.empty();
    @Builder.Default
    Optional<String> address = Optional.empty();
    @Builder.Default
    Optional<String> address2 = Optional.empty();
    @Builder.Default
    Optional<String> zip = Optional.empty();
    @Builder.Default
    Optional<ZoneId> timeZone = Optional.empty();
    @Builder.Default
    Optional<String> countryCode = Optional.empty();
}
