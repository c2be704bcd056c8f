package dev.devanks.solaredge.schedule;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("UpdateScheduler Unit Tests")
class UpdateSchedulerTest {

    private static final ZoneId ZONE = ZoneId.of("Europe/Amsterdam");
    private static final ZonedDateTime LAST_READING = ZonedDateTime.of(2023, 11, 9, 10, 28, 56, 0, ZONE);

    private final UpdateScheduler scheduler = UpdateScheduler.DEFAULT;

    @Test
    @DisplayName("estimateNextUpdate - exactly 15m10s after the reading is due now")
    void estimate_ExactlyDue() {
        ZonedDateTime now = LAST_READING.plusMinutes(15).plusSeconds(10);

        NextUpdateEstimate estimate = scheduler.estimateNextUpdate(LAST_READING, now);

        assertThat(estimate.getNextUpdate()).isEqualTo(now);
        assertThat(estimate.getDurationFromNow()).isEqualTo(Duration.ZERO);
        assertThat(estimate.isDue()).isTrue();
    }

    @Test
    @DisplayName("estimateNextUpdate - 16 minutes after the reading is 50 seconds overdue")
    void estimate_Overdue() {
        ZonedDateTime now = LAST_READING.plusMinutes(16);

        NextUpdateEstimate estimate = scheduler.estimateNextUpdate(LAST_READING, now);

        assertThat(estimate.getNextUpdate()).isEqualTo(ZonedDateTime.of(2023, 11, 9, 10, 44, 6, 0, ZONE));
        assertThat(estimate.getDurationFromNow()).isEqualTo(Duration.ofSeconds(-50));
        assertThat(estimate.waitTime()).isEqualTo(Duration.ZERO);
        assertThat(estimate.isDue()).isTrue();
    }

    @Test
    @DisplayName("estimateNextUpdate - right after the reading the full interval is left")
    void estimate_JustRead() {
        NextUpdateEstimate estimate = scheduler.estimateNextUpdate(LAST_READING, LAST_READING);

        assertThat(estimate.getDurationFromNow()).isEqualTo(Duration.ofMinutes(15).plusSeconds(10));
        assertThat(estimate.waitTime()).isEqualTo(estimate.getDurationFromNow());
        assertThat(estimate.isDue()).isFalse();
    }

    @Test
    @DisplayName("estimateNextUpdate - clock overload reads now from the clock")
    void estimate_FromClock() {
        Clock clock = Clock.fixed(LAST_READING.plusMinutes(5).toInstant(), ZONE);

        NextUpdateEstimate estimate = scheduler.estimateNextUpdate(LAST_READING, clock);

        assertThat(estimate.getDurationFromNow()).isEqualTo(Duration.ofMinutes(10).plusSeconds(10));
    }

    @Test
    @DisplayName("estimateNextUpdate - durations are compared on the timeline, not the wall clock")
    void estimate_AcrossZones() {
        ZonedDateTime nowInUtc = LAST_READING.plusMinutes(16).withZoneSameInstant(ZoneId.of("UTC"));

        NextUpdateEstimate estimate = scheduler.estimateNextUpdate(LAST_READING, nowInUtc);

        assertThat(estimate.getDurationFromNow()).isEqualTo(Duration.ofSeconds(-50));
    }

    @Test
    @DisplayName("custom interval and margin replace the defaults")
    void customSchedule() {
        UpdateScheduler fiveMinutes = new UpdateScheduler(Duration.ofMinutes(5), Duration.ZERO);

        NextUpdateEstimate estimate = fiveMinutes.estimateNextUpdate(LAST_READING, LAST_READING);

        assertThat(estimate.getNextUpdate()).isEqualTo(LAST_READING.plusMinutes(5));
        assertThat(UpdateScheduler.DEFAULT.getRefreshInterval()).isEqualTo(Duration.ofMinutes(15));
        assertThat(UpdateScheduler.DEFAULT.getGraceMargin()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("negative interval or margin is rejected")
    void rejectsNegativeDurations() {
        assertThatThrownBy(() -> new UpdateScheduler(Duration.ofMinutes(-1), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("refreshInterval");
        assertThatThrownBy(() -> new UpdateScheduler(Duration.ofMinutes(15), Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("graceMargin");
    }
}
