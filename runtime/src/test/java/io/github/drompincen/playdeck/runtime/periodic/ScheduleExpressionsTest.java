package io.github.drompincen.playdeck.runtime.periodic;

import io.github.drompincen.playdeck.protocol.api.PeriodicTaskType;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleExpressionsTest {

    private static final Instant FROM = Instant.parse("2024-05-10T10:15:30Z");

    @Test
    void intervalAddsSeconds() {
        assertThat(ScheduleExpressions.next(PeriodicTaskType.DELTA, "90", FROM))
                .isEqualTo(Instant.parse("2024-05-10T10:17:00Z"));
    }

    @Test
    void intervalMustBePositiveNumber() {
        assertThatThrownBy(() -> ScheduleExpressions.validate(PeriodicTaskType.DELTA, "0"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
        assertThatThrownBy(() -> ScheduleExpressions.validate(PeriodicTaskType.DELTA, "ten"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("number of seconds");
    }

    @Test
    void intervalBeyondHundredYearsIsRejected() {
        assertThatThrownBy(() -> ScheduleExpressions.validate(PeriodicTaskType.DELTA, "9223372036854775807"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must not exceed");
        ScheduleExpressions.validate(PeriodicTaskType.DELTA, String.valueOf(ScheduleExpressions.MAX_INTERVAL_SECONDS));
    }

    @Test
    void fiveFieldCrontabFiresOnTheMinute() {
        assertThat(ScheduleExpressions.next(PeriodicTaskType.CRONTAB, "*/15 * * * *", FROM))
                .isEqualTo(Instant.parse("2024-05-10T10:30:00Z"));
    }

    @Test
    void sixFieldCrontabIsAccepted() {
        assertThat(ScheduleExpressions.next(PeriodicTaskType.CRONTAB, "0 0 3 * * MON-FRI", FROM))
                .isEqualTo(Instant.parse("2024-05-13T03:00:00Z"));
    }

    @Test
    void crontabIsEvaluatedInUtc() {
        assertThat(ScheduleExpressions.next(PeriodicTaskType.CRONTAB, "0 2 * * *", FROM))
                .isEqualTo(Instant.parse("2024-05-11T02:00:00Z"));
    }

    @Test
    void invalidCrontabIsRejected() {
        assertThatThrownBy(() -> ScheduleExpressions.validate(PeriodicTaskType.CRONTAB, "every day"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid crontab schedule");
    }
}
