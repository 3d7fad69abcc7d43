package uk.gegc.codejudge.features.contest.domain.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Contest")
class ContestTest {

    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");
    private static final Instant END = Instant.parse("2024-03-01T12:00:00Z");

    private Contest contest;

    @BeforeEach
    void setUp() {
        contest = new Contest();
        contest.setStartTime(START);
        contest.setEndTime(END);
    }

    @Test
    @DisplayName("window bounds are inclusive")
    void windowBoundsInclusive() {
        assertThat(contest.isRunningAt(START)).isTrue();
        assertThat(contest.isRunningAt(END)).isTrue();
        assertThat(contest.isRunningAt(START.minusMillis(1))).isFalse();
        assertThat(contest.isRunningAt(END.plusMillis(1))).isFalse();
    }

    @Test
    @DisplayName("status follows the window")
    void statusAt() {
        assertThat(contest.statusAt(START.minusSeconds(1))).isEqualTo(ContestStatus.NOT_STARTED);
        assertThat(contest.statusAt(START.plusSeconds(1))).isEqualTo(ContestStatus.ACTIVE);
        assertThat(contest.statusAt(END.plusSeconds(1))).isEqualTo(ContestStatus.ENDED);
    }

    @Test
    @DisplayName("minutes since start are whole minutes and never negative")
    void minutesSinceStart() {
        assertThat(contest.minutesSinceStart(START.minusSeconds(600))).isZero();
        assertThat(contest.minutesSinceStart(START.plusSeconds(59))).isZero();
        assertThat(contest.minutesSinceStart(START.plusSeconds(61 * 60 + 30))).isEqualTo(61);
    }

    @Test
    @DisplayName("registration closes at the start and when the cap is reached")
    void registrationWindow() {
        contest.setMaxParticipants(2);
        contest.setTotalParticipants(1);
        assertThat(contest.isRegistrationOpenAt(START.minusSeconds(1))).isTrue();
        assertThat(contest.isRegistrationOpenAt(START)).isFalse();

        contest.setTotalParticipants(2);
        assertThat(contest.isRegistrationOpenAt(START.minusSeconds(1))).isFalse();
    }
}
