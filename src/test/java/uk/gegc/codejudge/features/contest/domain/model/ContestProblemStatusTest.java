package uk.gegc.codejudge.features.contest.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.codejudge.features.problem.domain.model.SolveStatus;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ContestProblemStatus")
class ContestProblemStatusTest {

    @Test
    @DisplayName("only the first acceptance marks the problem solved")
    void markSolved_onlyOnce() {
        ContestProblemStatus status = new ContestProblemStatus();
        Instant at = Instant.parse("2024-03-01T10:30:00Z");

        assertThat(status.markSolved(100, 30, at)).isTrue();
        assertThat(status.markSolved(100, 45, at.plusSeconds(900))).isFalse();

        assertThat(status.getStatus()).isEqualTo(SolveStatus.SOLVED);
        assertThat(status.getScore()).isEqualTo(100);
        assertThat(status.getSolveTime()).isEqualTo(30);
        assertThat(status.getFirstSolvedAt()).isEqualTo(at);
    }

    @Test
    @DisplayName("wrong attempts stop counting once solved")
    void wrongAttempts_frozenAfterSolve() {
        ContestProblemStatus status = new ContestProblemStatus();
        status.recordWrongAttempt();
        status.recordWrongAttempt();
        status.markSolved(100, 10, Instant.parse("2024-03-01T10:10:00Z"));
        status.recordWrongAttempt();

        assertThat(status.getWrongAttempts()).isEqualTo(2);
    }
}
