package uk.gegc.codejudge.features.contest.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.codejudge.features.problem.domain.model.SolveStatus;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "contest_problem_status",
        uniqueConstraints = @UniqueConstraint(name = "uk_contest_status_participant_problem", columnNames = {"participant_id", "contest_problem_id"}))
public class ContestProblemStatus {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "participant_id", nullable = false, updatable = false)
    private ContestParticipant participant;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "contest_problem_id", nullable = false, updatable = false)
    private ContestProblem contestProblem;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private SolveStatus status = SolveStatus.ATTEMPTED;

    @Column(name = "score", nullable = false)
    private int score;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    // non-accepted submissions before the first acceptance
    @Column(name = "wrong_attempts", nullable = false)
    private int wrongAttempts;

    @Column(name = "solve_time")
    private Integer solveTime;

    @Column(name = "first_solved_at")
    private Instant firstSolvedAt;

    public boolean isSolved() {
        return status == SolveStatus.SOLVED;
    }

    /**
     * @param minutesSinceStart whole minutes between the contest start and the acceptance
     * @return false when the problem was already solved and nothing changed
     */
    public boolean markSolved(int points, int minutesSinceStart, Instant at) {
        if (isSolved()) {
            return false;
        }
        this.status = SolveStatus.SOLVED;
        this.score = points;
        this.solveTime = minutesSinceStart;
        this.firstSolvedAt = at;
        return true;
    }

    public void recordWrongAttempt() {
        if (!isSolved()) {
            this.wrongAttempts++;
        }
    }
}
