package uk.gegc.codejudge.features.problem.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.codejudge.features.user.domain.model.User;

import java.time.Instant;
import java.util.UUID;

/**
 * Practice-mode progress of one user on one problem.
 */
@Entity
@Getter
@Setter
@Table(name = "problem_solve_status",
        uniqueConstraints = @UniqueConstraint(name = "uk_solve_status_user_problem", columnNames = {"user_id", "problem_id"}))
public class ProblemSolveStatus {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "problem_id", nullable = false)
    private Problem problem;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private SolveStatus status = SolveStatus.ATTEMPTED;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "first_solved_at")
    private Instant firstSolvedAt;

    @Column(name = "last_attempted_at")
    private Instant lastAttemptedAt;

    public boolean isSolved() {
        return status == SolveStatus.SOLVED;
    }

    /**
     * Transitions to SOLVED on the first acceptance only.
     *
     * @return true when this call performed the transition
     */
    public boolean markSolved(Instant at) {
        if (isSolved()) {
            return false;
        }
        this.status = SolveStatus.SOLVED;
        this.firstSolvedAt = at;
        return true;
    }
}
