package uk.gegc.codejudge.features.contest.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.codejudge.features.user.domain.model.User;

import java.time.Instant;
import java.util.UUID;

/**
 * Standing of one user in one contest. {@code rank} is a cached projection refreshed after
 * every scoring submission, null until the first ranking pass.
 */
@Entity
@Getter
@Setter
@Table(name = "contest_participants",
        uniqueConstraints = @UniqueConstraint(name = "uk_participant_contest_user", columnNames = {"contest_id", "user_id"}),
        indexes = @Index(name = "idx_participants_contest_rank", columnList = "contest_id, contest_rank"))
public class ContestParticipant {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "contest_id", nullable = false, updatable = false)
    private Contest contest;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private User user;

    // copied from the registration, used as a tie-break
    @Column(name = "registered_at", nullable = false, updatable = false)
    private Instant registeredAt;

    @Column(name = "total_score", nullable = false)
    private int totalScore;

    @Column(name = "problems_solved", nullable = false)
    private int problemsSolved;

    @Column(name = "total_time", nullable = false)
    private int totalTime;

    @Column(name = "penalty_time", nullable = false)
    private int penaltyTime;

    @Column(name = "contest_rank")
    private Integer rank;

    @Column(name = "last_submission_at")
    private Instant lastSubmissionAt;

    public void recordSolve(int points, int penaltyMinutes) {
        this.problemsSolved++;
        this.totalScore += points;
        this.penaltyTime += penaltyMinutes;
    }
}
