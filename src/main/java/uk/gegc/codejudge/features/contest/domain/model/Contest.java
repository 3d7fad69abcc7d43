package uk.gegc.codejudge.features.contest.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "contests", indexes = @Index(name = "idx_contests_start_time", columnList = "start_time"))
public class Contest {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "slug", nullable = false, unique = true, length = 200)
    private String slug;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "scoring_type", nullable = false, length = 10)
    private ScoringType scoringType = ScoringType.STANDARD;

    @Column(name = "max_participants")
    private Integer maxParticipants;

    @Column(name = "total_participants", nullable = false)
    private int totalParticipants;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public ContestStatus statusAt(Instant now) {
        if (now.isBefore(startTime)) {
            return ContestStatus.NOT_STARTED;
        }
        if (now.isAfter(endTime)) {
            return ContestStatus.ENDED;
        }
        return ContestStatus.ACTIVE;
    }

    /**
     * Both window bounds are inclusive.
     */
    public boolean isRunningAt(Instant now) {
        return statusAt(now) == ContestStatus.ACTIVE;
    }

    public boolean isRegistrationOpenAt(Instant now) {
        return active
                && statusAt(now) == ContestStatus.NOT_STARTED
                && (maxParticipants == null || totalParticipants < maxParticipants);
    }

    /**
     * Whole minutes elapsed since the start, never negative.
     */
    public int minutesSinceStart(Instant now) {
        if (now.isBefore(startTime)) {
            return 0;
        }
        return (int) Duration.between(startTime, now).toMinutes();
    }
}
