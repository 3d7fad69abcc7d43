package uk.gegc.codejudge.features.problem.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "problems")
public class Problem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "slug", nullable = false, unique = true, length = 200)
    private String slug;

    @Enumerated(EnumType.STRING)
    @Column(name = "difficulty", nullable = false, length = 10)
    private Difficulty difficulty = Difficulty.MEDIUM;

    @Column(name = "time_limit_ms", nullable = false)
    private int timeLimitMs = 2000;

    @Column(name = "memory_limit_mb", nullable = false)
    private int memoryLimitMb = 256;

    // Counters are only ever changed through ProblemRepository's atomic increments
    @Column(name = "total_submissions", nullable = false)
    private long totalSubmissions;

    @Column(name = "accepted_submissions", nullable = false)
    private long acceptedSubmissions;

    @Column(name = "total_solved", nullable = false)
    private long totalSolved;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public double getAcceptanceRate() {
        if (totalSubmissions == 0) {
            return 0.0;
        }
        return Math.round((double) acceptedSubmissions / totalSubmissions * 10000.0) / 100.0;
    }
}
