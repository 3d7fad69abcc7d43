package uk.gegc.codejudge.features.contest.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.codejudge.features.problem.domain.model.Difficulty;

import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "contest_problems", indexes = @Index(name = "idx_contest_problems_order", columnList = "contest_id, sort_order"))
public class ContestProblem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "contest_id", nullable = false, updatable = false)
    private Contest contest;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(name = "difficulty", nullable = false, length = 10)
    private Difficulty difficulty = Difficulty.MEDIUM;

    @Column(name = "points", nullable = false)
    private int points = 100;

    @Column(name = "time_limit_ms", nullable = false)
    private int timeLimitMs = 2000;

    @Column(name = "memory_limit_mb", nullable = false)
    private int memoryLimitMb = 256;

    @Column(name = "sort_order", nullable = false)
    private int sortOrder;

    @Column(name = "total_submissions", nullable = false)
    private long totalSubmissions;

    @Column(name = "accepted_submissions", nullable = false)
    private long acceptedSubmissions;

    @Column(name = "total_solved", nullable = false)
    private long totalSolved;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;
}
