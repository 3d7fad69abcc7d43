package uk.gegc.codejudge.features.contest.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.codejudge.features.sandbox.domain.model.Language;
import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;
import uk.gegc.codejudge.features.submission.domain.judging.JudgingReport;
import uk.gegc.codejudge.features.user.domain.model.User;

import java.time.Instant;
import java.util.UUID;

/**
 * A submission made during a contest. Only aggregate counters are kept, no per-case rows.
 */
@Entity
@Getter
@Setter
@Table(name = "contest_submissions", indexes = {
        @Index(name = "idx_contest_submissions_contest_user", columnList = "contest_id, user_id, submitted_at"),
        @Index(name = "idx_contest_submissions_problem", columnList = "contest_id, contest_problem_id")
})
public class ContestSubmission {

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

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "contest_problem_id", nullable = false, updatable = false)
    private ContestProblem problem;

    @Column(name = "code", columnDefinition = "MEDIUMTEXT", nullable = false, updatable = false)
    private String code;

    @Enumerated(EnumType.STRING)
    @Column(name = "language", nullable = false, length = 20, updatable = false)
    private Language language;

    @Enumerated(EnumType.STRING)
    @Column(name = "verdict", nullable = false, length = 30)
    private Verdict verdict = Verdict.PENDING;

    @Column(name = "test_cases_passed", nullable = false)
    private int testCasesPassed;

    @Column(name = "total_test_cases", nullable = false)
    private int totalTestCases;

    @Column(name = "execution_time_ms")
    private Integer executionTimeMs;

    @Column(name = "memory_used_kb")
    private Integer memoryUsedKb;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "compilation_output", columnDefinition = "TEXT")
    private String compilationOutput;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private Instant submittedAt;

    @Column(name = "judged_at")
    private Instant judgedAt;

    public boolean isAccepted() {
        return verdict == Verdict.ACCEPTED;
    }

    public void applyReport(JudgingReport report, Instant at) {
        if (verdict != Verdict.RUNNING) {
            throw new IllegalStateException("Contest submission " + id + " is not being judged (verdict " + verdict + ")");
        }
        this.verdict = report.verdict();
        this.testCasesPassed = report.passedCases();
        this.totalTestCases = report.totalCases();
        this.executionTimeMs = report.maxTimeMs();
        this.memoryUsedKb = report.maxMemoryKb();
        this.errorMessage = report.errorMessage();
        this.compilationOutput = report.compileOutput();
        this.judgedAt = at;
    }
}
