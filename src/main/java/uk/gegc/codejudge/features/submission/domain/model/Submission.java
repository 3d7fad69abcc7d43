package uk.gegc.codejudge.features.submission.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.codejudge.features.problem.domain.model.Problem;
import uk.gegc.codejudge.features.sandbox.domain.model.Language;
import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;
import uk.gegc.codejudge.features.submission.domain.judging.JudgingReport;
import uk.gegc.codejudge.features.user.domain.model.User;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "submissions", indexes = {
        @Index(name = "idx_submissions_user_submitted", columnList = "user_id, submitted_at"),
        @Index(name = "idx_submissions_user_problem_verdict", columnList = "user_id, problem_id, verdict")
})
public class Submission {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private User user;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "problem_id", nullable = false, updatable = false)
    private Problem problem;

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

    @OneToMany(mappedBy = "submission", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("executionIndex ASC")
    private List<TestCaseResult> testCaseResults = new ArrayList<>();

    public boolean isAccepted() {
        return verdict == Verdict.ACCEPTED;
    }

    public void addTestCaseResult(TestCaseResult result) {
        result.setSubmission(this);
        testCaseResults.add(result);
    }

    /**
     * Copies the outcome of the judging pass onto this submission. Allowed once, while RUNNING.
     */
    public void applyReport(JudgingReport report, Instant at) {
        if (verdict != Verdict.RUNNING) {
            throw new IllegalStateException("Submission " + id + " is not being judged (verdict " + verdict + ")");
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
