package uk.gegc.codejudge.features.submission.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.codejudge.features.problem.domain.model.TestCase;

import java.util.UUID;

/**
 * Outcome of one test case within a practice submission. Created PENDING and completed once.
 */
@Entity
@Getter
@Setter
@Table(name = "test_case_results",
        uniqueConstraints = @UniqueConstraint(name = "uk_result_submission_case", columnNames = {"submission_id", "test_case_id"}))
public class TestCaseResult {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "submission_id", nullable = false, updatable = false)
    private Submission submission;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "test_case_id", nullable = false, updatable = false)
    private TestCase testCase;

    /**
     * Zero-based execution order within the submission.
     */
    @Column(name = "execution_index", nullable = false)
    private int executionIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private TestCaseStatus status = TestCaseStatus.PENDING;

    @Column(name = "actual_output", columnDefinition = "MEDIUMTEXT")
    private String actualOutput;

    @Column(name = "execution_time_ms")
    private Integer executionTimeMs;

    @Column(name = "memory_used_kb")
    private Integer memoryUsedKb;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    public static TestCaseResult pending(TestCase testCase, int executionIndex) {
        TestCaseResult result = new TestCaseResult();
        result.setTestCase(testCase);
        result.setExecutionIndex(executionIndex);
        return result;
    }

    public void complete(TestCaseStatus finalStatus, String actualOutput, Integer executionTimeMs,
                         Integer memoryUsedKb, String errorMessage) {
        if (this.status != TestCaseStatus.PENDING) {
            throw new IllegalStateException("Test case result already completed with " + this.status);
        }
        if (finalStatus == TestCaseStatus.PENDING) {
            throw new IllegalArgumentException("A completed test case result needs a terminal status");
        }
        this.status = finalStatus;
        this.actualOutput = actualOutput;
        this.executionTimeMs = executionTimeMs;
        this.memoryUsedKb = memoryUsedKb;
        this.errorMessage = errorMessage;
    }
}
