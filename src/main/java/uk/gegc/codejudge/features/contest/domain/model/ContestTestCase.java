package uk.gegc.codejudge.features.contest.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.codejudge.features.problem.domain.model.TestCaseType;

import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "contest_test_cases", indexes = @Index(name = "idx_contest_test_cases_order", columnList = "contest_problem_id, sort_order"))
public class ContestTestCase {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "contest_problem_id", nullable = false)
    private ContestProblem contestProblem;

    @Enumerated(EnumType.STRING)
    @Column(name = "test_type", nullable = false, length = 10)
    private TestCaseType type = TestCaseType.HIDDEN;

    @Column(name = "input_data", columnDefinition = "MEDIUMTEXT", nullable = false)
    private String inputData;

    @Column(name = "expected_output", columnDefinition = "MEDIUMTEXT", nullable = false)
    private String expectedOutput;

    @Column(name = "sort_order", nullable = false)
    private int sortOrder;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;
}
