package uk.gegc.codejudge.features.problem.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "test_cases", indexes = @Index(name = "idx_test_cases_problem_order", columnList = "problem_id, sort_order"))
public class TestCase {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "problem_id", nullable = false)
    private Problem problem;

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
