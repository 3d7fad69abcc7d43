package uk.gegc.codejudge.features.problem.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.codejudge.features.problem.domain.model.TestCase;
import uk.gegc.codejudge.features.problem.domain.model.TestCaseType;

import java.util.List;
import java.util.UUID;

@Repository
public interface TestCaseRepository extends JpaRepository<TestCase, UUID> {

    List<TestCase> findByProblem_IdAndActiveTrueOrderBySortOrderAsc(UUID problemId);

    List<TestCase> findByProblem_IdAndTypeAndActiveTrueOrderBySortOrderAsc(UUID problemId, TestCaseType type);
}
