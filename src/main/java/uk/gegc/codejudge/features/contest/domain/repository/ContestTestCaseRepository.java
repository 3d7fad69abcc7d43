package uk.gegc.codejudge.features.contest.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.codejudge.features.contest.domain.model.ContestTestCase;

import java.util.List;
import java.util.UUID;

@Repository
public interface ContestTestCaseRepository extends JpaRepository<ContestTestCase, UUID> {

    List<ContestTestCase> findByContestProblem_IdAndActiveTrueOrderBySortOrderAsc(UUID contestProblemId);
}
