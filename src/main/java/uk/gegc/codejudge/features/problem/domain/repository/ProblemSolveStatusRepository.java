package uk.gegc.codejudge.features.problem.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.codejudge.features.problem.domain.model.ProblemSolveStatus;
import uk.gegc.codejudge.features.problem.domain.model.SolveStatus;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProblemSolveStatusRepository extends JpaRepository<ProblemSolveStatus, UUID> {

    Optional<ProblemSolveStatus> findByUser_IdAndProblem_Id(UUID userId, UUID problemId);

    long countByUser_IdAndStatus(UUID userId, SolveStatus status);
}
