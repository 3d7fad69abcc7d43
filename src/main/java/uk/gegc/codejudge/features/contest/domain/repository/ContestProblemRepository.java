package uk.gegc.codejudge.features.contest.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.codejudge.features.contest.domain.model.ContestProblem;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContestProblemRepository extends JpaRepository<ContestProblem, UUID> {

    Optional<ContestProblem> findByIdAndContest_IdAndActiveTrue(UUID id, UUID contestId);

    List<ContestProblem> findByContest_IdAndActiveTrueOrderBySortOrderAsc(UUID contestId);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE ContestProblem p SET p.totalSubmissions = p.totalSubmissions + 1 WHERE p.id = :id")
    int incrementTotalSubmissions(@Param("id") UUID id);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE ContestProblem p SET p.acceptedSubmissions = p.acceptedSubmissions + 1 WHERE p.id = :id")
    int incrementAcceptedSubmissions(@Param("id") UUID id);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE ContestProblem p SET p.totalSolved = p.totalSolved + 1 WHERE p.id = :id")
    int incrementTotalSolved(@Param("id") UUID id);
}
