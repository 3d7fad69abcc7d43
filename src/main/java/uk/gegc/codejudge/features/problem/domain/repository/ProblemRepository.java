package uk.gegc.codejudge.features.problem.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.codejudge.features.problem.domain.model.Problem;

import java.util.Optional;
import java.util.UUID;

/**
 * Counter updates are issued as single UPDATE statements so concurrent judging passes
 * never lose an increment.
 */
@Repository
public interface ProblemRepository extends JpaRepository<Problem, UUID> {

    Optional<Problem> findBySlugAndActiveTrue(String slug);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE Problem p SET p.totalSubmissions = p.totalSubmissions + 1 WHERE p.id = :id")
    int incrementTotalSubmissions(@Param("id") UUID id);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE Problem p SET p.acceptedSubmissions = p.acceptedSubmissions + 1 WHERE p.id = :id")
    int incrementAcceptedSubmissions(@Param("id") UUID id);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE Problem p SET p.totalSolved = p.totalSolved + 1 WHERE p.id = :id")
    int incrementTotalSolved(@Param("id") UUID id);
}
