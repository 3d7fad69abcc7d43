package uk.gegc.codejudge.features.submission.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.codejudge.features.sandbox.domain.model.Verdict;
import uk.gegc.codejudge.features.submission.domain.model.Submission;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SubmissionRepository extends JpaRepository<Submission, UUID> {

    @Query("""
            SELECT s
            FROM Submission s
            JOIN FETCH s.user
            JOIN FETCH s.problem
            WHERE s.id = :id
            """)
    Optional<Submission> findByIdWithUserAndProblem(@Param("id") UUID id);

    @EntityGraph(attributePaths = "problem")
    Page<Submission> findByUser_Id(UUID userId, Pageable pageable);

    @Query("""
            SELECT s.verdict AS verdict, COUNT(s) AS total
            FROM Submission s
            WHERE s.user.id = :userId
            GROUP BY s.verdict
            """)
    List<VerdictCountProjection> countByVerdictForUser(@Param("userId") UUID userId);

    /**
     * Whether the user already had another submission for the problem accepted within
     * {@code [from, to)}. Used to count a problem as solved at most once per day.
     */
    @Query("""
            SELECT COUNT(s) > 0
            FROM Submission s
            WHERE s.user.id = :userId
              AND s.problem.id = :problemId
              AND s.verdict = :verdict
              AND s.submittedAt >= :from
              AND s.submittedAt < :to
              AND s.id <> :excludedId
            """)
    boolean existsOtherWithVerdictBetween(@Param("userId") UUID userId,
                                          @Param("problemId") UUID problemId,
                                          @Param("verdict") Verdict verdict,
                                          @Param("from") Instant from,
                                          @Param("to") Instant to,
                                          @Param("excludedId") UUID excludedId);
}
