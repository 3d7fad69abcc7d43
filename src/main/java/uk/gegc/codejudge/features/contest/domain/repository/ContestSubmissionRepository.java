package uk.gegc.codejudge.features.contest.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.codejudge.features.contest.domain.model.ContestSubmission;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContestSubmissionRepository extends JpaRepository<ContestSubmission, UUID> {

    @EntityGraph(attributePaths = "problem")
    Page<ContestSubmission> findByContest_IdAndUser_Id(UUID contestId, UUID userId, Pageable pageable);

    @Query("""
            SELECT s
            FROM ContestSubmission s
            JOIN FETCH s.user
            JOIN FETCH s.problem
            JOIN FETCH s.contest
            WHERE s.id = :id
            """)
    Optional<ContestSubmission> findByIdWithDetails(@Param("id") UUID id);
}
