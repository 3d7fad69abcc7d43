package uk.gegc.codejudge.features.contest.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.codejudge.features.contest.domain.model.ContestParticipant;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContestParticipantRepository extends JpaRepository<ContestParticipant, UUID> {

    Optional<ContestParticipant> findByContest_IdAndUser_Id(UUID contestId, UUID userId);

    List<ContestParticipant> findByContest_Id(UUID contestId);

    @Query("""
            SELECT p
            FROM ContestParticipant p
            JOIN FETCH p.user
            WHERE p.contest.id = :contestId
            ORDER BY CASE WHEN p.rank IS NULL THEN 1 ELSE 0 END, p.rank ASC, p.registeredAt ASC
            """)
    List<ContestParticipant> findLeaderboard(@Param("contestId") UUID contestId);
}
