package uk.gegc.codejudge.features.contest.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.codejudge.features.contest.domain.model.ContestProblemStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContestProblemStatusRepository extends JpaRepository<ContestProblemStatus, UUID> {

    Optional<ContestProblemStatus> findByParticipant_IdAndContestProblem_Id(UUID participantId, UUID contestProblemId);

    List<ContestProblemStatus> findByParticipant_Id(UUID participantId);

    @Query("""
            SELECT s
            FROM ContestProblemStatus s
            JOIN FETCH s.contestProblem
            WHERE s.participant.contest.id = :contestId
            """)
    List<ContestProblemStatus> findAllForContest(@Param("contestId") UUID contestId);
}
