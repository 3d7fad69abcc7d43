package uk.gegc.codejudge.features.contest.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.codejudge.features.contest.domain.model.ContestRegistration;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContestRegistrationRepository extends JpaRepository<ContestRegistration, UUID> {

    Optional<ContestRegistration> findByContest_IdAndUser_Id(UUID contestId, UUID userId);

    boolean existsByContest_IdAndUser_Id(UUID contestId, UUID userId);
}
