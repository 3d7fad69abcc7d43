package uk.gegc.codejudge.features.contest.domain.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.codejudge.features.contest.domain.model.Contest;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContestRepository extends JpaRepository<Contest, UUID> {

    Optional<Contest> findBySlugAndActiveTrue(String slug);

    /**
     * Load a contest with a pessimistic write lock.
     * Every write to a contest's participants and ranks happens while holding this lock,
     * so scoring and re-ranking passes of one contest run one after another.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Contest c WHERE c.id = :id")
    Optional<Contest> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Slug lookup that takes the row lock on the first read, so the returned state
     * (participant count in particular) is the committed one.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Contest c WHERE c.slug = :slug AND c.active = true")
    Optional<Contest> findActiveBySlugForUpdate(@Param("slug") String slug);
}
