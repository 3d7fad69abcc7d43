package uk.gegc.codejudge.features.user.domain.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.codejudge.features.user.domain.model.User;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserRepository extends JpaRepository<User, UUID> {

    Optional<User> findByUsername(String username);

    /**
     * Load a user with a pessimistic write lock.
     * Serializes concurrent solve-status updates for the same user so first-solve
     * detection increments the aggregates exactly once.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM User u WHERE u.id = :id")
    Optional<User> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
            SELECT u
            FROM User u
            WHERE u.totalSolved > 0
            ORDER BY u.totalSolved DESC, u.username ASC
            """)
    List<User> findTopSolvers(Pageable pageable);
}
