package uk.gegc.codejudge.features.activity.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.codejudge.features.activity.domain.model.UserActivity;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
public interface UserActivityRepository extends JpaRepository<UserActivity, UUID> {

    boolean existsByUser_IdAndActivityDate(UUID userId, LocalDate activityDate);

    List<UserActivity> findByUser_IdAndActivityDateBetweenOrderByActivityDateAsc(UUID userId, LocalDate from, LocalDate to);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE UserActivity a
            SET a.submissionsCount = a.submissionsCount + 1,
                a.problemsSolved = a.problemsSolved + :solvedDelta
            WHERE a.user.id = :userId AND a.activityDate = :activityDate
            """)
    int incrementCounters(@Param("userId") UUID userId,
                          @Param("activityDate") LocalDate activityDate,
                          @Param("solvedDelta") int solvedDelta);

    @Query("""
            SELECT a.activityDate
            FROM UserActivity a
            WHERE a.user.id = :userId
              AND a.problemsSolved > 0
              AND a.activityDate <= :upTo
            ORDER BY a.activityDate DESC
            """)
    List<LocalDate> findSolvedDays(@Param("userId") UUID userId, @Param("upTo") LocalDate upTo);
}
