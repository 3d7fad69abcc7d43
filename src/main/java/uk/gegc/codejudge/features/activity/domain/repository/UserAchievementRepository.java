package uk.gegc.codejudge.features.activity.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.codejudge.features.activity.domain.model.AchievementType;
import uk.gegc.codejudge.features.activity.domain.model.UserAchievement;

import java.util.List;
import java.util.UUID;

@Repository
public interface UserAchievementRepository extends JpaRepository<UserAchievement, UUID> {

    boolean existsByUser_IdAndType(UUID userId, AchievementType type);

    List<UserAchievement> findByUser_IdOrderByEarnedAtAsc(UUID userId);
}
