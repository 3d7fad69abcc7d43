package uk.gegc.codejudge.features.activity.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.codejudge.features.user.domain.model.User;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "user_achievements",
        uniqueConstraints = @UniqueConstraint(name = "uk_achievement_user_type", columnNames = {"user_id", "achievement_type"}))
public class UserAchievement {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private User user;

    @Enumerated(EnumType.STRING)
    @Column(name = "achievement_type", nullable = false, length = 30, updatable = false)
    private AchievementType type;

    @Column(name = "earned_at", nullable = false, updatable = false)
    private Instant earnedAt;
}
