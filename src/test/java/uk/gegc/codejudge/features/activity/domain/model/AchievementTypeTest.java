package uk.gegc.codejudge.features.activity.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AchievementType")
class AchievementTypeTest {

    @Test
    @DisplayName("milestones are reached at or above the threshold")
    void reachedAtOrAboveThreshold() {
        assertThat(AchievementType.FIRST_SOLVE.isReached(0, 0)).isFalse();
        assertThat(AchievementType.FIRST_SOLVE.isReached(1, 0)).isTrue();
        assertThat(AchievementType.SOLVE_10.isReached(11, 0)).isTrue();
        assertThat(AchievementType.SOLVE_50.isReached(49, 100)).isFalse();
    }

    @Test
    @DisplayName("streak achievements only look at the streak")
    void streakKind() {
        assertThat(AchievementType.SOLVE_STREAK_7.isReached(500, 6)).isFalse();
        assertThat(AchievementType.SOLVE_STREAK_7.isReached(0, 7)).isTrue();
        assertThat(AchievementType.SOLVE_STREAK_30.getKind()).isEqualTo(AchievementType.Kind.STREAK);
    }
}
