package uk.gegc.codejudge.features.activity.application;

import uk.gegc.codejudge.features.activity.api.dto.AchievementDto;
import uk.gegc.codejudge.features.activity.api.dto.StreakDto;

import java.util.List;

public interface ActivityService {

    StreakDto getMyStreak(String username, int days);

    List<AchievementDto> getMyAchievements(String username);
}
