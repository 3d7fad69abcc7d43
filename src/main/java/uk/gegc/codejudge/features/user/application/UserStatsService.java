package uk.gegc.codejudge.features.user.application;

import uk.gegc.codejudge.features.user.api.dto.UserLeaderboardEntryDto;
import uk.gegc.codejudge.features.user.api.dto.UserSolveStatsDto;

import java.util.List;

public interface UserStatsService {

    List<UserLeaderboardEntryDto> getLeaderboard(int limit);

    UserSolveStatsDto getMyStats(String username);
}
