package uk.gegc.codejudge.features.contest.application;

import uk.gegc.codejudge.features.contest.api.dto.ContestDashboardDto;
import uk.gegc.codejudge.features.contest.api.dto.ContestRegistrationDto;
import uk.gegc.codejudge.features.contest.api.dto.DetailedLeaderboardEntryDto;
import uk.gegc.codejudge.features.contest.api.dto.LeaderboardEntryDto;

import java.util.List;

public interface ContestService {

    /**
     * Registration is open while the contest has not started and is below its participant cap.
     */
    ContestRegistrationDto register(String username, String contestSlug);

    void unregister(String username, String contestSlug);

    List<LeaderboardEntryDto> getLeaderboard(String contestSlug);

    List<DetailedLeaderboardEntryDto> getDetailedLeaderboard(String contestSlug);

    ContestDashboardDto getDashboard(String username, String contestSlug);
}
