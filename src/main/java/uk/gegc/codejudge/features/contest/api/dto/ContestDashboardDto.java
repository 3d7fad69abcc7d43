package uk.gegc.codejudge.features.contest.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.codejudge.features.contest.domain.model.ScoringType;

import java.util.List;

@Schema(name = "ContestDashboardDto", description = "The caller's view of a contest")
public record ContestDashboardDto(
        String contestSlug,
        String title,
        ScoringType scoringType,
        TimeInfoDto timeInfo,

        @Schema(description = "The caller's standing, null before their first submission")
        LeaderboardEntryDto standing,

        @Schema(description = "Progress on every active problem, including untouched ones")
        List<ProblemStatusDto> problems,

        @Schema(description = "The caller's latest submissions, newest first")
        List<ContestSubmissionDto> recentSubmissions
) {
}
